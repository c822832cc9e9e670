package io.jalali;

import io.jalali.arith.DateArithmetic;
import io.jalali.calendar.CalendarConverter;
import io.jalali.calendar.CalendarDate;
import io.jalali.calendar.CalendarKind;
import io.jalali.calendar.CycleLeapYearRule;
import io.jalali.calendar.LeapYearRule;
import io.jalali.display.Display;
import io.jalali.parser.DateTextParser;
import io.jalali.period.PeriodClassifier;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Jalali date functions, taking and returning date text.
 *
 * <p>Jalali text is written "YYYY/MM/DD" and Gregorian text "YYYY-MM-DD". Every function is
 * stateless and thread-safe; a rejected call throws a {@link JalaliException} whose {@link
 * ErrorKind} tells malformed text, invalid dates, invalid arguments and out-of-range results
 * apart.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * JalaliFunctions functions = JalaliFunctions.create();
 * String gregorian = functions.convertJalaliToGregorian("1403/05/29"); // "2024-08-19"
 * String due = functions.addMonths("1403/06/31", 6); // "1403/12/30"
 * String state = functions.periodState("1403/06/31", 31); // "End"
 * }</pre>
 */
public final class JalaliFunctions {
  private static final Logger LOG = LoggerFactory.getLogger(JalaliFunctions.class);

  private final CalendarConverter converter;
  private final DateArithmetic arithmetic;
  private final PeriodClassifier classifier;
  private final Clock clock;

  private JalaliFunctions(LeapYearRule rule, Clock clock) {
    this.converter = new CalendarConverter(rule);
    this.arithmetic = new DateArithmetic(converter);
    this.classifier = new PeriodClassifier(converter);
    this.clock = clock;
  }

  /**
   * Creates the functions with the 33-year leap cycle and the UTC system clock.
   *
   * @return the functions
   */
  public static JalaliFunctions create() {
    return create(CycleLeapYearRule.INSTANCE, Clock.systemUTC());
  }

  /**
   * Creates the functions with a custom leap year rule and clock.
   *
   * @param rule the Jalali leap year rule
   * @param clock the clock {@link #now()} reads; its zone decides the current date
   * @return the functions
   */
  public static JalaliFunctions create(LeapYearRule rule, Clock clock) {
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(clock, "clock");
    LOG.debug("Creating Jalali functions with leap rule {} and clock {}", rule, clock);
    return new JalaliFunctions(rule, clock);
  }

  /**
   * Converts a Jalali date text to Gregorian.
   *
   * @param date the Jalali date, e.g. "1403/05/29"
   * @return the Gregorian date, e.g. "2024-08-19"
   * @throws JalaliException if the text is malformed or not a valid Jalali date
   */
  public String convertJalaliToGregorian(String date) throws JalaliException {
    return call("convertJalaliToGregorian", () -> converter.toGregorian(jalali(date)).toString());
  }

  /**
   * Converts a Gregorian date text to Jalali.
   *
   * @param date the Gregorian date, e.g. "2024-08-19"
   * @return the Jalali date, e.g. "1403/05/29"
   * @throws JalaliException if the text is malformed or not a valid Gregorian date
   */
  public String convertGregorianToJalali(String date) throws JalaliException {
    return call("convertGregorianToJalali", () -> converter.toJalali(gregorian(date)).toString());
  }

  /**
   * Returns the signed number of days between two Jalali dates.
   *
   * @param start the start date
   * @param end the end date
   * @return the number of days, positive when end is after start
   * @throws JalaliException if either text is malformed or not a valid Jalali date
   */
  public int diffDays(String start, String end) throws JalaliException {
    return call("diffDays", () -> arithmetic.diffDays(jalali(start), jalali(end)));
  }

  /**
   * Returns the number of days between two Jalali dates plus an adjustment.
   *
   * <p>The adjustment is added to the absolute distance before the sign is applied, so with an
   * adjustment of 1 both bounds count: {@code diffDaysWithAdjustment("1403/01/01", "1403/01/10",
   * 1) == 10} and the reversed call gives -10.
   *
   * @param start the start date
   * @param end the end date
   * @param adjustment the days to add to the distance
   * @return the adjusted distance, negative when end is before start
   * @throws JalaliException if either text is malformed or not a valid Jalali date, or the result
   *     overflows
   */
  public int diffDaysWithAdjustment(String start, String end, int adjustment)
      throws JalaliException {
    return call(
        "diffDaysWithAdjustment",
        () -> arithmetic.diffDaysWithAdjustment(jalali(start), jalali(end), adjustment));
  }

  /**
   * Adds days to a Jalali date.
   *
   * @param date the Jalali date
   * @param days the days to add, may be negative
   * @return the resulting Jalali date
   * @throws JalaliException if the text is malformed or not a valid Jalali date, or the result
   *     is out of range
   */
  public String addDays(String date, int days) throws JalaliException {
    return call("addDays", () -> arithmetic.addDays(jalali(date), days).toString());
  }

  /**
   * Adds months to a Jalali date, clamping the day to the destination month.
   *
   * @param date the Jalali date
   * @param months the months to add, must be positive
   * @return the resulting Jalali date
   * @throws JalaliException if the text is malformed or not a valid Jalali date, months is not
   *     positive, or the result is out of range
   */
  public String addMonths(String date, int months) throws JalaliException {
    return call("addMonths", () -> arithmetic.addMonths(jalali(date), months).toString());
  }

  /**
   * Returns today's date in the Jalali calendar, as seen by the configured clock.
   *
   * @return the current Jalali date
   */
  public String now() {
    LocalDate today = LocalDate.now(clock);
    try {
      CalendarDate date =
          converter.date(
              today.getYear(),
              today.getMonthValue(),
              today.getDayOfMonth(),
              CalendarKind.GREGORIAN);
      return converter.toJalali(date).toString();
    } catch (JalaliException e) {
      // Only a clock set outside the supported span reaches this
      throw new IllegalStateException("clock date " + today + " is not supported", e);
    }
  }

  /**
   * Returns whether a Jalali date falls in a leap year.
   *
   * @param date the Jalali date
   * @return true if month 12 of the date's year has 30 days
   * @throws JalaliException if the text is malformed or not a valid Jalali date
   */
  public boolean isLeapYear(String date) throws JalaliException {
    return call("isLeapYear", () -> converter.isLeapYear(jalali(date)));
  }

  /**
   * Classifies a Jalali date within the recurring period ending on an anchor day.
   *
   * @param date the Jalali date
   * @param anchorDay the day of the month each period ends on
   * @return one of "Start", "Middle", "End" or "Unknown"
   * @throws JalaliException if the text is malformed or not a valid Jalali date
   */
  public String periodState(String date, int anchorDay) throws JalaliException {
    return call("periodState", () -> classifier.classify(jalali(date), anchorDay).toString());
  }

  /**
   * Parses and validates a date text.
   *
   * @param text the date text
   * @param kind the calendar the text is written in
   * @return the date
   * @throws JalaliException if the text is malformed or not a valid date
   */
  public CalendarDate parse(String text, CalendarKind kind) throws JalaliException {
    return converter.date(DateTextParser.parse(text, kind), kind);
  }

  /**
   * Renders a date as text in its own calendar's format.
   *
   * @param date the date
   * @return the date text
   */
  public String format(CalendarDate date) {
    return Display.render(date);
  }

  private CalendarDate jalali(String text) throws JalaliException {
    return parse(text, CalendarKind.JALALI);
  }

  private CalendarDate gregorian(String text) throws JalaliException {
    return parse(text, CalendarKind.GREGORIAN);
  }

  private static <T> T call(String function, Call<T> body) throws JalaliException {
    try {
      return body.run();
    } catch (JalaliException e) {
      LOG.debug("{} rejected [{}]: {}", function, e.kind(), e.getMessage());
      throw e;
    }
  }

  /** A function body that may reject its arguments. */
  @FunctionalInterface
  private interface Call<T> {
    T run() throws JalaliException;
  }
}
