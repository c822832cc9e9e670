package io.jalali.calendar;

import io.jalali.JalaliException;
import io.jalali.display.Display;
import io.jalali.parser.RawDate;
import java.time.LocalDate;
import java.time.Year;
import java.util.Objects;

/**
 * Builds validated {@link CalendarDate} values and converts them between calendars.
 *
 * <h2>Day count</h2>
 *
 * <p>Both calendars map to the {@code java.time} epoch day (days since 1970-01-01). Gregorian
 * dates use {@link LocalDate#toEpochDay()}. A Jalali date is counted from the first day of its
 * year (Nowruz):
 *
 * <pre>
 * nowruz(y) = nowruz(1404) + 365 * (y - 1404) + leapYearsBetween(1404, y)
 * </pre>
 *
 * <p>where nowruz(1404) is 2025-03-21 and the leap count comes from the configured {@link
 * LeapYearRule}.
 *
 * <h2>Supported span</h2>
 *
 * <p>Dates from Jalali {@value #MIN_YEAR}/01/01 through the last day of Jalali {@value #MAX_YEAR}
 * are supported. Gregorian dates are bounded by the same span of days, so conversion between the
 * calendars never leaves it.
 */
public final class CalendarConverter {
  /** First supported Jalali year. */
  public static final int MIN_YEAR = -999_999;

  /** Last supported Jalali year. */
  public static final int MAX_YEAR = 999_999;

  /** Gregorian years beyond this distance from the Jalali bounds are rejected outright. */
  private static final int GREGORIAN_YEAR_MARGIN = 1_000;

  /** Reference year for the Jalali day count. */
  private static final int ANCHOR_YEAR = 1404;

  /** Epoch day of 1404/01/01, which is 2025-03-21. */
  private static final long ANCHOR_NOWRUZ = LocalDate.of(2025, 3, 21).toEpochDay();

  /** Days in one 33-year cycle of the arithmetic calendar, used to estimate a year. */
  private static final long CYCLE_DAYS = 365L * CycleLeapYearRule.CYCLE_YEARS + 8;

  private final LeapYearRule rule;
  private final long minEpochDay;
  private final long maxEpochDay;

  /**
   * Creates a converter using the given Jalali leap year rule.
   *
   * @param rule the leap year rule
   */
  public CalendarConverter(LeapYearRule rule) {
    this.rule = Objects.requireNonNull(rule, "rule");
    this.minEpochDay = nowruz(MIN_YEAR);
    this.maxEpochDay = nowruz(MAX_YEAR + 1) - 1;
  }

  /**
   * Returns the Jalali leap year rule.
   *
   * @return the rule
   */
  public LeapYearRule rule() {
    return rule;
  }

  /**
   * Creates a validated date.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of the month
   * @param kind the calendar
   * @return the date
   * @throws JalaliException if the components do not name a supported day of the calendar
   */
  public CalendarDate date(int year, int month, int day, CalendarKind kind)
      throws JalaliException {
    return validate(year, month, day, kind, Display.render(year, month, day, kind));
  }

  /**
   * Creates a validated date from parsed date text.
   *
   * @param raw the parsed fields
   * @param kind the calendar the text was written in
   * @return the date
   * @throws JalaliException if the fields do not name a supported day of the calendar
   */
  public CalendarDate date(RawDate raw, CalendarKind kind) throws JalaliException {
    return validate(raw.year(), raw.month(), raw.day(), kind, raw.text());
  }

  private CalendarDate validate(int year, int month, int day, CalendarKind kind, String text)
      throws JalaliException {
    if (month < 1 || month > 12) {
      throw JalaliException.invalidDate(
          "invalid " + kind + " date: month " + month + " is not in 1..12", text);
    }
    if (!supportsYear(year, kind)) {
      throw JalaliException.invalidDate(
          "invalid " + kind + " date: year " + year + " is outside the supported range", text);
    }
    int length = lengthOfMonth(year, month, kind);
    if (day < 1 || day > length) {
      throw JalaliException.invalidDate(
          "invalid "
              + kind
              + " date: day "
              + day
              + " is not in 1.."
              + length
              + " for month "
              + month
              + " of "
              + year,
          text);
    }
    if (!supports(year, month, day, kind)) {
      throw JalaliException.invalidDate(
          "invalid " + kind + " date: outside the supported range", text);
    }
    return new CalendarDate(year, month, day, kind);
  }

  /**
   * Returns whether a year can hold supported dates of the given calendar.
   *
   * <p>For Gregorian years near the bounds only part of the year is supported; see {@link
   * #supports(int, int, int, CalendarKind)}.
   *
   * @param year the year
   * @param kind the calendar
   * @return false if the year lies entirely outside the supported span
   */
  public boolean supportsYear(long year, CalendarKind kind) {
    return switch (kind) {
      case JALALI -> year >= MIN_YEAR && year <= MAX_YEAR;
      case GREGORIAN ->
          year >= MIN_YEAR - GREGORIAN_YEAR_MARGIN && year <= MAX_YEAR + GREGORIAN_YEAR_MARGIN;
    };
  }

  /**
   * Returns whether a year is a leap year in the given calendar.
   *
   * @param year the year
   * @param kind the calendar
   * @return true for a leap year
   */
  public boolean isLeapYear(int year, CalendarKind kind) {
    return switch (kind) {
      case JALALI -> rule.isLeapYear(year);
      case GREGORIAN -> Year.isLeap(year);
    };
  }

  /**
   * Returns whether a date falls in a leap year of its own calendar.
   *
   * @param date the date
   * @return true for a leap year
   */
  public boolean isLeapYear(CalendarDate date) {
    return isLeapYear(date.year(), date.kind());
  }

  /**
   * Returns the number of days in a month.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param kind the calendar
   * @return the length of the month in days
   */
  public int lengthOfMonth(int year, int month, CalendarKind kind) {
    return kind.lengthOfMonth(month, isLeapYear(year, kind));
  }

  /**
   * Returns whether a date is the last day of its month.
   *
   * @param date the date
   * @return true on the last day of the month
   */
  public boolean isLastDayOfMonth(CalendarDate date) {
    return date.day() == lengthOfMonth(date.year(), date.month(), date.kind());
  }

  /**
   * Returns whether a day named by valid calendar fields lies in the supported span.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day, within the month's length
   * @param kind the calendar
   * @return true if the day can be represented
   */
  public boolean supports(int year, int month, int day, CalendarKind kind) {
    if (!supportsYear(year, kind)) {
      return false;
    }
    return kind == CalendarKind.JALALI || supports(LocalDate.of(year, month, day).toEpochDay());
  }

  /**
   * Returns whether an epoch day lies in the supported span.
   *
   * @param epochDay days since 1970-01-01
   * @return true if the day can be represented
   */
  public boolean supports(long epochDay) {
    return epochDay >= minEpochDay && epochDay <= maxEpochDay;
  }

  /**
   * Returns the epoch day of a date.
   *
   * @param date the date
   * @return days since 1970-01-01
   */
  public long toEpochDay(CalendarDate date) {
    return switch (date.kind()) {
      case GREGORIAN -> LocalDate.of(date.year(), date.month(), date.day()).toEpochDay();
      case JALALI ->
          nowruz(date.year())
              + CalendarKind.JALALI.daysBeforeMonth(date.month(), rule.isLeapYear(date.year()))
              + date.day()
              - 1;
    };
  }

  /**
   * Returns the date of an epoch day.
   *
   * @param epochDay days since 1970-01-01
   * @param kind the calendar of the result
   * @return the date
   * @throws JalaliException if the day is outside the supported span
   */
  public CalendarDate fromEpochDay(long epochDay, CalendarKind kind) throws JalaliException {
    if (!supports(epochDay)) {
      throw JalaliException.overflow(
          "epoch day " + epochDay + " is outside the supported range", "epoch day " + epochDay);
    }
    return dateOf(epochDay, kind);
  }

  /**
   * Converts a date to the Gregorian calendar.
   *
   * @param date the date
   * @return the same day in the Gregorian calendar
   */
  public CalendarDate toGregorian(CalendarDate date) {
    return convert(date, CalendarKind.GREGORIAN);
  }

  /**
   * Converts a date to the Jalali calendar.
   *
   * @param date the date
   * @return the same day in the Jalali calendar
   */
  public CalendarDate toJalali(CalendarDate date) {
    return convert(date, CalendarKind.JALALI);
  }

  /**
   * Converts a date to the given calendar.
   *
   * @param date the date
   * @param kind the target calendar
   * @return the same day in the target calendar
   */
  public CalendarDate convert(CalendarDate date, CalendarKind kind) {
    if (date.kind() == kind) {
      return date;
    }
    // Every constructed date lies in the supported span
    return dateOf(toEpochDay(date), kind);
  }

  private CalendarDate dateOf(long epochDay, CalendarKind kind) {
    return switch (kind) {
      case GREGORIAN -> {
        LocalDate d = LocalDate.ofEpochDay(epochDay);
        yield new CalendarDate(d.getYear(), d.getMonthValue(), d.getDayOfMonth(), kind);
      }
      case JALALI -> jalaliOf(epochDay);
    };
  }

  private CalendarDate jalaliOf(long epochDay) {
    long estimate =
        ANCHOR_YEAR
            + Math.floorDiv((epochDay - ANCHOR_NOWRUZ) * CycleLeapYearRule.CYCLE_YEARS, CYCLE_DAYS);
    int year = (int) Math.max(MIN_YEAR, Math.min(MAX_YEAR, estimate));
    long start = nowruz(year);
    while (start > epochDay) {
      year--;
      start = nowruz(year);
    }
    long next = nowruz(year + 1);
    while (next <= epochDay) {
      year++;
      start = next;
      next = nowruz(year + 1);
    }

    boolean leap = rule.isLeapYear(year);
    int remaining = (int) (epochDay - start) + 1;
    int month = 1;
    int length = CalendarKind.JALALI.lengthOfMonth(month, leap);
    while (remaining > length) {
      remaining -= length;
      month++;
      length = CalendarKind.JALALI.lengthOfMonth(month, leap);
    }
    return new CalendarDate(year, month, remaining, CalendarKind.JALALI);
  }

  /** Epoch day of the first day of a Jalali year. */
  private long nowruz(int year) {
    return ANCHOR_NOWRUZ
        + 365L * (year - ANCHOR_YEAR)
        + rule.leapYearsBetween(ANCHOR_YEAR, year);
  }
}
