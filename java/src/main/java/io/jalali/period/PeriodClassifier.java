package io.jalali.period;

import io.jalali.calendar.CalendarConverter;
import io.jalali.calendar.CalendarDate;
import io.jalali.calendar.CalendarKind;
import java.util.List;
import java.util.Objects;

/**
 * Classifies a date within a recurring period that ends on a configured day of each month.
 *
 * <p>A period with anchor day {@code n} runs from day {@code n + 1} of one month through day
 * {@code n} of the next. Months shorter than {@code n} close the period on their last day, and
 * the first day of the following month opens the next one.
 *
 * <p>The rules form an ordered table; the first matching row decides:
 *
 * <ol>
 *   <li>last day of the month, on or before the anchor day: End
 *   <li>1 Farvardin, when the anchor is 30 or more or equals the last day of the previous year:
 *       Start
 *   <li>first of months 2-7 with anchor 31, or of months 8-12 with anchor 30 or more: Start
 *   <li>the anchor day itself: End
 *   <li>the day after the anchor day: Start
 *   <li>any other day with an anchor in 1..31: Middle
 * </ol>
 *
 * <p>Anchors outside 1..31 yield Unknown unless one of the first three rows matches.
 */
public final class PeriodClassifier {
  private static final List<PeriodRule> RULES =
      List.of(
          new PeriodRule(
              "month-end", c -> c.monthEnd() && c.day() <= c.anchorDay(), PeriodState.END),
          new PeriodRule(
              "new-year-rollover",
              c ->
                  c.day() == 1
                      && c.month() == 1
                      && (c.anchorDay() >= 30 || c.anchorDay() == c.previousDay()),
              PeriodState.START),
          new PeriodRule(
              "long-anchor-rollover",
              c ->
                  c.day() == 1
                      && ((c.monthBetween(2, 7) && c.anchorDay() == 31)
                          || (c.monthBetween(8, 12) && c.anchorDay() >= 30)),
              PeriodState.START),
          new PeriodRule(
              "anchor-day",
              c -> c.anchorInMonthRange() && c.day() == c.anchorDay(),
              PeriodState.END),
          new PeriodRule(
              "day-after-anchor",
              c -> c.anchorInMonthRange() && c.day() == c.anchorDay() + 1,
              PeriodState.START),
          new PeriodRule("inside-period", PeriodContext::anchorInMonthRange, PeriodState.MIDDLE));

  private final CalendarConverter converter;

  /**
   * Creates a classifier.
   *
   * @param converter the converter supplying Jalali month lengths
   */
  public PeriodClassifier(CalendarConverter converter) {
    this.converter = Objects.requireNonNull(converter, "converter");
  }

  /**
   * Returns the decision table in evaluation order.
   *
   * @return the rules
   */
  public static List<PeriodRule> rules() {
    return RULES;
  }

  /**
   * Classifies a date. Gregorian dates are converted to Jalali first.
   *
   * @param date the date
   * @param anchorDay the day of the month the period ends on
   * @return the state of the date within its period
   */
  public PeriodState classify(CalendarDate date, int anchorDay) {
    PeriodContext context = contextOf(converter.toJalali(date), anchorDay);
    for (PeriodRule rule : RULES) {
      if (rule.matches(context)) {
        return rule.state();
      }
    }
    return PeriodState.UNKNOWN;
  }

  /**
   * Collects the facts the rules decide on.
   *
   * @param date a Jalali date
   * @param anchorDay the day of the month the period ends on
   * @return the context
   */
  PeriodContext contextOf(CalendarDate date, int anchorDay) {
    return new PeriodContext(
        date.year(),
        date.month(),
        date.day(),
        anchorDay,
        converter.isLastDayOfMonth(date),
        previousDay(date));
  }

  private int previousDay(CalendarDate date) {
    if (date.day() > 1) {
      return date.day() - 1;
    }
    if (date.month() > 1) {
      return converter.lengthOfMonth(date.year(), date.month() - 1, CalendarKind.JALALI);
    }
    return converter.lengthOfMonth(date.year() - 1, 12, CalendarKind.JALALI);
  }
}
