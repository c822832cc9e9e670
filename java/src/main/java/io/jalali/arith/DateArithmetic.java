package io.jalali.arith;

import io.jalali.JalaliException;
import io.jalali.calendar.CalendarConverter;
import io.jalali.calendar.CalendarDate;
import io.jalali.calendar.CalendarKind;
import java.util.Objects;

/**
 * Day and month arithmetic over {@link CalendarDate} values.
 *
 * <p>Day arithmetic runs on the epoch day count, so it crosses month and year boundaries of
 * either calendar without special cases. Month arithmetic works on the calendar fields and clamps
 * the day to the length of the destination month.
 */
public final class DateArithmetic {
  private final CalendarConverter converter;

  /**
   * Creates date arithmetic on top of a converter.
   *
   * @param converter the converter supplying day counts and month lengths
   */
  public DateArithmetic(CalendarConverter converter) {
    this.converter = Objects.requireNonNull(converter, "converter");
  }

  /**
   * Adds a signed number of days to a date.
   *
   * @param date the start date
   * @param days the number of days to add, may be negative
   * @return the resulting date, in the calendar of the start date
   * @throws JalaliException if the result is outside the supported range
   */
  public CalendarDate addDays(CalendarDate date, long days) throws JalaliException {
    long epochDay = converter.toEpochDay(date) + days;
    if (!converter.supports(epochDay)) {
      throw JalaliException.overflow(
          "adding " + days + " days leaves the supported date range", date.toString());
    }
    return converter.fromEpochDay(epochDay, date.kind());
  }

  /**
   * Returns the signed number of days from one date to another.
   *
   * <p>The dates may be in different calendars. The result is positive when {@code end} is after
   * {@code start}, and {@code diffDays(a, b) == -diffDays(b, a)}.
   *
   * @param start the start date
   * @param end the end date
   * @return the number of days from start to end
   */
  public int diffDays(CalendarDate start, CalendarDate end) {
    // The supported span is well under Integer.MAX_VALUE days wide
    return (int) (converter.toEpochDay(end) - converter.toEpochDay(start));
  }

  /**
   * Returns the day distance between two dates plus an adjustment, signed by direction.
   *
   * <p>The adjustment is added to the absolute distance, then the sum is negated when {@code end}
   * is before {@code start}. Equal dates count as forward, so the result is the adjustment.
   *
   * @param start the start date
   * @param end the end date
   * @param adjustment the number of days to add to the distance
   * @return the adjusted, signed distance
   * @throws JalaliException if the result does not fit in an int
   */
  public int diffDaysWithAdjustment(CalendarDate start, CalendarDate end, int adjustment)
      throws JalaliException {
    int diff = diffDays(start, end);
    try {
      int adjusted = Math.addExact(Math.abs(diff), adjustment);
      return diff < 0 ? Math.negateExact(adjusted) : adjusted;
    } catch (ArithmeticException e) {
      throw JalaliException.overflow(
          "day difference " + diff + " adjusted by " + adjustment + " does not fit in an int",
          start + " .. " + end);
    }
  }

  /**
   * Adds a positive number of months to a date.
   *
   * <p>The month count is split into whole years and remaining months; a month past 12 rolls
   * into the next year. The day is clamped to the length of the destination month in the
   * destination year, so 1403/06/31 plus 6 months is 1403/12/30 (1403 is a leap year) and
   * 1402/06/31 plus 6 months is 1402/12/29.
   *
   * @param date the start date
   * @param months the number of months to add, must be positive
   * @return the resulting date, in the calendar of the start date
   * @throws JalaliException if months is not positive or the result is outside the supported
   *     range
   */
  public CalendarDate addMonths(CalendarDate date, int months) throws JalaliException {
    if (months <= 0) {
      throw JalaliException.invalidArgument(
          "months must be positive, was " + months, String.valueOf(months));
    }

    long year = (long) date.year() + months / 12;
    int month = date.month() + months % 12;
    if (month > 12) {
      year++;
      month -= 12;
    }
    CalendarKind kind = date.kind();
    if (!converter.supportsYear(year, kind)) {
      throw outOfRange(date, months);
    }
    int day = Math.min(date.day(), converter.lengthOfMonth((int) year, month, kind));
    if (!converter.supports((int) year, month, day, kind)) {
      throw outOfRange(date, months);
    }
    return converter.date((int) year, month, day, kind);
  }

  private static JalaliException outOfRange(CalendarDate date, int months) {
    return JalaliException.overflow(
        "adding " + months + " months leaves the supported date range", date.toString());
  }
}
