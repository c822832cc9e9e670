package io.jalali.display;

import io.jalali.calendar.CalendarDate;
import io.jalali.calendar.CalendarKind;
import java.util.Locale;

/** Renders dates as fixed-format text. */
public final class Display {
  private Display() {}

  /**
   * Renders a date in its calendar's format: "YYYY/MM/DD" for Jalali, "YYYY-MM-DD" for Gregorian.
   *
   * @param date the date to render
   * @return the date text
   */
  public static String render(CalendarDate date) {
    return render(date.year(), date.month(), date.day(), date.kind());
  }

  /**
   * Renders date fields in a calendar's format without validating them.
   *
   * <p>The year is zero-padded to 4 digits, with a leading minus sign when negative; month and
   * day are zero-padded to 2.
   *
   * @param year the year
   * @param month the month
   * @param day the day
   * @param kind the calendar whose delimiter to use
   * @return the date text
   */
  public static String render(int year, int month, int day, CalendarKind kind) {
    char d = kind.delimiter();
    // ASCII digits under every default locale
    return String.format(
        Locale.ROOT,
        "%s%04d%c%02d%c%02d",
        year < 0 ? "-" : "",
        Math.abs((long) year),
        d,
        month,
        d,
        day);
  }
}
