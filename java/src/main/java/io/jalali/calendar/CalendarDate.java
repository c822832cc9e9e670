package io.jalali.calendar;

import io.jalali.display.Display;
import java.util.Objects;

/**
 * An immutable, validated civil date in the Jalali or Gregorian calendar.
 *
 * <p>Instances are created by {@link CalendarConverter#date}, which rejects components that do
 * not name a day of the calendar, so every instance is valid.
 */
public final class CalendarDate {
  private final int year;
  private final int month;
  private final int day;
  private final CalendarKind kind;

  CalendarDate(int year, int month, int day, CalendarKind kind) {
    this.year = year;
    this.month = month;
    this.day = day;
    this.kind = kind;
  }

  /**
   * Returns the year.
   *
   * @return the year, may be zero or negative
   */
  public int year() {
    return year;
  }

  /**
   * Returns the month.
   *
   * @return the month (1-12)
   */
  public int month() {
    return month;
  }

  /**
   * Returns the day of the month.
   *
   * @return the day (1-31)
   */
  public int day() {
    return day;
  }

  /**
   * Returns the calendar this date is expressed in.
   *
   * @return the calendar kind
   */
  public CalendarKind kind() {
    return kind;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CalendarDate other)) {
      return false;
    }
    return year == other.year && month == other.month && day == other.day && kind == other.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(year, month, day, kind);
  }

  /**
   * Returns the date text in this calendar's fixed format.
   *
   * @return the date text
   */
  @Override
  public String toString() {
    return Display.render(this);
  }
}
