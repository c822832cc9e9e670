package io.jalali.calendar;

/**
 * Decides which Persian years are leap years, i.e. years whose 12th month (Esfand) has 30 days.
 *
 * <p>Implementations must be deterministic and thread-safe. The converter derives every Jalali
 * day count from this rule, so swapping the rule changes conversion results consistently.
 */
public interface LeapYearRule {

  /**
   * Returns whether the given Persian year is a leap year.
   *
   * @param year the Persian year, may be zero or negative
   * @return true if month 12 of the year has 30 days
   */
  boolean isLeapYear(int year);

  /**
   * Counts the leap years in {@code [fromYear, toYear)}; negative when {@code toYear < fromYear}.
   *
   * <p>The default walks every year. Rules with a closed form should override it.
   *
   * @param fromYear the first year (inclusive)
   * @param toYear the last year (exclusive)
   * @return the signed number of leap years in the range
   */
  default long leapYearsBetween(int fromYear, int toYear) {
    if (toYear < fromYear) {
      return -leapYearsBetween(toYear, fromYear);
    }
    long count = 0;
    for (int year = fromYear; year < toYear; year++) {
      if (isLeapYear(year)) {
        count++;
      }
    }
    return count;
  }
}
