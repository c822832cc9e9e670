package io.jalali.calendar;

/**
 * The 33-year arithmetic leap cycle.
 *
 * <p>Within each cycle of 33 years, the years at positions 1, 5, 9, 13, 17, 22, 26 and 30 are
 * leap years, giving 8 leap days per 12053 days. This agrees with the astronomical Solar Hijri
 * calendar for the years in current civil use (e.g. 1399, 1403 and 1408 are leap years) and
 * extends proleptically in both directions.
 */
public final class CycleLeapYearRule implements LeapYearRule {
  /** Shared instance; the rule has no state. */
  public static final CycleLeapYearRule INSTANCE = new CycleLeapYearRule();

  /** Years in one cycle. */
  static final int CYCLE_YEARS = 33;

  /** Leap years in one cycle. */
  static final int CYCLE_LEAP_YEARS = 8;

  private CycleLeapYearRule() {}

  @Override
  public boolean isLeapYear(int year) {
    return Math.floorMod(25L * year + 11, CYCLE_YEARS) < CYCLE_LEAP_YEARS;
  }

  @Override
  public long leapYearsBetween(int fromYear, int toYear) {
    return leapYearsBefore(toYear) - leapYearsBefore(fromYear);
  }

  /** Leap years in [1, year), signed for years before 1. */
  private static long leapYearsBefore(int year) {
    return Math.floorDiv(8L * year + 21, CYCLE_YEARS);
  }

  @Override
  public String toString() {
    return "33-year cycle";
  }
}
