package io.jalali.calendar;

/** The two calendars a {@link CalendarDate} can be expressed in. */
public enum CalendarKind {
  JALALI(
      "jalali",
      '/',
      new int[] {31, 31, 31, 31, 31, 31, 30, 30, 30, 30, 30, 29},
      new int[] {31, 31, 31, 31, 31, 31, 30, 30, 30, 30, 30, 30}),
  GREGORIAN(
      "gregorian",
      '-',
      new int[] {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31},
      new int[] {31, 29, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31});

  private final String displayName;
  private final char delimiter;
  private final int[] commonYear;
  private final int[] leapYear;

  CalendarKind(String displayName, char delimiter, int[] commonYear, int[] leapYear) {
    this.displayName = displayName;
    this.delimiter = delimiter;
    this.commonYear = commonYear;
    this.leapYear = leapYear;
  }

  /**
   * Returns the character separating year, month and day in this calendar's date text.
   *
   * @return the delimiter
   */
  public char delimiter() {
    return delimiter;
  }

  /**
   * Returns the number of days in a month.
   *
   * @param month the month (1-12)
   * @param leap whether the year is a leap year in this calendar
   * @return the length of the month in days
   * @throws IllegalArgumentException if the month is out of range
   */
  public int lengthOfMonth(int month, boolean leap) {
    checkMonth(month);
    return (leap ? leapYear : commonYear)[month - 1];
  }

  /**
   * Returns the number of days in the year before the first day of a month.
   *
   * @param month the month (1-12)
   * @param leap whether the year is a leap year in this calendar
   * @return the days preceding the month
   * @throws IllegalArgumentException if the month is out of range
   */
  public int daysBeforeMonth(int month, boolean leap) {
    checkMonth(month);
    int[] lengths = leap ? leapYear : commonYear;
    int days = 0;
    for (int i = 0; i < month - 1; i++) {
      days += lengths[i];
    }
    return days;
  }

  private static void checkMonth(int month) {
    if (month < 1 || month > 12) {
      throw new IllegalArgumentException("month out of range: " + month);
    }
  }

  @Override
  public String toString() {
    return displayName;
  }
}
