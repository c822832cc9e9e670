package io.jalali.period;

/**
 * The facts about a Jalali date that period rules decide on.
 *
 * @param year the Jalali year
 * @param month the Jalali month (1-12)
 * @param day the day of the month
 * @param anchorDay the configured period anchor day
 * @param monthEnd whether the date is the last day of its month
 * @param previousDay the day of the month of the day before the date
 */
public record PeriodContext(
    int year, int month, int day, int anchorDay, boolean monthEnd, int previousDay) {

  /**
   * Returns whether the anchor day is a possible day of a month.
   *
   * @return true if the anchor day is in 1..31
   */
  public boolean anchorInMonthRange() {
    return anchorDay >= 1 && anchorDay <= 31;
  }

  /**
   * Returns whether the month is in the given inclusive range.
   *
   * @param from the first month
   * @param to the last month
   * @return true if from &lt;= month &lt;= to
   */
  public boolean monthBetween(int from, int to) {
    return month >= from && month <= to;
  }
}
