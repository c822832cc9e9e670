package io.jalali.period;

/** Position of a date within its recurring custom period. */
public enum PeriodState {
  /** First day of a period. */
  START("Start"),
  /** Last day of a period. */
  END("End"),
  /** Any other day of a period. */
  MIDDLE("Middle"),
  /** The anchor day does not define a period. */
  UNKNOWN("Unknown");

  private final String displayName;

  PeriodState(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
