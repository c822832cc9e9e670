package io.jalali;

/** The type of failure that rejected a calendar function call. */
public enum ErrorKind {
  /** Date text does not split into three integer segments. */
  FORMAT("format"),
  /** Segments parse but do not name a day of the calendar. */
  INVALID_DATE("invalid_date"),
  /** A non-date argument is outside its documented domain. */
  INVALID_ARGUMENT("invalid_argument"),
  /** An arithmetic result falls outside the supported span of days. */
  OVERFLOW("overflow");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
