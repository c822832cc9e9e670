package io.jalali;

import java.util.Optional;

/** Exception thrown when a date text, date value or argument is rejected. */
public final class JalaliException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending segment of the input, for format errors. */
  private final Span span;

  /** The raw input that was rejected. */
  private final String input;

  private JalaliException(ErrorKind kind, String message, Span span, String input) {
    super(message);
    this.kind = kind;
    this.span = span;
    this.input = input;
  }

  /**
   * Creates a new format error.
   *
   * @param message the error message
   * @param span the location of the bad segment in the input
   * @param input the original date text
   * @return a new JalaliException for a format error
   */
  public static JalaliException format(String message, Span span, String input) {
    return new JalaliException(ErrorKind.FORMAT, message, span, input);
  }

  /**
   * Creates a new invalid date error.
   *
   * @param message the error message
   * @param input the rejected date, as text
   * @return a new JalaliException for an invalid date
   */
  public static JalaliException invalidDate(String message, String input) {
    return new JalaliException(ErrorKind.INVALID_DATE, message, null, input);
  }

  /**
   * Creates a new invalid argument error.
   *
   * @param message the error message
   * @param input the rejected argument, as text
   * @return a new JalaliException for an invalid argument
   */
  public static JalaliException invalidArgument(String message, String input) {
    return new JalaliException(ErrorKind.INVALID_ARGUMENT, message, null, input);
  }

  /**
   * Creates a new overflow error.
   *
   * @param message the error message
   * @param input the date the arithmetic started from, as text
   * @return a new JalaliException for an out-of-range result
   */
  public static JalaliException overflow(String message, String input) {
    return new JalaliException(ErrorKind.OVERFLOW, message, null, input);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span of the offending segment, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the rejected input, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message.
   *
   * <p>Format errors with a span underline the offending segment:
   *
   * <pre>
   * error[format]: invalid month value
   *   1403/x5/28
   *        ^^
   * </pre>
   *
   * <p>Other errors name the rejected input on a second line.
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder();
    sb.append("error[").append(kind).append("]: ").append(getMessage());
    if (input == null) {
      return sb.toString();
    }
    sb.append("\n  ").append(input);
    if (kind == ErrorKind.FORMAT && span != null) {
      sb.append("\n");
      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));
    }
    return sb.toString();
  }
}
