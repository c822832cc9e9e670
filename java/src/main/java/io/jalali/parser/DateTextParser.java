package io.jalali.parser;

import io.jalali.JalaliException;
import io.jalali.Span;
import io.jalali.calendar.CalendarKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a delimited date text into year, month and day fields.
 *
 * <p>The year is a signed 32-bit integer; month and day are unsigned integers no larger than 255.
 * Only ASCII digits are accepted. Whether the fields name a real day is left to {@link
 * io.jalali.calendar.CalendarConverter}.
 */
public final class DateTextParser {
  /** Largest value accepted for the month and day fields. */
  private static final long MAX_UNSIGNED_FIELD = 255;

  private final String input;
  private final char delimiter;

  private DateTextParser(String input, char delimiter) {
    this.input = input;
    this.delimiter = delimiter;
  }

  /**
   * Parses a date text written in the given calendar's format.
   *
   * @param input the date text, e.g. "1403/05/29" or "2024-08-19"
   * @param kind the calendar whose delimiter separates the fields
   * @return the raw fields
   * @throws JalaliException if the text is not three integer fields
   */
  public static RawDate parse(String input, CalendarKind kind) throws JalaliException {
    if (input == null) {
      throw JalaliException.format("missing date text", new Span(0, 0), "");
    }
    return new DateTextParser(input, kind.delimiter()).parseFields();
  }

  private RawDate parseFields() throws JalaliException {
    List<Span> segments = split();
    if (segments.size() != 3) {
      throw JalaliException.format(
          "invalid date format: expected 3 fields separated by '"
              + delimiter
              + "', found "
              + segments.size(),
          new Span(0, input.length()),
          input);
    }

    int year =
        (int) parseField(segments.get(0), "year", true, Integer.MIN_VALUE, Integer.MAX_VALUE);
    int month = (int) parseField(segments.get(1), "month", false, 0, MAX_UNSIGNED_FIELD);
    int day = (int) parseField(segments.get(2), "day", false, 0, MAX_UNSIGNED_FIELD);
    return new RawDate(year, month, day, input);
  }

  /** Splits on the delimiter, keeping empty segments. */
  private List<Span> split() {
    List<Span> segments = new ArrayList<>(3);
    int start = 0;
    for (int pos = 0; pos < input.length(); pos++) {
      if (input.charAt(pos) == delimiter) {
        segments.add(new Span(start, pos));
        start = pos + 1;
      }
    }
    segments.add(new Span(start, input.length()));
    return segments;
  }

  private long parseField(Span span, String field, boolean signed, long min, long max)
      throws JalaliException {
    int pos = span.start();
    boolean negative = false;
    if (pos < span.end()) {
      char sign = input.charAt(pos);
      if (sign == '+' || (signed && sign == '-')) {
        negative = sign == '-';
        pos++;
      }
    }
    if (pos == span.end()) {
      throw fieldError(field, span);
    }

    long limit = negative ? -min : max;
    long value = 0;
    for (; pos < span.end(); pos++) {
      char ch = input.charAt(pos);
      if (!isDigit(ch)) {
        throw fieldError(field, span);
      }
      value = value * 10 + (ch - '0');
      if (value > limit) {
        throw fieldError(field, span);
      }
    }
    return negative ? -value : value;
  }

  private JalaliException fieldError(String field, Span span) {
    return JalaliException.format("invalid " + field + " value", span, input);
  }

  private static boolean isDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }
}
