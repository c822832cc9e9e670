package io.jalali.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.jalali.ErrorKind;
import io.jalali.JalaliException;
import io.jalali.Span;
import io.jalali.calendar.CalendarKind;
import org.junit.jupiter.api.Test;

/** Tests for splitting date text into raw fields. */
public class DateTextParserTest {

  @Test
  void testParseJalali() throws JalaliException {
    RawDate raw = DateTextParser.parse("1403/05/29", CalendarKind.JALALI);
    assertEquals(new RawDate(1403, 5, 29, "1403/05/29"), raw);
  }

  @Test
  void testParseGregorian() throws JalaliException {
    RawDate raw = DateTextParser.parse("2024-08-19", CalendarKind.GREGORIAN);
    assertEquals(2024, raw.year());
    assertEquals(8, raw.month());
    assertEquals(19, raw.day());
  }

  @Test
  void testParseWithoutPadding() throws JalaliException {
    RawDate raw = DateTextParser.parse("1403/5/9", CalendarKind.JALALI);
    assertEquals(5, raw.month());
    assertEquals(9, raw.day());
  }

  @Test
  void testParseSignedYear() throws JalaliException {
    assertEquals(-12, DateTextParser.parse("-12/01/01", CalendarKind.JALALI).year());
    assertEquals(12, DateTextParser.parse("+12/01/01", CalendarKind.JALALI).year());
    assertEquals(3, DateTextParser.parse("1403/+3/01", CalendarKind.JALALI).month());
  }

  @Test
  void testNoCalendarValidation() throws JalaliException {
    RawDate raw = DateTextParser.parse("1403/13/255", CalendarKind.JALALI);
    assertEquals(13, raw.month());
    assertEquals(255, raw.day());
    assertEquals(0, DateTextParser.parse("1403/00/00", CalendarKind.JALALI).month());
  }

  @Test
  void testWrongDelimiter() {
    JalaliException e =
        assertThrows(
            JalaliException.class, () -> DateTextParser.parse("2024-08-19", CalendarKind.JALALI));
    assertEquals(ErrorKind.FORMAT, e.kind());
    assertEquals("2024-08-19", e.input().orElseThrow());
  }

  @Test
  void testSegmentCount() {
    for (String text : new String[] {"1403/05", "1403/05/29/", "1403/05/29/1", "", "/"}) {
      JalaliException e =
          assertThrows(
              JalaliException.class,
              () -> DateTextParser.parse(text, CalendarKind.JALALI),
              "expected format error for: " + text);
      assertEquals(ErrorKind.FORMAT, e.kind());
    }
  }

  @Test
  void testEmptySegment() {
    JalaliException e =
        assertThrows(
            JalaliException.class, () -> DateTextParser.parse("1403//29", CalendarKind.JALALI));
    assertEquals(ErrorKind.FORMAT, e.kind());
    assertEquals("invalid month value", e.getMessage());
    assertEquals(new Span(5, 5), e.span().orElseThrow());
  }

  @Test
  void testNonNumericSegmentSpan() {
    JalaliException e =
        assertThrows(
            JalaliException.class, () -> DateTextParser.parse("1403/x5/29", CalendarKind.JALALI));
    assertEquals("invalid month value", e.getMessage());
    assertEquals(new Span(5, 7), e.span().orElseThrow());
  }

  @Test
  void testUnsignedFieldsRejectMinus() {
    JalaliException e =
        assertThrows(
            JalaliException.class, () -> DateTextParser.parse("1403/05/-1", CalendarKind.JALALI));
    assertEquals("invalid day value", e.getMessage());
  }

  @Test
  void testFieldRange() throws JalaliException {
    assertThrows(
        JalaliException.class, () -> DateTextParser.parse("1403/256/01", CalendarKind.JALALI));
    assertThrows(
        JalaliException.class,
        () -> DateTextParser.parse("2147483648/01/01", CalendarKind.JALALI));
    assertEquals(
        Integer.MIN_VALUE,
        DateTextParser.parse("-2147483648/01/01", CalendarKind.JALALI).year());
  }

  @Test
  void testRejectsWhitespaceAndNonAsciiDigits() {
    assertThrows(
        JalaliException.class, () -> DateTextParser.parse(" 1403/05/29", CalendarKind.JALALI));
    assertThrows(
        JalaliException.class, () -> DateTextParser.parse("1403/05/29 ", CalendarKind.JALALI));
    assertThrows(
        JalaliException.class,
        () -> DateTextParser.parse("۱۴۰۳/05/29", CalendarKind.JALALI));
  }

  @Test
  void testNullInput() {
    JalaliException e =
        assertThrows(JalaliException.class, () -> DateTextParser.parse(null, CalendarKind.JALALI));
    assertEquals(ErrorKind.FORMAT, e.kind());
  }
}
