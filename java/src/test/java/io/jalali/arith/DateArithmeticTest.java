package io.jalali.arith;

import static org.junit.jupiter.api.Assertions.*;

import io.jalali.ErrorKind;
import io.jalali.JalaliException;
import io.jalali.calendar.CalendarConverter;
import io.jalali.calendar.CalendarDate;
import io.jalali.calendar.CalendarKind;
import io.jalali.calendar.CycleLeapYearRule;
import org.junit.jupiter.api.Test;

/** Tests for day and month arithmetic. */
public class DateArithmeticTest {
  private final CalendarConverter converter = new CalendarConverter(CycleLeapYearRule.INSTANCE);
  private final DateArithmetic arithmetic = new DateArithmetic(converter);

  private CalendarDate jalali(int year, int month, int day) throws JalaliException {
    return converter.date(year, month, day, CalendarKind.JALALI);
  }

  private CalendarDate gregorian(int year, int month, int day) throws JalaliException {
    return converter.date(year, month, day, CalendarKind.GREGORIAN);
  }

  @Test
  void testAddDays() throws JalaliException {
    assertEquals(jalali(1403, 5, 30), arithmetic.addDays(jalali(1403, 5, 28), 2));
    assertEquals(jalali(1403, 7, 1), arithmetic.addDays(jalali(1403, 6, 31), 1));
    assertEquals(jalali(1404, 1, 1), arithmetic.addDays(jalali(1403, 12, 30), 1));
    assertEquals(jalali(1403, 1, 1), arithmetic.addDays(jalali(1402, 12, 29), 1));
  }

  @Test
  void testAddNegativeDays() throws JalaliException {
    assertEquals(jalali(1402, 12, 29), arithmetic.addDays(jalali(1403, 1, 1), -1));
    assertEquals(jalali(1375, 8, 12), arithmetic.addDays(jalali(1403, 1, 1), -10_000));
  }

  @Test
  void testAddManyYearsOfDays() throws JalaliException {
    assertEquals(jalali(1404, 1, 1), arithmetic.addDays(jalali(1403, 1, 1), 366));
    assertEquals(jalali(1676, 10, 14), arithmetic.addDays(jalali(1403, 1, 1), 100_000));
  }

  @Test
  void testAddDaysKeepsCalendar() throws JalaliException {
    assertEquals(gregorian(2024, 3, 1), arithmetic.addDays(gregorian(2024, 2, 28), 2));
  }

  @Test
  void testAddZeroDays() throws JalaliException {
    CalendarDate d = jalali(1403, 5, 29);
    assertEquals(d, arithmetic.addDays(d, 0));
  }

  @Test
  void testAddDaysOverflow() throws JalaliException {
    CalendarDate d = jalali(1403, 1, 1);
    JalaliException e =
        assertThrows(JalaliException.class, () -> arithmetic.addDays(d, Integer.MAX_VALUE));
    assertEquals(ErrorKind.OVERFLOW, e.kind());
    assertEquals("1403/01/01", e.input().orElseThrow());
    assertThrows(JalaliException.class, () -> arithmetic.addDays(d, Integer.MIN_VALUE));
  }

  @Test
  void testAdditiveIdentity() throws JalaliException {
    CalendarDate d = jalali(1403, 5, 29);
    for (int n : new int[] {0, 1, -1, 29, -365, 366, 12_053, -12_053, 1_000_000, -1_000_000}) {
      assertEquals(n, arithmetic.diffDays(d, arithmetic.addDays(d, n)), "n = " + n);
    }
  }

  @Test
  void testDiffDays() throws JalaliException {
    assertEquals(0, arithmetic.diffDays(jalali(1403, 1, 1), jalali(1403, 1, 1)));
    assertEquals(366, arithmetic.diffDays(jalali(1403, 1, 1), jalali(1404, 1, 1)));
    assertEquals(365, arithmetic.diffDays(jalali(1402, 1, 1), jalali(1403, 1, 1)));
    assertEquals(-152, arithmetic.diffDays(jalali(1403, 5, 29), jalali(1403, 1, 1)));
    assertEquals(36_525, arithmetic.diffDays(jalali(1300, 1, 1), jalali(1400, 1, 1)));
  }

  @Test
  void testDiffDaysAntisymmetric() throws JalaliException {
    CalendarDate[] dates = {
      jalali(1403, 1, 1), jalali(1402, 12, 29), jalali(1399, 12, 30), jalali(1, 1, 1), jalali(-5, 6, 31)
    };
    for (CalendarDate a : dates) {
      for (CalendarDate b : dates) {
        assertEquals(-arithmetic.diffDays(b, a), arithmetic.diffDays(a, b), a + " .. " + b);
      }
    }
  }

  @Test
  void testDiffDaysAcrossCalendars() throws JalaliException {
    assertEquals(0, arithmetic.diffDays(jalali(1403, 5, 29), gregorian(2024, 8, 19)));
    assertEquals(1, arithmetic.diffDays(gregorian(2024, 8, 19), jalali(1403, 5, 30)));
  }

  @Test
  void testDiffDaysAcrossWholeRange() throws JalaliException {
    CalendarDate first = jalali(CalendarConverter.MIN_YEAR, 1, 1);
    CalendarDate last = jalali(CalendarConverter.MAX_YEAR, 12, 29);
    int span = arithmetic.diffDays(first, last);
    assertTrue(span > 0);
    assertEquals(-span, arithmetic.diffDays(last, first));
  }

  @Test
  void testDiffDaysWithAdjustment() throws JalaliException {
    CalendarDate a = jalali(1403, 1, 1);
    CalendarDate b = jalali(1403, 1, 10);
    assertEquals(10, arithmetic.diffDaysWithAdjustment(a, b, 1));
    assertEquals(-10, arithmetic.diffDaysWithAdjustment(b, a, 1));
    assertEquals(9, arithmetic.diffDaysWithAdjustment(a, b, 0));
    assertEquals(-9, arithmetic.diffDaysWithAdjustment(b, a, 0));
    assertEquals(1, arithmetic.diffDaysWithAdjustment(a, a, 1));
    assertEquals(-5, arithmetic.diffDaysWithAdjustment(a, a, -5));
    assertEquals(7, arithmetic.diffDaysWithAdjustment(a, b, -2));
  }

  @Test
  void testDiffDaysWithAdjustmentOverflow() throws JalaliException {
    CalendarDate a = jalali(1403, 1, 1);
    CalendarDate b = jalali(1403, 1, 10);
    JalaliException e =
        assertThrows(
            JalaliException.class,
            () -> arithmetic.diffDaysWithAdjustment(a, b, Integer.MAX_VALUE));
    assertEquals(ErrorKind.OVERFLOW, e.kind());
  }

  @Test
  void testAddMonths() throws JalaliException {
    assertEquals(jalali(1403, 6, 15), arithmetic.addMonths(jalali(1403, 5, 15), 1));
    assertEquals(jalali(1404, 5, 15), arithmetic.addMonths(jalali(1403, 5, 15), 12));
    assertEquals(jalali(1405, 1, 15), arithmetic.addMonths(jalali(1403, 11, 15), 14));
    assertEquals(jalali(1404, 1, 1), arithmetic.addMonths(jalali(1403, 12, 1), 1));
    assertEquals(jalali(1503, 5, 15), arithmetic.addMonths(jalali(1403, 5, 15), 1200));
  }

  @Test
  void testAddMonthsClampsDay() throws JalaliException {
    assertEquals(jalali(1403, 12, 30), arithmetic.addMonths(jalali(1403, 6, 31), 6));
    assertEquals(jalali(1402, 12, 29), arithmetic.addMonths(jalali(1402, 6, 31), 6));
    assertEquals(jalali(1403, 7, 30), arithmetic.addMonths(jalali(1403, 6, 31), 1));
    assertEquals(jalali(1404, 2, 30), arithmetic.addMonths(jalali(1403, 12, 30), 2));
  }

  @Test
  void testAddMonthsUsesDestinationYearLeapStatus() throws JalaliException {
    // 1403 is leap, 1404 is not
    assertEquals(jalali(1404, 12, 29), arithmetic.addMonths(jalali(1403, 12, 30), 12));
    assertEquals(jalali(1403, 12, 30), arithmetic.addMonths(jalali(1402, 6, 31), 18));
    assertEquals(jalali(1402, 12, 29), arithmetic.addMonths(jalali(1401, 11, 30), 13));
  }

  @Test
  void testAddMonthsGregorian() throws JalaliException {
    assertEquals(gregorian(2024, 2, 29), arithmetic.addMonths(gregorian(2024, 1, 31), 1));
    assertEquals(gregorian(2023, 2, 28), arithmetic.addMonths(gregorian(2022, 12, 31), 2));
  }

  @Test
  void testAddMonthsRejectsNonPositive() throws JalaliException {
    CalendarDate d = jalali(1403, 5, 15);
    for (int months : new int[] {0, -1, -12, Integer.MIN_VALUE}) {
      JalaliException e = assertThrows(JalaliException.class, () -> arithmetic.addMonths(d, months));
      assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
      assertEquals(String.valueOf(months), e.input().orElseThrow());
    }
  }

  @Test
  void testAddMonthsOverflow() throws JalaliException {
    JalaliException e =
        assertThrows(
            JalaliException.class,
            () -> arithmetic.addMonths(jalali(1403, 1, 1), Integer.MAX_VALUE));
    assertEquals(ErrorKind.OVERFLOW, e.kind());
    assertThrows(
        JalaliException.class,
        () -> arithmetic.addMonths(jalali(CalendarConverter.MAX_YEAR, 12, 1), 1));
  }
}
