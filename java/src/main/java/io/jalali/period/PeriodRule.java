package io.jalali.period;

import java.util.function.Predicate;

/**
 * One row of the period decision table.
 *
 * @param name a short name for the row, used in diagnostics
 * @param condition when the row applies
 * @param state the state the row assigns
 */
public record PeriodRule(String name, Predicate<PeriodContext> condition, PeriodState state) {

  /**
   * Returns whether this row applies.
   *
   * @param context the date facts
   * @return true if the condition holds
   */
  public boolean matches(PeriodContext context) {
    return condition.test(context);
  }
}
