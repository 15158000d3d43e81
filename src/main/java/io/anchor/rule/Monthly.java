package io.anchor.rule;

import io.anchor.RecurrenceException;
import java.time.LocalDate;

/**
 * Repeats on a day of every month, falling back to the month's last day when it is shorter.
 *
 * @param dayOfMonth the day (1-31), or null to use the anchor's day of month
 * @param endDate the inclusive end date (may be null)
 * @param count the occurrence count (may be null)
 */
public record Monthly(Integer dayOfMonth, LocalDate endDate, Integer count)
    implements RecurrenceRule {
  /** Validates the day of month and count. */
  public Monthly {
    if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > 31)) {
      throw RecurrenceException.invalidRule(
          "dayOfMonth", "day of month must be 1-31, got " + dayOfMonth);
    }
    count = RuleChecks.count(count);
  }

  /**
   * Creates a rule on the given day of every month.
   *
   * @param dayOfMonth the day (1-31)
   * @return a new monthly rule
   */
  public static Monthly onDay(int dayOfMonth) {
    return new Monthly(dayOfMonth, null, null);
  }

  /**
   * Creates a monthly rule that takes its day from the anchor.
   *
   * @return a new monthly rule without a fixed day
   */
  public static Monthly sameDay() {
    return new Monthly(null, null, null);
  }

  @Override
  public RecurrenceType type() {
    return RecurrenceType.MONTHLY;
  }

  @Override
  public Monthly withEndDate(LocalDate endDate) {
    return new Monthly(dayOfMonth, endDate, count);
  }

  @Override
  public Monthly withCount(Integer count) {
    return new Monthly(dayOfMonth, endDate, count);
  }
}
