package io.anchor.rule;

import java.time.LocalDate;

/**
 * Repeats every {@code interval} days counted from the anchor date.
 *
 * @param interval the number of days between occurrences (at least 1)
 * @param endDate the inclusive end date (may be null)
 * @param count the occurrence count (may be null)
 */
public record CustomDays(int interval, LocalDate endDate, Integer count)
    implements RecurrenceRule {
  /** Validates the interval and count. */
  public CustomDays {
    interval = RuleChecks.interval(interval);
    count = RuleChecks.count(count);
  }

  /**
   * Creates a rule repeating every {@code interval} days. An interval of 0 is treated as 1.
   *
   * @param interval the number of days between occurrences
   * @return a new custom-days rule
   */
  public static CustomDays every(int interval) {
    return new CustomDays(interval == 0 ? 1 : interval, null, null);
  }

  @Override
  public RecurrenceType type() {
    return RecurrenceType.CUSTOM_DAYS;
  }

  @Override
  public CustomDays withEndDate(LocalDate endDate) {
    return new CustomDays(interval, endDate, count);
  }

  @Override
  public CustomDays withCount(Integer count) {
    return new CustomDays(interval, endDate, count);
  }
}
