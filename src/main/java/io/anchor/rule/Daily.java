package io.anchor.rule;

import java.time.LocalDate;

/**
 * Repeats every {@code interval} days, stepping from the reference time.
 *
 * @param interval the number of days between occurrences (at least 1)
 * @param endDate the inclusive end date (may be null)
 * @param count the occurrence count (may be null)
 */
public record Daily(int interval, LocalDate endDate, Integer count) implements RecurrenceRule {
  /** Validates the interval and count. */
  public Daily {
    interval = RuleChecks.interval(interval);
    count = RuleChecks.count(count);
  }

  /**
   * Creates an every-day rule.
   *
   * @return a new daily rule with interval 1
   */
  public static Daily everyDay() {
    return new Daily(1, null, null);
  }

  /**
   * Creates a rule repeating every {@code interval} days. An interval of 0 is treated as 1.
   *
   * @param interval the number of days between occurrences
   * @return a new daily rule
   */
  public static Daily every(int interval) {
    return new Daily(interval == 0 ? 1 : interval, null, null);
  }

  @Override
  public RecurrenceType type() {
    return RecurrenceType.DAILY;
  }

  @Override
  public Daily withEndDate(LocalDate endDate) {
    return new Daily(interval, endDate, count);
  }

  @Override
  public Daily withCount(Integer count) {
    return new Daily(interval, endDate, count);
  }
}
