package io.anchor.rule;

import java.time.LocalDate;

/**
 * Repeats on the anchor's month and day every year. A February 29 anchor falls on February 28 in
 * common years.
 *
 * @param endDate the inclusive end date (may be null)
 * @param count the occurrence count (may be null)
 */
public record Yearly(LocalDate endDate, Integer count) implements RecurrenceRule {
  /** Validates the count. */
  public Yearly {
    count = RuleChecks.count(count);
  }

  /**
   * Creates an open-ended yearly rule.
   *
   * @return a new yearly rule
   */
  public static Yearly everyYear() {
    return new Yearly(null, null);
  }

  @Override
  public RecurrenceType type() {
    return RecurrenceType.YEARLY;
  }

  @Override
  public Yearly withEndDate(LocalDate endDate) {
    return new Yearly(endDate, count);
  }

  @Override
  public Yearly withCount(Integer count) {
    return new Yearly(endDate, count);
  }
}
