package io.anchor.rule;

import java.time.LocalDate;

/**
 * A rule that never repeats. The reminder fires once, at its anchor.
 *
 * @param endDate ignored for scheduling, kept for round-tripping (may be null)
 * @param count ignored for scheduling, kept for round-tripping (may be null)
 */
public record NoRecurrence(LocalDate endDate, Integer count) implements RecurrenceRule {
  private static final NoRecurrence INSTANCE = new NoRecurrence(null, null);

  /** Validates the count. */
  public NoRecurrence {
    count = RuleChecks.count(count);
  }

  /**
   * Returns the shared bare instance.
   *
   * @return a rule without end date or count
   */
  public static NoRecurrence instance() {
    return INSTANCE;
  }

  @Override
  public RecurrenceType type() {
    return RecurrenceType.NONE;
  }

  @Override
  public NoRecurrence withEndDate(LocalDate endDate) {
    return new NoRecurrence(endDate, count);
  }

  @Override
  public NoRecurrence withCount(Integer count) {
    return new NoRecurrence(endDate, count);
  }
}
