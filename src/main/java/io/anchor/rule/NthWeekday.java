package io.anchor.rule;

import io.anchor.RecurrenceException;
import java.time.LocalDate;

/**
 * Repeats monthly on an ordinal weekday, e.g. the second Monday or the last Friday.
 *
 * @param ordinal which occurrence within the month
 * @param weekday the weekday
 * @param endDate the inclusive end date (may be null)
 * @param count the occurrence count (may be null)
 */
public record NthWeekday(OrdinalPosition ordinal, Weekday weekday, LocalDate endDate, Integer count)
    implements RecurrenceRule {
  /** Validates that ordinal and weekday are present. */
  public NthWeekday {
    if (ordinal == null) {
      throw RecurrenceException.invalidRule("n", "ordinal position is required");
    }
    if (weekday == null) {
      throw RecurrenceException.invalidRule("weekday", "weekday is required");
    }
    count = RuleChecks.count(count);
  }

  /**
   * Creates a rule on the given ordinal weekday.
   *
   * @param ordinal which occurrence within the month
   * @param weekday the weekday
   * @return a new nth-weekday rule
   */
  public static NthWeekday of(OrdinalPosition ordinal, Weekday weekday) {
    return new NthWeekday(ordinal, weekday, null, null);
  }

  /**
   * Creates a rule from a numeric ordinal.
   *
   * @param n 1 to 5, or -1 for the last occurrence
   * @param weekday the weekday
   * @return a new nth-weekday rule
   * @throws RecurrenceException if n is out of range
   */
  public static NthWeekday of(int n, Weekday weekday) {
    return of(OrdinalPosition.fromN(n), weekday);
  }

  /**
   * Returns the ordinal as a number (1-5, or -1 for last).
   *
   * @return the ordinal number
   */
  public int n() {
    return ordinal.toN();
  }

  @Override
  public RecurrenceType type() {
    return RecurrenceType.NTH_WEEKDAY;
  }

  @Override
  public NthWeekday withEndDate(LocalDate endDate) {
    return new NthWeekday(ordinal, weekday, endDate, count);
  }

  @Override
  public NthWeekday withCount(Integer count) {
    return new NthWeekday(ordinal, weekday, endDate, count);
  }
}
