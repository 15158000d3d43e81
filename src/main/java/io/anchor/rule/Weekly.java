package io.anchor.rule;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Repeats on the given days of every week.
 *
 * <p>A null day set means the anchor's own weekday, as for a bare "weekly". An empty day set is
 * allowed but never produces an occurrence. The interval is stored but occurrences are always
 * computed week by week.
 *
 * @param interval the stored week interval (at least 1)
 * @param daysOfWeek the days to fire on, or null for the anchor's weekday
 * @param endDate the inclusive end date (may be null)
 * @param count the occurrence count (may be null)
 */
public record Weekly(int interval, Set<Weekday> daysOfWeek, LocalDate endDate, Integer count)
    implements RecurrenceRule {
  /** Validates the interval and count and copies the day set. */
  public Weekly {
    interval = RuleChecks.interval(interval);
    daysOfWeek = daysOfWeek == null ? null : RuleChecks.days(daysOfWeek);
    count = RuleChecks.count(count);
  }

  /**
   * Creates a weekly rule on the given days.
   *
   * @param days the days to fire on
   * @return a new weekly rule
   */
  public static Weekly on(Weekday... days) {
    return on(List.of(days));
  }

  /**
   * Creates a weekly rule on the given days.
   *
   * @param days the days to fire on
   * @return a new weekly rule
   */
  public static Weekly on(Collection<Weekday> days) {
    return new Weekly(1, RuleChecks.days(days), null, null);
  }

  /**
   * Creates a weekly rule on the anchor's weekday.
   *
   * @return a new weekly rule without explicit days
   */
  public static Weekly sameDay() {
    return new Weekly(1, null, null, null);
  }

  @Override
  public RecurrenceType type() {
    return RecurrenceType.WEEKLY;
  }

  @Override
  public Weekly withEndDate(LocalDate endDate) {
    return new Weekly(interval, daysOfWeek, endDate, count);
  }

  @Override
  public Weekly withCount(Integer count) {
    return new Weekly(interval, daysOfWeek, endDate, count);
  }
}
