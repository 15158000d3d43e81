package io.anchor.rule;

import io.anchor.RecurrenceException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Repeats on a fixed, non-empty set of weekdays.
 *
 * @param daysOfWeek the days to fire on
 * @param endDate the inclusive end date (may be null)
 * @param count the occurrence count (may be null)
 */
public record SpecificDays(Set<Weekday> daysOfWeek, LocalDate endDate, Integer count)
    implements RecurrenceRule {
  /** Monday through Friday. */
  public static final Set<Weekday> WEEKDAYS =
      Set.copyOf(EnumSet.range(Weekday.MONDAY, Weekday.FRIDAY));

  /** Saturday and Sunday. */
  public static final Set<Weekday> WEEKEND = Set.of(Weekday.SATURDAY, Weekday.SUNDAY);

  /** Validates the day set and count. */
  public SpecificDays {
    daysOfWeek = RuleChecks.days(daysOfWeek);
    if (daysOfWeek.isEmpty()) {
      throw RecurrenceException.invalidRule(
          "daysOfWeek", "at least one day of week must be specified");
    }
    count = RuleChecks.count(count);
  }

  /**
   * Creates a rule on the given days.
   *
   * @param days the days to fire on
   * @return a new specific-days rule
   */
  public static SpecificDays on(Weekday... days) {
    return on(List.of(days));
  }

  /**
   * Creates a rule on the given days.
   *
   * @param days the days to fire on
   * @return a new specific-days rule
   */
  public static SpecificDays on(Collection<Weekday> days) {
    return new SpecificDays(RuleChecks.days(days), null, null);
  }

  /**
   * Creates a Monday-to-Friday rule.
   *
   * @return a new specific-days rule
   */
  public static SpecificDays weekdays() {
    return on(WEEKDAYS);
  }

  /**
   * Creates a Saturday-and-Sunday rule.
   *
   * @return a new specific-days rule
   */
  public static SpecificDays weekend() {
    return on(WEEKEND);
  }

  @Override
  public RecurrenceType type() {
    return RecurrenceType.SPECIFIC_DAYS;
  }

  @Override
  public SpecificDays withEndDate(LocalDate endDate) {
    return new SpecificDays(daysOfWeek, endDate, count);
  }

  @Override
  public SpecificDays withCount(Integer count) {
    return new SpecificDays(daysOfWeek, endDate, count);
  }
}
