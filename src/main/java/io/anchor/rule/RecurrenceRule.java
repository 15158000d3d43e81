package io.anchor.rule;

import java.time.LocalDate;

/**
 * Sealed interface for recurrence rules.
 *
 * <p>There are 8 kinds of rule:
 *
 * <ul>
 *   <li>{@link NoRecurrence} - does not repeat
 *   <li>{@link Daily} - "every day", "every 2 days"
 *   <li>{@link Weekly} - "every Friday"
 *   <li>{@link Monthly} - "monthly on the 31st"
 *   <li>{@link Yearly} - "every year"
 *   <li>{@link CustomDays} - "every 3 days", counted from the anchor
 *   <li>{@link NthWeekday} - "second Monday of the month"
 *   <li>{@link SpecificDays} - "weekdays", "every Mon, Wed, Fri"
 * </ul>
 *
 * <p>Every rule may carry an inclusive end date and an occurrence count. Both are nullable.
 */
public sealed interface RecurrenceRule
    permits NoRecurrence,
        Daily,
        Weekly,
        Monthly,
        Yearly,
        CustomDays,
        NthWeekday,
        SpecificDays {

  /**
   * Returns the type tag of this rule.
   *
   * @return the type
   */
  RecurrenceType type();

  /**
   * Returns the last date on which the rule may fire, or null if open-ended.
   *
   * @return the end date (may be null)
   */
  LocalDate endDate();

  /**
   * Returns the number of occurrences the series was created with, or null.
   *
   * <p>Stored verbatim; occurrence calculation does not consult it.
   *
   * @return the count (may be null)
   */
  Integer count();

  /**
   * Returns a copy of this rule with the given end date.
   *
   * @param endDate the end date (may be null)
   * @return a new rule
   */
  RecurrenceRule withEndDate(LocalDate endDate);

  /**
   * Returns a copy of this rule with the given count.
   *
   * @param count the count (may be null)
   * @return a new rule
   */
  RecurrenceRule withCount(Integer count);
}
