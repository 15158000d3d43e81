package io.anchor.rule;

import io.anchor.RecurrenceException;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Shared invariant checks for rule constructors. */
final class RuleChecks {
  private RuleChecks() {}

  static int interval(int interval) {
    if (interval < 1) {
      throw RecurrenceException.invalidRule(
          "interval", "interval must be at least 1, got " + interval);
    }
    return interval;
  }

  static Integer count(Integer count) {
    if (count != null && count < 1) {
      throw RecurrenceException.invalidRule("count", "count must be at least 1, got " + count);
    }
    return count;
  }

  /** Copies into an immutable set iterating Monday first. */
  static Set<Weekday> days(Collection<Weekday> days) {
    EnumSet<Weekday> copy = EnumSet.noneOf(Weekday.class);
    if (days != null) {
      for (Weekday day : days) {
        if (day == null) {
          throw RecurrenceException.invalidRule("daysOfWeek", "daysOfWeek must not contain null");
        }
        copy.add(day);
      }
    }
    return Collections.unmodifiableSet(copy);
  }
}
