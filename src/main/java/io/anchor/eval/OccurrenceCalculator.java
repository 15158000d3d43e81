package io.anchor.eval;

import io.anchor.rule.Anchor;
import io.anchor.rule.CustomDays;
import io.anchor.rule.Daily;
import io.anchor.rule.Monthly;
import io.anchor.rule.NthWeekday;
import io.anchor.rule.OrdinalPosition;
import io.anchor.rule.RecurrenceRule;
import io.anchor.rule.SpecificDays;
import io.anchor.rule.Weekday;
import io.anchor.rule.Weekly;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.MonthDay;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the next occurrence of a recurrence rule.
 *
 * <h2>Contract</h2>
 *
 * <p>A returned occurrence is always strictly after the reference and carries the anchor's time of
 * day; only the date varies. An empty result means the series has ended, it is never an error.
 * Rules are validated on construction, so no branch here needs to guard against malformed input.
 *
 * <h2>End Date</h2>
 *
 * <p>The end date is inclusive. A reference on a later date ends the series, and so does a
 * candidate that falls after it.
 *
 * <h2>Search Bounds</h2>
 *
 * <ul>
 *   <li>Weekly and specific days: 14 days from the reference date
 *   <li>Nth weekday: 14 months, enough for any month that has a fifth such weekday
 * </ul>
 *
 * <p>Every other rule is resolved with calendar arithmetic and no search.
 */
public final class OccurrenceCalculator {
  /** Days scanned for weekly and specific-days rules. */
  static final int WEEKLY_SCAN_DAYS = 14;

  /** Months scanned for nth-weekday rules. */
  static final int NTH_WEEKDAY_SCAN_MONTHS = 14;

  private OccurrenceCalculator() {}

  /**
   * Computes the next occurrence strictly after the reference.
   *
   * @param anchor the reminder's original date and time
   * @param rule the recurrence rule
   * @param reference the time to search after (may precede the anchor)
   * @return the next occurrence, or empty if the series has no further occurrences
   */
  public static Optional<LocalDateTime> nextOccurrence(
      Anchor anchor, RecurrenceRule rule, LocalDateTime reference) {
    LocalDate endDate = rule.endDate();
    if (endDate != null && endDate.isBefore(reference.toLocalDate())) {
      return Optional.empty();
    }

    Optional<LocalDateTime> next = nextCandidate(anchor, rule, reference);
    if (endDate != null && next.isPresent() && next.get().toLocalDate().isAfter(endDate)) {
      return Optional.empty();
    }
    return next;
  }

  /**
   * Checks whether the reminder fires on the given day.
   *
   * <p>The anchor date always counts and days before it never do. Any later day counts when the
   * first occurrence after the end of the previous day lands on it.
   *
   * @param anchor the reminder's original date and time
   * @param rule the recurrence rule
   * @param day the day to check
   * @return true if an occurrence falls on the day
   */
  public static boolean occursOn(Anchor anchor, RecurrenceRule rule, LocalDate day) {
    if (day.equals(anchor.date())) {
      return true;
    }
    if (day.isBefore(anchor.date())) {
      return false;
    }
    LocalDateTime endOfPreviousDay = day.atStartOfDay().minusNanos(1);
    return nextOccurrence(anchor, rule, endOfPreviousDay)
        .map(t -> t.toLocalDate().equals(day))
        .orElse(false);
  }

  private static Optional<LocalDateTime> nextCandidate(
      Anchor anchor, RecurrenceRule rule, LocalDateTime reference) {
    return switch (rule.type()) {
      case NONE -> Optional.empty();
      case DAILY -> Optional.of(nextDaily(anchor, (Daily) rule, reference));
      case WEEKLY -> nextOnDays(anchor, weeklyDays(anchor, (Weekly) rule), reference);
      case SPECIFIC_DAYS -> nextOnDays(anchor, ((SpecificDays) rule).daysOfWeek(), reference);
      case MONTHLY -> Optional.of(nextMonthly(anchor, (Monthly) rule, reference));
      case YEARLY -> Optional.of(nextYearly(anchor, reference));
      case CUSTOM_DAYS -> Optional.of(nextCustomDays(anchor, (CustomDays) rule, reference));
      case NTH_WEEKDAY -> nextNthWeekday(anchor, (NthWeekday) rule, reference);
    };
  }

  /** Steps from the reference date, not from the anchor, so interval phase is not preserved. */
  private static LocalDateTime nextDaily(Anchor anchor, Daily rule, LocalDateTime reference) {
    LocalDateTime candidate = anchor.on(reference.toLocalDate());
    if (!candidate.isAfter(reference)) {
      candidate = candidate.plusDays(rule.interval());
    }
    return candidate;
  }

  private static Set<Weekday> weeklyDays(Anchor anchor, Weekly rule) {
    if (rule.daysOfWeek() == null) {
      return Set.of(Weekday.fromDayOfWeek(anchor.date().getDayOfWeek()));
    }
    return rule.daysOfWeek();
  }

  private static Optional<LocalDateTime> nextOnDays(
      Anchor anchor, Set<Weekday> days, LocalDateTime reference) {
    LocalDate start = reference.toLocalDate();
    for (int i = 0; i < WEEKLY_SCAN_DAYS; i++) {
      LocalDate day = start.plusDays(i);
      if (!days.contains(Weekday.fromDayOfWeek(day.getDayOfWeek()))) {
        continue;
      }
      LocalDateTime candidate = anchor.on(day);
      if (candidate.isAfter(reference)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  private static LocalDateTime nextMonthly(Anchor anchor, Monthly rule, LocalDateTime reference) {
    int targetDay = rule.dayOfMonth() != null ? rule.dayOfMonth() : anchor.date().getDayOfMonth();
    YearMonth month = YearMonth.from(reference);

    LocalDateTime candidate = anchor.on(clampedDay(month, targetDay));
    if (!candidate.isAfter(reference)) {
      candidate = anchor.on(clampedDay(month.plusMonths(1), targetDay));
    }
    return candidate;
  }

  private static LocalDateTime nextYearly(Anchor anchor, LocalDateTime reference) {
    // atYear moves Feb 29 to Feb 28 in common years
    MonthDay monthDay = MonthDay.from(anchor.date());
    int year = reference.getYear();

    LocalDateTime candidate = anchor.on(monthDay.atYear(year));
    if (!candidate.isAfter(reference)) {
      candidate = anchor.on(monthDay.atYear(year + 1));
    }
    return candidate;
  }

  /** Equivalent to adding the interval to the anchor until past the reference. */
  private static LocalDateTime nextCustomDays(
      Anchor anchor, CustomDays rule, LocalDateTime reference) {
    LocalDateTime start = anchor.toLocalDateTime();
    if (start.isAfter(reference)) {
      return start;
    }
    long elapsedDays = ChronoUnit.DAYS.between(start, reference);
    long strides = elapsedDays / rule.interval() + 1;
    return start.plusDays(strides * rule.interval());
  }

  private static Optional<LocalDateTime> nextNthWeekday(
      Anchor anchor, NthWeekday rule, LocalDateTime reference) {
    YearMonth month = YearMonth.from(reference);

    for (int i = 0; i < NTH_WEEKDAY_SCAN_MONTHS; i++) {
      Optional<LocalDate> day = nthWeekdayOfMonth(month, rule.weekday(), rule.ordinal());
      if (day.isPresent()) {
        LocalDateTime candidate = anchor.on(day.get());
        if (candidate.isAfter(reference)) {
          return Optional.of(candidate);
        }
      }
      month = month.plusMonths(1);
    }

    return Optional.empty();
  }

  /**
   * Finds the nth weekday of a month.
   *
   * @return the date, or empty when the month has fewer than n such weekdays
   */
  static Optional<LocalDate> nthWeekdayOfMonth(
      YearMonth month, Weekday weekday, OrdinalPosition ordinal) {
    DayOfWeek targetDow = weekday.toDayOfWeek();
    if (ordinal == OrdinalPosition.LAST) {
      return Optional.of(month.atEndOfMonth().with(TemporalAdjusters.lastInMonth(targetDow)));
    }

    LocalDate d = month.atDay(1).with(TemporalAdjusters.firstInMonth(targetDow));
    d = d.plusWeeks(ordinal.toN() - 1);

    if (!YearMonth.from(d).equals(month)) {
      return Optional.empty();
    }
    return Optional.of(d);
  }

  private static LocalDate clampedDay(YearMonth month, int day) {
    return month.atDay(Math.min(day, month.lengthOfMonth()));
  }
}
