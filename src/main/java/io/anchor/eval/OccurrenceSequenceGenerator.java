package io.anchor.eval;

import io.anchor.rule.Anchor;
import io.anchor.rule.NoRecurrence;
import io.anchor.rule.RecurrenceRule;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Produces bounded, forward-ordered sequences of occurrences.
 *
 * <p>A sequence starts with the anchor itself and then follows {@link
 * OccurrenceCalculator#nextOccurrence}, each result becoming the next reference. It stops after
 * {@code count} elements or when the calculator reports no further occurrence. Since the
 * calculator only moves forward, sequences are strictly increasing.
 */
public final class OccurrenceSequenceGenerator {
  /** Number of occurrences shown in a preview. */
  public static final int DEFAULT_PREVIEW_COUNT = 5;

  private OccurrenceSequenceGenerator() {}

  /**
   * Returns a lazy stream of at most {@code count} occurrences, starting with the anchor.
   *
   * @param anchor the reminder's original date and time
   * @param rule the recurrence rule
   * @param count the maximum number of occurrences
   * @return a stream of occurrences
   * @throws IllegalArgumentException if count is negative
   */
  public static Stream<LocalDateTime> generate(Anchor anchor, RecurrenceRule rule, int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative, got " + count);
    }
    if (rule instanceof NoRecurrence) {
      return Stream.of(anchor.toLocalDateTime()).limit(count);
    }
    return unbounded(anchor, rule).limit(count);
  }

  /**
   * Returns at most {@code count} occurrences, starting with the anchor.
   *
   * @param anchor the reminder's original date and time
   * @param rule the recurrence rule
   * @param count the maximum number of occurrences
   * @return a list of occurrences
   * @throws IllegalArgumentException if count is negative
   */
  public static List<LocalDateTime> generateList(Anchor anchor, RecurrenceRule rule, int count) {
    return generate(anchor, rule, count).collect(Collectors.toList());
  }

  /**
   * Returns the occurrences of the sequence where {@code from < occurrence <= to}.
   *
   * <p>The search starts at {@code from} rather than walking from the anchor, so ranges far from
   * the anchor cost no more than nearby ones. The anchor is included when it lies in the range.
   *
   * @param anchor the reminder's original date and time
   * @param rule the recurrence rule
   * @param from the start time (exclusive)
   * @param to the end time (inclusive)
   * @return the occurrences in the range
   */
  public static List<LocalDateTime> between(
      Anchor anchor, RecurrenceRule rule, LocalDateTime from, LocalDateTime to) {
    LocalDateTime start = anchor.toLocalDateTime();
    LocalDateTime first =
        from.isBefore(start)
            ? start
            : OccurrenceCalculator.nextOccurrence(anchor, rule, from).orElse(null);
    return following(anchor, rule, first)
        .takeWhile(t -> !t.isAfter(to))
        .collect(Collectors.toList());
  }

  private static Stream<LocalDateTime> unbounded(Anchor anchor, RecurrenceRule rule) {
    return following(anchor, rule, anchor.toLocalDateTime());
  }

  /** The sequence beginning at {@code first}, or an empty one when {@code first} is null. */
  private static Stream<LocalDateTime> following(
      Anchor anchor, RecurrenceRule rule, LocalDateTime first) {
    Iterator<LocalDateTime> iterator =
        new Iterator<>() {
          private LocalDateTime next = first;

          @Override
          public boolean hasNext() {
            return next != null;
          }

          @Override
          public LocalDateTime next() {
            if (next == null) {
              throw new NoSuchElementException();
            }
            LocalDateTime current = next;
            Optional<LocalDateTime> following =
                OccurrenceCalculator.nextOccurrence(anchor, rule, current);
            next = following.orElse(null);
            return current;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }
}
