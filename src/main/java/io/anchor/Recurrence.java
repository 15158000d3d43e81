package io.anchor;

import io.anchor.codec.RecurrenceRuleCodec;
import io.anchor.display.RecurrenceFormatter;
import io.anchor.eval.OccurrenceCalculator;
import io.anchor.eval.OccurrenceSequenceGenerator;
import io.anchor.parser.NaturalLanguageRecurrenceParser;
import io.anchor.rule.Anchor;
import io.anchor.rule.RecurrenceRule;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The main entry point for working with a reminder's recurrence.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Anchor anchor = Anchor.of(2024, 3, 4, 8, 0);
 * Recurrence recurrence = Recurrence.of(anchor, SpecificDays.on(MONDAY, WEDNESDAY, FRIDAY));
 * Optional<LocalDateTime> next = recurrence.nextFrom(LocalDateTime.now());
 * System.out.println(recurrence + ": " + recurrence.preview());
 * }</pre>
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class Recurrence {
  private final Anchor anchor;
  private final RecurrenceRule rule;

  private Recurrence(Anchor anchor, RecurrenceRule rule) {
    this.anchor = Objects.requireNonNull(anchor, "anchor");
    this.rule = Objects.requireNonNull(rule, "rule");
  }

  /**
   * Pairs an anchor with a rule.
   *
   * @param anchor the reminder's original date and time
   * @param rule the recurrence rule
   * @return a new recurrence
   */
  public static Recurrence of(Anchor anchor, RecurrenceRule rule) {
    return new Recurrence(anchor, rule);
  }

  /**
   * Pairs an anchor with the rule recognized in free text.
   *
   * @param anchor the reminder's original date and time
   * @param text the free text
   * @return the recurrence, or empty if the text names no recurrence
   */
  public static Optional<Recurrence> parse(Anchor anchor, String text) {
    return NaturalLanguageRecurrenceParser.parse(text).map(rule -> new Recurrence(anchor, rule));
  }

  /**
   * Pairs an anchor with a stored rule.
   *
   * @param anchor the reminder's original date and time
   * @param json the stored rule
   * @return a new recurrence
   * @throws RecurrenceException if the stored rule cannot be decoded
   */
  public static Recurrence fromJson(Anchor anchor, String json) {
    return new Recurrence(anchor, RecurrenceRuleCodec.fromJson(json));
  }

  /**
   * Computes the next occurrence strictly after the given time.
   *
   * @param reference the reference time
   * @return the next occurrence, or empty if none exists
   */
  public Optional<LocalDateTime> nextFrom(LocalDateTime reference) {
    return OccurrenceCalculator.nextOccurrence(anchor, rule, reference);
  }

  /**
   * Returns a lazy stream of at most {@code count} occurrences, starting with the anchor.
   *
   * @param count the maximum number of occurrences
   * @return a stream of occurrences
   */
  public Stream<LocalDateTime> occurrences(int count) {
    return OccurrenceSequenceGenerator.generate(anchor, rule, count);
  }

  /**
   * Returns the first few occurrences, for display.
   *
   * @return up to {@value OccurrenceSequenceGenerator#DEFAULT_PREVIEW_COUNT} occurrences
   */
  public List<LocalDateTime> preview() {
    return OccurrenceSequenceGenerator.generateList(
        anchor, rule, OccurrenceSequenceGenerator.DEFAULT_PREVIEW_COUNT);
  }

  /**
   * Returns the occurrences where {@code from < occurrence <= to}.
   *
   * @param from the start time (exclusive)
   * @param to the end time (inclusive)
   * @return the occurrences in the range
   */
  public List<LocalDateTime> between(LocalDateTime from, LocalDateTime to) {
    return OccurrenceSequenceGenerator.between(anchor, rule, from, to);
  }

  /**
   * Checks whether the reminder fires on the given day.
   *
   * @param day the day
   * @return true if an occurrence falls on the day
   */
  public boolean occursOn(LocalDate day) {
    return OccurrenceCalculator.occursOn(anchor, rule, day);
  }

  /**
   * Encodes the rule in its stored JSON form.
   *
   * @return the JSON text
   */
  public String toJson() {
    return RecurrenceRuleCodec.toJson(rule);
  }

  /**
   * Returns the anchor.
   *
   * @return the anchor
   */
  public Anchor anchor() {
    return anchor;
  }

  /**
   * Returns the rule.
   *
   * @return the rule
   */
  public RecurrenceRule rule() {
    return rule;
  }

  /**
   * Returns the human-readable description of the rule.
   *
   * @return the description
   */
  @Override
  public String toString() {
    return RecurrenceFormatter.format(rule);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Recurrence other
        && anchor.equals(other.anchor) && rule.equals(other.rule);
  }

  @Override
  public int hashCode() {
    return Objects.hash(anchor, rule);
  }
}
