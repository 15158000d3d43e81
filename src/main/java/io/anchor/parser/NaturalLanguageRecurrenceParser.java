package io.anchor.parser;

import io.anchor.rule.RecurrenceRule;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort extraction of a recurrence rule from free text such as "remind me every second
 * Monday".
 *
 * <p>Matching is case-insensitive and tries each {@link RecurrencePattern} in declaration order;
 * the first match wins. Text with no recognizable phrase yields an empty result, never an error.
 */
public final class NaturalLanguageRecurrenceParser {
  private static final Logger log = LoggerFactory.getLogger(NaturalLanguageRecurrenceParser.class);

  private static final List<RecurrencePattern> PATTERNS = List.of(RecurrencePattern.values());

  private NaturalLanguageRecurrenceParser() {}

  /**
   * Parses free text into a recurrence rule.
   *
   * @param text the text to scan (may be null)
   * @return the rule for the first recognized phrase, or empty
   */
  public static Optional<RecurrenceRule> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String normalized = text.toLowerCase(Locale.ROOT).trim();

    for (RecurrencePattern pattern : PATTERNS) {
      Optional<RecurrenceRule> rule = pattern.match(normalized);
      if (rule.isPresent()) {
        log.debug("Matched {} in \"{}\"", pattern, text);
        return rule;
      }
    }

    log.debug("No recurrence phrase in \"{}\"", text);
    return Optional.empty();
  }

  /**
   * Returns the pattern that {@link #parse} would use for the text.
   *
   * @param text the text to scan (may be null)
   * @return the first matching pattern, or empty
   */
  public static Optional<RecurrencePattern> matchingPattern(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String normalized = text.toLowerCase(Locale.ROOT).trim();
    return PATTERNS.stream().filter(p -> p.match(normalized).isPresent()).findFirst();
  }
}
