package io.anchor.rule;

import io.anchor.RecurrenceException;
import java.util.Map;
import java.util.Optional;

/** Represents which occurrence of a weekday within a month (first, second, ..., last). */
public enum OrdinalPosition {
  FIRST(1, "first"),
  SECOND(2, "second"),
  THIRD(3, "third"),
  FOURTH(4, "fourth"),
  FIFTH(5, "fifth"),
  LAST(-1, "last");

  private final int number;
  private final String displayName;

  OrdinalPosition(int number, String displayName) {
    this.number = number;
    this.displayName = displayName;
  }

  /**
   * Returns the ordinal as a number (1-5, or -1 for Last).
   *
   * @return the ordinal number
   */
  public int toN() {
    return number;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, OrdinalPosition> PARSE_MAP =
      Map.ofEntries(
          Map.entry("first", FIRST), Map.entry("1st", FIRST),
          Map.entry("second", SECOND), Map.entry("2nd", SECOND),
          Map.entry("third", THIRD), Map.entry("3rd", THIRD),
          Map.entry("fourth", FOURTH), Map.entry("4th", FOURTH),
          Map.entry("fifth", FIFTH), Map.entry("5th", FIFTH),
          Map.entry("last", LAST));

  /**
   * Parses an ordinal word or numeral (case insensitive), e.g. "second" or "2nd".
   *
   * @param s the string to parse
   * @return the ordinal position if valid
   */
  public static Optional<OrdinalPosition> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toLowerCase()));
  }

  /**
   * Returns the position for a numeric ordinal.
   *
   * @param n 1 to 5, or -1 for the last occurrence
   * @return the ordinal position
   * @throws RecurrenceException if n is outside 1..5 and not -1
   */
  public static OrdinalPosition fromN(int n) {
    for (OrdinalPosition p : values()) {
      if (p.number == n) {
        return p;
      }
    }
    throw RecurrenceException.invalidRule("n", "n must be -1 (last) or 1-5, got " + n);
  }
}
