package io.anchor.rule;

import java.time.DayOfWeek;
import java.util.Map;
import java.util.Optional;

/** Represents a day of the week. */
public enum Weekday {
  MONDAY(1, "Monday", "Mon"),
  TUESDAY(2, "Tuesday", "Tue"),
  WEDNESDAY(3, "Wednesday", "Wed"),
  THURSDAY(4, "Thursday", "Thu"),
  FRIDAY(5, "Friday", "Fri"),
  SATURDAY(6, "Saturday", "Sat"),
  SUNDAY(7, "Sunday", "Sun");

  private final int isoNumber;
  private final String displayName;
  private final String shortName;

  Weekday(int isoNumber, String displayName, String shortName) {
    this.isoNumber = isoNumber;
    this.displayName = displayName;
    this.shortName = shortName;
  }

  /**
   * Returns the stored day index used by persisted rules (Sunday=0, Monday=1, ..., Saturday=6).
   *
   * @return the stored day index
   */
  public int storedIndex() {
    return switch (this) {
      case SUNDAY -> 0;
      case MONDAY -> 1;
      case TUESDAY -> 2;
      case WEDNESDAY -> 3;
      case THURSDAY -> 4;
      case FRIDAY -> 5;
      case SATURDAY -> 6;
    };
  }

  /**
   * Returns the three-letter name, e.g. "Mon".
   *
   * @return the short name
   */
  public String shortName() {
    return shortName;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, Weekday> PARSE_MAP =
      Map.ofEntries(
          Map.entry("monday", MONDAY), Map.entry("mon", MONDAY),
          Map.entry("tuesday", TUESDAY), Map.entry("tue", TUESDAY),
          Map.entry("wednesday", WEDNESDAY), Map.entry("wed", WEDNESDAY),
          Map.entry("thursday", THURSDAY), Map.entry("thu", THURSDAY),
          Map.entry("friday", FRIDAY), Map.entry("fri", FRIDAY),
          Map.entry("saturday", SATURDAY), Map.entry("sat", SATURDAY),
          Map.entry("sunday", SUNDAY), Map.entry("sun", SUNDAY));

  /**
   * Parses a weekday name (case insensitive).
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toLowerCase()));
  }

  /**
   * Returns a Weekday from a stored day index (Sunday=0 .. Saturday=6).
   *
   * @param index the stored day index
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromStoredIndex(int index) {
    if (index < 0 || index > 6) {
      return Optional.empty();
    }
    return Optional.of(index == 0 ? SUNDAY : values()[index - 1]);
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return values()[dow.getValue() - 1];
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public DayOfWeek toDayOfWeek() {
    return DayOfWeek.of(isoNumber);
  }
}
