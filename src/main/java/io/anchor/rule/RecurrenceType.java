package io.anchor.rule;

import java.util.Map;
import java.util.Optional;

/** The persisted type tag of a recurrence rule. */
public enum RecurrenceType {
  NONE("none"),
  DAILY("daily"),
  WEEKLY("weekly"),
  MONTHLY("monthly"),
  YEARLY("yearly"),
  CUSTOM_DAYS("custom_days"),
  NTH_WEEKDAY("nth_weekday"),
  SPECIFIC_DAYS("specific_days");

  private final String value;

  RecurrenceType(String value) {
    this.value = value;
  }

  /**
   * Returns the tag as stored, e.g. "custom_days".
   *
   * @return the stored tag
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }

  private static final Map<String, RecurrenceType> PARSE_MAP =
      Map.of(
          "none", NONE,
          "daily", DAILY,
          "weekly", WEEKLY,
          "monthly", MONTHLY,
          "yearly", YEARLY,
          "custom_days", CUSTOM_DAYS,
          "nth_weekday", NTH_WEEKDAY,
          "specific_days", SPECIFIC_DAYS);

  /**
   * Parses a stored tag.
   *
   * @param s the tag
   * @return the type if known
   */
  public static Optional<RecurrenceType> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s));
  }
}
