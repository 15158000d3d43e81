package io.anchor.parser;

import io.anchor.rule.CustomDays;
import io.anchor.rule.Daily;
import io.anchor.rule.Monthly;
import io.anchor.rule.NthWeekday;
import io.anchor.rule.OrdinalPosition;
import io.anchor.rule.RecurrenceRule;
import io.anchor.rule.SpecificDays;
import io.anchor.rule.Weekday;
import io.anchor.rule.Weekly;
import io.anchor.rule.Yearly;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The phrases recognized by {@link NaturalLanguageRecurrenceParser}, in priority order.
 *
 * <p>Declaration order is the matching order: specific phrases (explicit day lists, ordinal
 * weekdays) come before the generic "weekly" and "monthly" so that "every Friday" is never read as
 * a bare weekly rule. Each constant expects lowercase input.
 */
public enum RecurrencePattern {
  /** "every 3 days" - custom interval counted from the anchor. */
  EVERY_N_DAYS {
    private final Pattern pattern = Pattern.compile("\\bevery\\s+(\\d{1,5})\\s+days?\\b");

    @Override
    public Optional<RecurrenceRule> match(String text) {
      Matcher m = pattern.matcher(text);
      if (!m.find()) {
        return Optional.empty();
      }
      int interval = Integer.parseInt(m.group(1));
      if (interval < 1) {
        return Optional.empty();
      }
      return Optional.of(CustomDays.every(interval));
    }
  },

  /** "every day", "everyday", "daily". */
  DAILY {
    private final Pattern pattern = Pattern.compile("\\b(?:every\\s+day|everyday|daily)\\b");

    @Override
    public Optional<RecurrenceRule> match(String text) {
      return pattern.matcher(text).find() ? Optional.of(Daily.everyDay()) : Optional.empty();
    }
  },

  /** "weekdays", "every week day" - Monday to Friday. */
  WEEKDAYS {
    private final Pattern pattern = Pattern.compile("\\bweek\\s?days?\\b");

    @Override
    public Optional<RecurrenceRule> match(String text) {
      return pattern.matcher(text).find()
          ? Optional.of(SpecificDays.weekdays())
          : Optional.empty();
    }
  },

  /** "weekend", "weekends" - Saturday and Sunday. */
  WEEKEND {
    private final Pattern pattern = Pattern.compile("\\bweekends?\\b");

    @Override
    public Optional<RecurrenceRule> match(String text) {
      return pattern.matcher(text).find() ? Optional.of(SpecificDays.weekend()) : Optional.empty();
    }
  },

  /**
   * "every friday", "every mon, wed and fri", "every tuesday and every thursday".
   *
   * <p>One day gives a weekly rule, several give a specific-days rule.
   */
  NAMED_WEEKDAYS {
    private final Pattern listPattern =
        Pattern.compile(
            "\\bevery\\s+(" + DAY_WORD + "(?:" + DAY_SEPARATOR + DAY_WORD + ")*)");

    @Override
    public Optional<RecurrenceRule> match(String text) {
      Set<Weekday> days = EnumSet.noneOf(Weekday.class);
      Matcher list = listPattern.matcher(text);
      while (list.find()) {
        Matcher day = DAY_NAME.matcher(list.group(1));
        while (day.find()) {
          Weekday.parse(day.group(1)).ifPresent(days::add);
        }
      }
      if (days.isEmpty()) {
        return Optional.empty();
      }
      if (days.size() == 1) {
        return Optional.of(Weekly.on(days));
      }
      return Optional.of(SpecificDays.on(days));
    }
  },

  /** "first monday", "2nd tuesday of the month", "last friday". */
  NTH_WEEKDAY {
    private final Pattern pattern =
        Pattern.compile(
            "\\b(first|second|third|fourth|fifth|last|1st|2nd|3rd|4th|5th)\\s+" + DAY_WORD);

    @Override
    public Optional<RecurrenceRule> match(String text) {
      Matcher m = pattern.matcher(text);
      if (!m.find()) {
        return Optional.empty();
      }
      Optional<OrdinalPosition> ordinal = OrdinalPosition.parse(m.group(1));
      Optional<Weekday> weekday = Weekday.parse(m.group(2));
      if (ordinal.isEmpty() || weekday.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(NthWeekday.of(ordinal.get(), weekday.get()));
    }
  },

  /** "weekly", "every week" - the day is taken from the anchor. */
  WEEKLY {
    private final Pattern pattern = Pattern.compile("\\b(?:weekly|every\\s+week)\\b");

    @Override
    public Optional<RecurrenceRule> match(String text) {
      return pattern.matcher(text).find() ? Optional.of(Weekly.sameDay()) : Optional.empty();
    }
  },

  /** "monthly", "every month" - the day is taken from the anchor. */
  MONTHLY {
    private final Pattern pattern = Pattern.compile("\\b(?:monthly|every\\s+month)\\b");

    @Override
    public Optional<RecurrenceRule> match(String text) {
      return pattern.matcher(text).find() ? Optional.of(Monthly.sameDay()) : Optional.empty();
    }
  },

  /** "yearly", "annually", "every year". */
  YEARLY {
    private final Pattern pattern = Pattern.compile("\\b(?:yearly|annually|every\\s+year)\\b");

    @Override
    public Optional<RecurrenceRule> match(String text) {
      return pattern.matcher(text).find() ? Optional.of(Yearly.everyYear()) : Optional.empty();
    }
  };

  /** A weekday name, full or three letters, optionally plural. Captures the bare name. */
  private static final String DAY_WORD =
      "\\b(monday|tuesday|wednesday|thursday|friday|saturday|sunday"
          + "|mon|tue|wed|thu|fri|sat|sun)s?\\b";

  /** Joins names in a list: commas, "and", "&", optionally repeating "every". */
  private static final String DAY_SEPARATOR =
      "(?:\\s*,\\s*(?:and\\s+)?|\\s*&\\s*|\\s+and\\s+|\\s+)(?:every\\s+)?";

  private static final Pattern DAY_NAME = Pattern.compile(DAY_WORD);

  /**
   * Tries this pattern against lowercase text.
   *
   * @param text the lowercase input
   * @return the rule if the pattern matches
   */
  public abstract Optional<RecurrenceRule> match(String text);
}
