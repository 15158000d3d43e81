package io.anchor.display;

import io.anchor.rule.CustomDays;
import io.anchor.rule.Daily;
import io.anchor.rule.Monthly;
import io.anchor.rule.NthWeekday;
import io.anchor.rule.RecurrenceRule;
import io.anchor.rule.SpecificDays;
import io.anchor.rule.Weekday;
import io.anchor.rule.Weekly;
import java.util.Set;
import java.util.stream.Collectors;

/** Renders recurrence rules as short English phrases, e.g. "Monthly on the 2nd Monday". */
public final class RecurrenceFormatter {
  private RecurrenceFormatter() {}

  /**
   * Renders a rule. Never fails; degenerate rules still get a label.
   *
   * @param rule the rule to render
   * @return the human-readable description
   */
  public static String format(RecurrenceRule rule) {
    String text = renderRule(rule);
    if (rule.endDate() != null) {
      return text + " until " + rule.endDate();
    }
    return text;
  }

  private static String renderRule(RecurrenceRule rule) {
    return switch (rule.type()) {
      case NONE -> "Does not repeat";
      case DAILY -> renderDaily((Daily) rule);
      case WEEKLY -> renderWeekly((Weekly) rule);
      case MONTHLY -> renderMonthly((Monthly) rule);
      case YEARLY -> "Every year";
      case CUSTOM_DAYS -> renderCustomDays((CustomDays) rule);
      case NTH_WEEKDAY -> renderNthWeekday((NthWeekday) rule);
      case SPECIFIC_DAYS -> renderSpecificDays((SpecificDays) rule);
    };
  }

  private static String renderDaily(Daily rule) {
    if (rule.interval() > 1) {
      return String.format("Every %d days", rule.interval());
    }
    return "Every day";
  }

  private static String renderWeekly(Weekly rule) {
    Set<Weekday> days = rule.daysOfWeek();
    if (days == null || days.isEmpty()) {
      return "Every week";
    }
    if (days.size() == 7) {
      return "Every day";
    }
    if (days.equals(SpecificDays.WEEKDAYS)) {
      return "Every weekday";
    }
    return "Weekly on " + formatDayList(days);
  }

  private static String renderMonthly(Monthly rule) {
    if (rule.dayOfMonth() == null) {
      return "Every month";
    }
    return "Monthly on the " + ordinalNumber(rule.dayOfMonth());
  }

  private static String renderCustomDays(CustomDays rule) {
    int n = rule.interval();
    return String.format("Every %d day%s", n, n > 1 ? "s" : "");
  }

  private static String renderNthWeekday(NthWeekday rule) {
    String ordinal = rule.n() == -1 ? "last" : ordinalNumber(rule.n());
    return String.format("Monthly on the %s %s", ordinal, rule.weekday());
  }

  private static String renderSpecificDays(SpecificDays rule) {
    Set<Weekday> days = rule.daysOfWeek();
    if (days.size() == 7) {
      return "Every day";
    }
    if (days.equals(SpecificDays.WEEKDAYS)) {
      return "Every weekday";
    }
    return "Every " + formatDayList(days);
  }

  private static String formatDayList(Set<Weekday> days) {
    return days.stream().map(Weekday::shortName).collect(Collectors.joining(", "));
  }

  /**
   * Returns a number with its English ordinal suffix, e.g. 1st, 12th, 22nd.
   *
   * @param n the number
   * @return the ordinal form
   */
  public static String ordinalNumber(int n) {
    return n + ordinalSuffix(n);
  }

  private static String ordinalSuffix(int n) {
    int mod100 = n % 100;
    if (mod100 >= 11 && mod100 <= 13) {
      return "th";
    }
    return switch (n % 10) {
      case 1 -> "st";
      case 2 -> "nd";
      case 3 -> "rd";
      default -> "th";
    };
  }
}
