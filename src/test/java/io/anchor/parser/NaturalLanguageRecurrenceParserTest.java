package io.anchor.parser;

import static org.junit.jupiter.api.Assertions.*;

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
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class NaturalLanguageRecurrenceParserTest {

  private static RecurrenceRule parse(String text) {
    return NaturalLanguageRecurrenceParser.parse(text).orElseThrow();
  }

  // =========================================================================
  // Priority
  // =========================================================================

  @Test
  void namedDayBeatsGenericWeekly() {
    assertEquals(Weekly.on(Weekday.FRIDAY), parse("every Friday"));
    assertEquals(Weekly.on(Weekday.FRIDAY), parse("weekly, every Friday"));
  }

  @Test
  void ordinalWeekdayBeatsMonthly() {
    assertEquals(NthWeekday.of(1, Weekday.MONDAY), parse("first Monday of the month"));
    assertEquals(NthWeekday.of(1, Weekday.MONDAY), parse("monthly on the first monday"));
  }

  @Test
  void explicitIntervalBeatsDaily() {
    assertEquals(CustomDays.every(2), parse("every 2 days, daily reminder"));
  }

  @Test
  void weekdaysBeatsNamedDays() {
    assertEquals(SpecificDays.weekdays(), parse("every weekday except friday"));
  }

  @Test
  void everyWeekdayRoundTrip() {
    RecurrenceRule rule = parse("every weekday");
    assertEquals(SpecificDays.on(List.of(
        Weekday.MONDAY, Weekday.TUESDAY, Weekday.WEDNESDAY, Weekday.THURSDAY, Weekday.FRIDAY)),
        rule);
  }

  @Test
  void declarationOrderIsMatchOrder() {
    assertEquals(
        List.of(
            RecurrencePattern.EVERY_N_DAYS,
            RecurrencePattern.DAILY,
            RecurrencePattern.WEEKDAYS,
            RecurrencePattern.WEEKEND,
            RecurrencePattern.NAMED_WEEKDAYS,
            RecurrencePattern.NTH_WEEKDAY,
            RecurrencePattern.WEEKLY,
            RecurrencePattern.MONTHLY,
            RecurrencePattern.YEARLY),
        List.of(RecurrencePattern.values()));
  }

  @Test
  void matchingPatternReportsWinner() {
    assertEquals(
        Optional.of(RecurrencePattern.NAMED_WEEKDAYS),
        NaturalLanguageRecurrenceParser.matchingPattern("Every Sunday and every Monday"));
    assertEquals(
        Optional.of(RecurrencePattern.NTH_WEEKDAY),
        NaturalLanguageRecurrenceParser.matchingPattern("the last Thursday"));
    assertTrue(NaturalLanguageRecurrenceParser.matchingPattern("next tuesday").isEmpty());
  }

  // =========================================================================
  // Individual patterns
  // =========================================================================

  @Test
  void everyNDays() {
    assertEquals(Optional.of(CustomDays.every(10)), RecurrencePattern.EVERY_N_DAYS.match("every 10 days"));
    assertTrue(RecurrencePattern.EVERY_N_DAYS.match("every 0 days").isEmpty());
    assertTrue(RecurrencePattern.EVERY_N_DAYS.match("every few days").isEmpty());
  }

  @Test
  void daily() {
    assertEquals(Optional.of(Daily.everyDay()), RecurrencePattern.DAILY.match("everyday at 7"));
    assertTrue(RecurrencePattern.DAILY.match("every sunday").isEmpty());
  }

  @Test
  void weekend() {
    assertEquals(Optional.of(SpecificDays.weekend()), RecurrencePattern.WEEKEND.match("weekends"));
  }

  @Test
  void namedWeekdaysAbbreviated() {
    assertEquals(
        Optional.of(SpecificDays.on(Weekday.MONDAY, Weekday.THURSDAY)),
        RecurrencePattern.NAMED_WEEKDAYS.match("every mon & thu"));
  }

  @Test
  void namedWeekdaysPlural() {
    assertEquals(
        Optional.of(Weekly.on(Weekday.SATURDAY)),
        RecurrencePattern.NAMED_WEEKDAYS.match("every saturdays"));
  }

  @Test
  void namedWeekdaysIgnoresMonth() {
    assertTrue(RecurrencePattern.NAMED_WEEKDAYS.match("every month").isEmpty());
    assertTrue(RecurrencePattern.NAMED_WEEKDAYS.match("on monday").isEmpty());
  }

  @Test
  void nthWeekdayNumerals() {
    assertEquals(
        Optional.of(NthWeekday.of(OrdinalPosition.FOURTH, Weekday.SATURDAY)),
        RecurrencePattern.NTH_WEEKDAY.match("4th sat"));
    assertEquals(
        Optional.of(NthWeekday.of(OrdinalPosition.FIFTH, Weekday.TUESDAY)),
        RecurrencePattern.NTH_WEEKDAY.match("fifth tuesday"));
  }

  @Test
  void genericWeeklyLeavesDayToAnchor() {
    assertEquals(Optional.of(Weekly.sameDay()), RecurrencePattern.WEEKLY.match("weekly"));
    assertEquals(Weekly.sameDay(), parse("remind me weekly"));
  }

  @Test
  void monthlyLeavesDayOpen() {
    assertEquals(Optional.of(Monthly.sameDay()), RecurrencePattern.MONTHLY.match("every month"));
  }

  @Test
  void yearly() {
    assertEquals(Optional.of(Yearly.everyYear()), RecurrencePattern.YEARLY.match("annually"));
  }

  // =========================================================================
  // No match
  // =========================================================================

  @Test
  void unrecognizedTextIsEmpty() {
    assertTrue(NaturalLanguageRecurrenceParser.parse("dentist tomorrow at 3pm").isEmpty());
    assertTrue(NaturalLanguageRecurrenceParser.parse("every 99999999 days").isEmpty());
    assertTrue(NaturalLanguageRecurrenceParser.parse("   ").isEmpty());
    assertTrue(NaturalLanguageRecurrenceParser.parse(null).isEmpty());
  }

  @Test
  void caseInsensitive() {
    assertEquals(Yearly.everyYear(), parse("EVERY YEAR"));
    assertEquals(NthWeekday.of(-1, Weekday.FRIDAY), parse("Last FRIDAY"));
  }
}
