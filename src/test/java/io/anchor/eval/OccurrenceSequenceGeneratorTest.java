package io.anchor.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.anchor.rule.Anchor;
import io.anchor.rule.CustomDays;
import io.anchor.rule.Daily;
import io.anchor.rule.Monthly;
import io.anchor.rule.NoRecurrence;
import io.anchor.rule.NthWeekday;
import io.anchor.rule.RecurrenceRule;
import io.anchor.rule.SpecificDays;
import io.anchor.rule.Weekday;
import io.anchor.rule.Weekly;
import io.anchor.rule.Yearly;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/**
 * Sequence behaviour beyond the conformance fixture:
 *
 * <ul>
 *   <li>purity and ordering
 *   <li>laziness and early termination
 *   <li>range queries
 * </ul>
 */
class OccurrenceSequenceGeneratorTest {

  private static final Anchor ANCHOR = Anchor.of(2024, 1, 31, 9, 0);

  private static final List<RecurrenceRule> RULES =
      List.of(
          Daily.everyDay(),
          Daily.every(2),
          Weekly.on(Weekday.SUNDAY),
          Monthly.onDay(31),
          Yearly.everyYear(),
          CustomDays.every(9),
          NthWeekday.of(-1, Weekday.FRIDAY),
          NthWeekday.of(5, Weekday.WEDNESDAY),
          SpecificDays.weekdays());

  // =========================================================================
  // Ordering and purity
  // =========================================================================

  @Test
  void sequencesAreStrictlyIncreasing() {
    for (RecurrenceRule rule : RULES) {
      List<LocalDateTime> occurrences = OccurrenceSequenceGenerator.generateList(ANCHOR, rule, 60);
      assertEquals(60, occurrences.size(), rule.toString());
      for (int i = 1; i < occurrences.size(); i++) {
        assertTrue(
            occurrences.get(i).isAfter(occurrences.get(i - 1)),
            rule + " at index " + i + ": " + occurrences);
      }
    }
  }

  @Test
  void sequencesStartWithAnchor() {
    for (RecurrenceRule rule : RULES) {
      List<LocalDateTime> occurrences = OccurrenceSequenceGenerator.generateList(ANCHOR, rule, 1);
      assertEquals(List.of(ANCHOR.toLocalDateTime()), occurrences);
    }
  }

  @Test
  void sameArgumentsGiveSameSequence() {
    for (RecurrenceRule rule : RULES) {
      assertEquals(
          OccurrenceSequenceGenerator.generateList(ANCHOR, rule, 12),
          OccurrenceSequenceGenerator.generateList(ANCHOR, rule, 12));
    }
  }

  @Test
  void noneYieldsOnlyAnchor() {
    assertEquals(
        List.of(ANCHOR.toLocalDateTime()),
        OccurrenceSequenceGenerator.generateList(ANCHOR, NoRecurrence.instance(), 10));
  }

  @Test
  void emptyWeeklyStopsAfterAnchor() {
    // an explicit empty day set, unlike an absent one, never fires
    assertEquals(
        List.of(ANCHOR.toLocalDateTime()),
        OccurrenceSequenceGenerator.generateList(ANCHOR, Weekly.on(Set.of()), 10));
  }

  @Test
  void weeklyWithoutDaysRepeatsOnAnchorWeekday() {
    // 2024-01-31 is a Wednesday
    assertEquals(
        List.of(
            LocalDateTime.of(2024, 1, 31, 9, 0),
            LocalDateTime.of(2024, 2, 7, 9, 0),
            LocalDateTime.of(2024, 2, 14, 9, 0),
            LocalDateTime.of(2024, 2, 21, 9, 0),
            LocalDateTime.of(2024, 2, 28, 9, 0)),
        OccurrenceSequenceGenerator.generateList(
            ANCHOR, Weekly.sameDay(), OccurrenceSequenceGenerator.DEFAULT_PREVIEW_COUNT));
  }

  @Test
  void countIsUpperBound() {
    RecurrenceRule rule = Daily.everyDay().withEndDate(LocalDate.of(2024, 2, 2));
    assertEquals(3, OccurrenceSequenceGenerator.generateList(ANCHOR, rule, 100).size());
    assertEquals(2, OccurrenceSequenceGenerator.generateList(ANCHOR, rule, 2).size());
  }

  @Test
  void negativeCountRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> OccurrenceSequenceGenerator.generate(ANCHOR, Daily.everyDay(), -1));
  }

  // =========================================================================
  // Laziness
  // =========================================================================

  @Test
  void generateIsLazy() {
    // A huge count must not be evaluated up front
    List<LocalDateTime> first =
        OccurrenceSequenceGenerator.generate(ANCHOR, Daily.everyDay(), Integer.MAX_VALUE)
            .limit(3)
            .collect(Collectors.toList());
    assertEquals(
        List.of(
            LocalDateTime.of(2024, 1, 31, 9, 0),
            LocalDateTime.of(2024, 2, 1, 9, 0),
            LocalDateTime.of(2024, 2, 2, 9, 0)),
        first);
  }

  @Test
  void worksWithStreamOperations() {
    long saturdays =
        OccurrenceSequenceGenerator.generate(ANCHOR, Daily.everyDay(), 28)
            .filter(t -> t.getDayOfWeek().getValue() == 6)
            .count();
    assertEquals(4, saturdays);
  }

  // =========================================================================
  // Range queries
  // =========================================================================

  @Test
  void betweenIsExclusiveInclusive() {
    Anchor anchor = Anchor.of(2024, 3, 4, 8, 0);
    List<LocalDateTime> range =
        OccurrenceSequenceGenerator.between(
            anchor,
            SpecificDays.on(Weekday.MONDAY, Weekday.WEDNESDAY, Weekday.FRIDAY),
            LocalDateTime.of(2024, 3, 4, 8, 0),
            LocalDateTime.of(2024, 3, 11, 8, 0));
    assertEquals(
        List.of(
            LocalDateTime.of(2024, 3, 6, 8, 0),
            LocalDateTime.of(2024, 3, 8, 8, 0),
            LocalDateTime.of(2024, 3, 11, 8, 0)),
        range);
  }

  @Test
  void betweenBeforeAnchorIsEmpty() {
    assertTrue(
        OccurrenceSequenceGenerator.between(
                ANCHOR,
                Daily.everyDay(),
                LocalDateTime.of(2023, 1, 1, 0, 0),
                LocalDateTime.of(2023, 12, 31, 0, 0))
            .isEmpty());
  }

  @Test
  void betweenYearsAfterAnchor() {
    Anchor anchor = Anchor.of(2024, 1, 1, 9, 0);
    List<LocalDateTime> range =
        OccurrenceSequenceGenerator.between(
            anchor,
            Daily.everyDay(),
            LocalDateTime.of(2027, 1, 1, 0, 0),
            LocalDateTime.of(2027, 1, 10, 0, 0));
    assertEquals(9, range.size());
    assertEquals(LocalDateTime.of(2027, 1, 1, 9, 0), range.get(0));
    assertEquals(LocalDateTime.of(2027, 1, 9, 9, 0), range.get(8));
  }

  @Test
  void betweenFarRangeForEveryRule() {
    LocalDateTime from = LocalDateTime.of(2040, 6, 1, 0, 0);
    LocalDateTime to = LocalDateTime.of(2041, 6, 1, 0, 0);
    for (RecurrenceRule rule : RULES) {
      List<LocalDateTime> range = OccurrenceSequenceGenerator.between(ANCHOR, rule, from, to);
      assertFalse(range.isEmpty(), rule.toString());
      assertTrue(range.get(0).isAfter(from), rule.toString());
      assertFalse(range.get(range.size() - 1).isAfter(to), rule.toString());
    }
  }

  @Test
  void betweenIncludesAnchorInRange() {
    List<LocalDateTime> range =
        OccurrenceSequenceGenerator.between(
            ANCHOR,
            Monthly.onDay(31),
            LocalDateTime.of(2024, 1, 1, 0, 0),
            LocalDateTime.of(2024, 3, 1, 0, 0));
    assertEquals(
        List.of(LocalDateTime.of(2024, 1, 31, 9, 0), LocalDateTime.of(2024, 2, 29, 9, 0)), range);
  }

  @Test
  void betweenForNoneOnlyCoversAnchor() {
    assertEquals(
        List.of(ANCHOR.toLocalDateTime()),
        OccurrenceSequenceGenerator.between(
            ANCHOR,
            NoRecurrence.instance(),
            LocalDateTime.of(2024, 1, 1, 0, 0),
            LocalDateTime.of(2030, 1, 1, 0, 0)));
    assertTrue(
        OccurrenceSequenceGenerator.between(
                ANCHOR,
                NoRecurrence.instance(),
                LocalDateTime.of(2024, 2, 1, 0, 0),
                LocalDateTime.of(2030, 1, 1, 0, 0))
            .isEmpty());
  }
}
