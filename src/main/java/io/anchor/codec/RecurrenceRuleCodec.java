package io.anchor.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.anchor.ErrorKind;
import io.anchor.RecurrenceException;
import io.anchor.rule.CustomDays;
import io.anchor.rule.Daily;
import io.anchor.rule.Monthly;
import io.anchor.rule.NoRecurrence;
import io.anchor.rule.NthWeekday;
import io.anchor.rule.OrdinalPosition;
import io.anchor.rule.RecurrenceRule;
import io.anchor.rule.RecurrenceType;
import io.anchor.rule.SpecificDays;
import io.anchor.rule.Weekday;
import io.anchor.rule.Weekly;
import io.anchor.rule.Yearly;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts recurrence rules to and from their stored JSON form.
 *
 * <p>The stored form is an object tagged by {@code type}:
 *
 * <pre>{@code
 * {"type":"specific_days","daysOfWeek":[1,3,5],"endDate":"2024-12-31"}
 * {"type":"nth_weekday","nthWeekday":{"n":-1,"weekday":5}}
 * {"type":"custom_days","interval":3,"count":10}
 * }</pre>
 *
 * <p>Weekdays are stored as 0 (Sunday) to 6 (Saturday). A missing or zero {@code interval} reads
 * as 1. A weekly rule without {@code daysOfWeek} fires on the anchor's weekday, while an empty
 * array never fires. Encoding then decoding returns an equal rule.
 */
public final class RecurrenceRuleCodec {
  private static final Logger log = LoggerFactory.getLogger(RecurrenceRuleCodec.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private RecurrenceRuleCodec() {}

  /**
   * Encodes a rule as a JSON string.
   *
   * @param rule the rule
   * @return the JSON text
   */
  public static String toJson(RecurrenceRule rule) {
    try {
      return MAPPER.writeValueAsString(toTree(rule));
    } catch (JsonProcessingException e) {
      // a tree of plain scalars always serializes
      throw new IllegalStateException("cannot serialize rule " + rule, e);
    }
  }

  /**
   * Decodes a rule from a JSON string.
   *
   * @param json the JSON text
   * @return the rule
   * @throws RecurrenceException if the text is not a valid stored rule
   */
  public static RecurrenceRule fromJson(String json) {
    JsonNode node;
    try {
      node = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      log.debug("Unreadable recurrence JSON: {}", e.getOriginalMessage());
      throw RecurrenceException.decode("malformed JSON: " + e.getOriginalMessage(), e);
    }
    return fromTree(node);
  }

  /**
   * Encodes a rule as a JSON tree.
   *
   * @param rule the rule
   * @return the JSON object
   */
  public static ObjectNode toTree(RecurrenceRule rule) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("type", rule.type().value());

    switch (rule.type()) {
      case NONE, YEARLY -> {}
      case DAILY -> node.put("interval", ((Daily) rule).interval());
      case CUSTOM_DAYS -> node.put("interval", ((CustomDays) rule).interval());
      case WEEKLY -> {
        Weekly weekly = (Weekly) rule;
        node.put("interval", weekly.interval());
        if (weekly.daysOfWeek() != null) {
          writeDays(node, weekly.daysOfWeek());
        }
      }
      case SPECIFIC_DAYS -> writeDays(node, ((SpecificDays) rule).daysOfWeek());
      case MONTHLY -> {
        Integer day = ((Monthly) rule).dayOfMonth();
        if (day != null) {
          node.put("dayOfMonth", day);
        }
      }
      case NTH_WEEKDAY -> {
        NthWeekday nth = (NthWeekday) rule;
        ObjectNode nthNode = node.putObject("nthWeekday");
        nthNode.put("n", nth.n());
        nthNode.put("weekday", nth.weekday().storedIndex());
      }
    }

    if (rule.endDate() != null) {
      node.put("endDate", rule.endDate().toString());
    }
    if (rule.count() != null) {
      node.put("count", rule.count());
    }
    return node;
  }

  /**
   * Decodes a rule from a JSON tree.
   *
   * @param node the JSON object
   * @return the rule
   * @throws RecurrenceException if the tree is not a valid stored rule
   */
  public static RecurrenceRule fromTree(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw RecurrenceException.decode("recurrence rule must be a JSON object");
    }
    JsonNode typeNode = node.get("type");
    if (typeNode == null || !typeNode.isTextual()) {
      throw RecurrenceException.decode("missing recurrence type");
    }
    RecurrenceType type =
        RecurrenceType.parse(typeNode.asText())
            .orElseThrow(
                () -> RecurrenceException.decode("unknown recurrence type: " + typeNode.asText()));

    LocalDate endDate = readEndDate(node);
    Integer count = readOptionalInt(node, "count");

    try {
      return switch (type) {
        case NONE -> new NoRecurrence(endDate, count);
        case DAILY -> new Daily(readInterval(node), endDate, count);
        case WEEKLY -> new Weekly(readInterval(node), readDays(node), endDate, count);
        case MONTHLY -> new Monthly(readOptionalInt(node, "dayOfMonth"), endDate, count);
        case YEARLY -> new Yearly(endDate, count);
        case CUSTOM_DAYS -> new CustomDays(readInterval(node), endDate, count);
        case NTH_WEEKDAY -> readNthWeekday(node, endDate, count);
        case SPECIFIC_DAYS -> new SpecificDays(readDays(node), endDate, count);
      };
    } catch (RecurrenceException e) {
      if (e.kind() == ErrorKind.DECODE) {
        throw e;
      }
      log.debug("Stored {} rule violates its invariants: {}", type, e.getMessage());
      throw RecurrenceException.decode("invalid " + type + " rule: " + e.getMessage(), e);
    }
  }

  private static void writeDays(ObjectNode node, Set<Weekday> days) {
    ArrayNode array = node.putArray("daysOfWeek");
    for (Weekday day : days) {
      array.add(day.storedIndex());
    }
  }

  private static NthWeekday readNthWeekday(JsonNode node, LocalDate endDate, Integer count) {
    JsonNode spec = node.get("nthWeekday");
    if (spec == null || !spec.isObject()) {
      throw RecurrenceException.decode("nth_weekday rule requires an nthWeekday object");
    }
    Integer n = readOptionalInt(spec, "n");
    Integer weekday = readOptionalInt(spec, "weekday");
    if (n == null || weekday == null) {
      throw RecurrenceException.decode("nthWeekday requires n and weekday");
    }
    return new NthWeekday(OrdinalPosition.fromN(n), storedWeekday(weekday), endDate, count);
  }

  private static int readInterval(JsonNode node) {
    Integer interval = readOptionalInt(node, "interval");
    return interval == null || interval == 0 ? 1 : interval;
  }

  /** Returns null when the field is absent, so weekly rules can fall back to the anchor. */
  private static Set<Weekday> readDays(JsonNode node) {
    JsonNode array = node.get("daysOfWeek");
    if (array == null || array.isNull()) {
      return null;
    }
    if (!array.isArray()) {
      throw RecurrenceException.decode("daysOfWeek must be an array");
    }
    Set<Weekday> days = EnumSet.noneOf(Weekday.class);
    for (JsonNode element : array) {
      if (!element.isNumber()
          || !element.canConvertToExactIntegral()
          || !element.canConvertToInt()) {
        throw RecurrenceException.decode("daysOfWeek entries must be integers, got " + element);
      }
      days.add(storedWeekday(element.intValue()));
    }
    return days;
  }

  private static Weekday storedWeekday(int index) {
    return Weekday.fromStoredIndex(index)
        .orElseThrow(() -> RecurrenceException.decode("weekday must be 0-6, got " + index));
  }

  private static Integer readOptionalInt(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isNumber() || !value.canConvertToExactIntegral() || !value.canConvertToInt()) {
      throw RecurrenceException.decode(field + " must be an integer, got " + value);
    }
    return value.intValue();
  }

  private static LocalDate readEndDate(JsonNode node) {
    JsonNode value = node.get("endDate");
    if (value == null || value.isNull()) {
      return null;
    }
    String text = value.asText();
    try {
      // stored end dates may carry a time part, only the date counts
      return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
    } catch (DateTimeParseException e) {
      throw RecurrenceException.decode("endDate must be an ISO date, got " + text, e);
    }
  }
}
