package io.anchor.rule;

import io.anchor.RecurrenceException;
import java.time.LocalTime;

/**
 * Represents a wall-clock time of day (hour and minute).
 *
 * @param hour the hour (0-23)
 * @param minute the minute (0-59)
 */
public record TimeOfDay(int hour, int minute) {
  /** Validates the hour and minute ranges. */
  public TimeOfDay {
    if (hour < 0 || hour > 23) {
      throw RecurrenceException.invalidRule("hour", "hour must be 0-23, got " + hour);
    }
    if (minute < 0 || minute > 59) {
      throw RecurrenceException.invalidRule("minute", "minute must be 0-59, got " + minute);
    }
  }

  /**
   * Returns the hour and minute of a local time, dropping seconds.
   *
   * @param time the local time
   * @return the time of day
   */
  public static TimeOfDay of(LocalTime time) {
    return new TimeOfDay(time.getHour(), time.getMinute());
  }

  /**
   * Converts this time to a java.time.LocalTime.
   *
   * @return the local time with zero seconds
   */
  public LocalTime toLocalTime() {
    return LocalTime.of(hour, minute);
  }

  @Override
  public String toString() {
    return String.format("%02d:%02d", hour, minute);
  }
}
