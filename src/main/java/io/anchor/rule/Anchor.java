package io.anchor.rule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * The date and time a reminder was originally set for. Every occurrence carries the anchor's time
 * of day.
 *
 * @param date the anchor date
 * @param time the anchor time of day
 */
public record Anchor(LocalDate date, TimeOfDay time) {
  /** Rejects missing components. */
  public Anchor {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(time, "time");
  }

  /**
   * Creates an anchor from a local date-time, dropping seconds.
   *
   * @param dateTime the anchor instant
   * @return a new anchor
   */
  public static Anchor of(LocalDateTime dateTime) {
    return new Anchor(dateTime.toLocalDate(), TimeOfDay.of(dateTime.toLocalTime()));
  }

  /**
   * Creates an anchor from its components.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of month
   * @param hour the hour
   * @param minute the minute
   * @return a new anchor
   */
  public static Anchor of(int year, int month, int day, int hour, int minute) {
    return new Anchor(LocalDate.of(year, month, day), new TimeOfDay(hour, minute));
  }

  /**
   * Returns the anchor's time of day on the given date.
   *
   * @param day the date
   * @return the date at the anchor's time
   */
  public LocalDateTime on(LocalDate day) {
    return day.atTime(time.toLocalTime());
  }

  /**
   * Returns the anchor as a local date-time.
   *
   * @return the anchor instant
   */
  public LocalDateTime toLocalDateTime() {
    return on(date);
  }

  @Override
  public String toString() {
    return date + " " + time;
  }
}
