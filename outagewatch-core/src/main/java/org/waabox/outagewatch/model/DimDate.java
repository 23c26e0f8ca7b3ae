package org.waabox.outagewatch.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One calendar date of the star schema.
 *
 * <p>The surrogate key is the date itself encoded as {@code yyyyMMdd}, so it
 * is stable across builds even though the table is rebuilt every time.
 *
 * @param dateKey   the {@code yyyyMMdd} key
 * @param date      the calendar date, never null
 * @param year      the year
 * @param month     the month, 1 to 12
 * @param day       the day of month
 * @param dayOfWeek the English day name, e.g. {@code Monday}
 * @param weekend   whether the date falls on Saturday or Sunday
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DimDate(
    int dateKey,
    LocalDate date,
    int year,
    int month,
    int day,
    String dayOfWeek,
    boolean weekend
) {

  /** Validates required fields. */
  public DimDate {
    Objects.requireNonNull(date, "date must not be null");
    Objects.requireNonNull(dayOfWeek, "dayOfWeek must not be null");
  }

  /**
   * Creates the row for the given date.
   *
   * @param date the calendar date, never null
   * @return the date row, never null
   */
  public static DimDate of(final LocalDate date) {
    Objects.requireNonNull(date, "date must not be null");
    final DayOfWeek dow = date.getDayOfWeek();
    final String name = dow.name().charAt(0)
        + dow.name().substring(1).toLowerCase();
    return new DimDate(keyOf(date), date, date.getYear(),
        date.getMonthValue(), date.getDayOfMonth(), name,
        dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY);
  }

  /**
   * Encodes a date as its {@code yyyyMMdd} key.
   *
   * @param date the calendar date, never null
   * @return the key, e.g. {@code 20250131}
   */
  public static int keyOf(final LocalDate date) {
    return date.getYear() * 10_000 + date.getMonthValue() * 100
        + date.getDayOfMonth();
  }
}
