package org.waabox.outagewatch.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One outage event: a maximal run of consecutive days on which a generator
 * was reported out of service.
 *
 * <p>The interval is half-open: {@code outageEnd} is midnight of the day
 * after the last observed day.
 *
 * @param outageKey          the surrogate key, unique within one build
 * @param plantKey           the plant of the event
 * @param dateKey            the {@code yyyyMMdd} key of the start date
 * @param generator          the generator identifier, never null
 * @param outageStart        midnight of the first day, never null
 * @param outageEnd          midnight after the last day, never null
 * @param durationHours      the length of the interval in hours
 * @param capacityAffectedMw the largest outage in MW seen during the event,
 *                           null when the feed did not report one
 * @param eiaOutageId        {@code <facility>-<generator>-<dateKey>}
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FactOutage(
    int outageKey,
    int plantKey,
    int dateKey,
    String generator,
    LocalDateTime outageStart,
    LocalDateTime outageEnd,
    double durationHours,
    Double capacityAffectedMw,
    String eiaOutageId
) {

  /** Validates required fields. */
  public FactOutage {
    Objects.requireNonNull(generator, "generator must not be null");
    Objects.requireNonNull(outageStart, "outageStart must not be null");
    Objects.requireNonNull(outageEnd, "outageEnd must not be null");
    Objects.requireNonNull(eiaOutageId, "eiaOutageId must not be null");
  }
}
