package org.waabox.outagewatch.query;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of the joined outage view: a fact with its plant and start date
 * attributes resolved.
 *
 * <p>The JSON names follow the star-schema column names.
 *
 * @param outageKey          the fact surrogate key
 * @param eiaOutageId        the readable event identifier, never null
 * @param plantKey           the plant surrogate key
 * @param facilityId         the EIA facility identifier, never null
 * @param plantName          the plant name, may be null
 * @param generator          the generator identifier, never null
 * @param unitName           {@code "Unit <generator>"}, never null
 * @param dateKey            the start date key
 * @param date               the start date, never null
 * @param outageStart        the inclusive start timestamp, never null
 * @param outageEnd          the exclusive end timestamp, never null
 * @param durationHours      the event length in hours
 * @param capacityAffectedMw the peak outage in MW, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonPropertyOrder({"OutageKey", "EIA_OutageID", "PlantKey",
    "EIA_FacilityID", "PlantName", "Generator", "UnitName", "DateKey", "Date",
    "OutageStartTimestamp", "OutageEndTimestamp", "OutageDurationHours",
    "CapacityAffectedMW"})
public record OutageView(
    @JsonProperty("OutageKey") int outageKey,
    @JsonProperty("EIA_OutageID") String eiaOutageId,
    @JsonProperty("PlantKey") int plantKey,
    @JsonProperty("EIA_FacilityID") String facilityId,
    @JsonProperty("PlantName") String plantName,
    @JsonProperty("Generator") String generator,
    @JsonProperty("UnitName") String unitName,
    @JsonProperty("DateKey") int dateKey,
    @JsonProperty("Date") LocalDate date,
    @JsonProperty("OutageStartTimestamp") LocalDateTime outageStart,
    @JsonProperty("OutageEndTimestamp") LocalDateTime outageEnd,
    @JsonProperty("OutageDurationHours") double durationHours,
    @JsonProperty("CapacityAffectedMW") Double capacityAffectedMw
) {

  /** Validates required fields. */
  public OutageView {
    Objects.requireNonNull(eiaOutageId, "eiaOutageId must not be null");
    Objects.requireNonNull(facilityId, "facilityId must not be null");
    Objects.requireNonNull(generator, "generator must not be null");
    Objects.requireNonNull(unitName, "unitName must not be null");
    Objects.requireNonNull(date, "date must not be null");
    Objects.requireNonNull(outageStart, "outageStart must not be null");
    Objects.requireNonNull(outageEnd, "outageEnd must not be null");
  }
}
