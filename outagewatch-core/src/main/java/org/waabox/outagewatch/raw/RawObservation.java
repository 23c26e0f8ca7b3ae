package org.waabox.outagewatch.raw;

import java.time.LocalDate;
import java.util.Optional;

/**
 * A single daily outage observation for one generator, as delivered by the
 * upstream feed.
 *
 * <p>The natural key is {@code (period, facility, generator)}. Rows built by
 * {@link RawObservationCodec} always carry the key; rows read back from a
 * store may not, if the file was edited by hand, so consumers check
 * {@link #hasNaturalKey()} before relying on it.
 *
 * @param period        the observation date, null if missing
 * @param facility      the EIA facility identifier, null if missing
 * @param facilityName  the plant name, may be null
 * @param generator     the generator (unit) identifier, null if missing
 * @param capacity      the unit capacity in MW, may be null
 * @param outage        the capacity out of service in MW, may be null
 * @param percentOutage the share of capacity out of service, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RawObservation(
    LocalDate period,
    String facility,
    String facilityName,
    String generator,
    Double capacity,
    Double outage,
    Double percentOutage
) {

  /**
   * Returns whether all natural key fields are present.
   *
   * @return true if period, facility and generator are all non-blank
   */
  public boolean hasNaturalKey() {
    return period != null
        && facility != null && !facility.isBlank()
        && generator != null && !generator.isBlank();
  }

  /**
   * Returns the natural key of this observation.
   *
   * @return the key, or empty if any key field is missing
   */
  public Optional<NaturalKey> naturalKey() {
    if (!hasNaturalKey()) {
      return Optional.empty();
    }
    return Optional.of(new NaturalKey(period, facility, generator));
  }
}
