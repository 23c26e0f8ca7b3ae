package org.waabox.outagewatch.raw;

import java.time.LocalDate;
import java.util.Objects;

/**
 * The real-world identity of a raw observation.
 *
 * <p>A raw store never holds two observations with the same key.
 *
 * @param period    the observation date, never null
 * @param facility  the EIA facility identifier, never null
 * @param generator the generator identifier, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record NaturalKey(LocalDate period, String facility,
    String generator) {

  /** Validates required fields. */
  public NaturalKey {
    Objects.requireNonNull(period, "period must not be null");
    Objects.requireNonNull(facility, "facility must not be null");
    Objects.requireNonNull(generator, "generator must not be null");
  }
}
