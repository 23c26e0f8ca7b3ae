package org.waabox.outagewatch.model;

import java.util.Objects;

/**
 * One plant (EIA facility) of the star schema.
 *
 * @param plantKey   the surrogate key, unique within one build
 * @param facilityId the EIA facility identifier, never null
 * @param plantName  the plant name, may be null when the feed omits it
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DimPlant(int plantKey, String facilityId, String plantName) {

  /** Validates required fields. */
  public DimPlant {
    Objects.requireNonNull(facilityId, "facilityId must not be null");
  }
}
