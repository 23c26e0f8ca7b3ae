package org.waabox.outagewatch.model;

import java.util.Objects;

/**
 * A handle on modeled tables written to a staging location, not yet
 * visible to readers.
 *
 * @param location where the staged tables live, meaningful only to the
 *                 {@link ModeledStore} that created the handle
 * @param plants   the number of staged plant rows
 * @param dates    the number of staged date rows
 * @param facts    the number of staged fact rows
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record StagedTables(String location, int plants, int dates,
    int facts) {

  /** Validates required fields. */
  public StagedTables {
    Objects.requireNonNull(location, "location must not be null");
  }
}
