package org.waabox.outagewatch.model;

import java.util.Objects;

/**
 * The result of one star-schema build.
 *
 * @param tables      the modeled tables, never null
 * @param skippedRows the number of raw rows left out for lacking a key
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record StarSchema(ModeledTables tables, int skippedRows) {

  /** Validates required fields. */
  public StarSchema {
    Objects.requireNonNull(tables, "tables must not be null");
  }
}
