package org.waabox.outagewatch.model;

import java.util.List;
import java.util.Objects;

/**
 * The three tables of the star schema, as one immutable unit.
 *
 * @param plants the plant dimension, never null
 * @param dates  the date dimension, never null
 * @param facts  the outage facts, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ModeledTables(
    List<DimPlant> plants,
    List<DimDate> dates,
    List<FactOutage> facts
) {

  /** Copies the lists into unmodifiable ones. */
  public ModeledTables {
    plants = List.copyOf(Objects.requireNonNull(plants,
        "plants must not be null"));
    dates = List.copyOf(Objects.requireNonNull(dates,
        "dates must not be null"));
    facts = List.copyOf(Objects.requireNonNull(facts,
        "facts must not be null"));
  }

  /**
   * Returns the first rows of every table.
   *
   * @param rows the maximum number of rows per table, not negative
   * @return a new instance holding at most {@code rows} rows per table
   */
  public ModeledTables head(final int rows) {
    if (rows < 0) {
      throw new IllegalArgumentException("rows must not be negative");
    }
    return new ModeledTables(
        plants.subList(0, Math.min(rows, plants.size())),
        dates.subList(0, Math.min(rows, dates.size())),
        facts.subList(0, Math.min(rows, facts.size())));
  }
}
