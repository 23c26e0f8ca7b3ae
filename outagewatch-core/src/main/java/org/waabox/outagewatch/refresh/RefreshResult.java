package org.waabox.outagewatch.refresh;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import org.waabox.outagewatch.connector.ExtractionResult;
import org.waabox.outagewatch.model.ModeledTables;

/**
 * The outcome of a refresh that did not fail.
 *
 * @param swapped     true if the new tables are live, false for a preview
 * @param extraction  the connector summary, never null
 * @param rawRows     the number of raw rows the build read
 * @param skippedRows the number of raw rows the build left out
 * @param plants      the number of plant rows built
 * @param dates       the number of date rows built
 * @param facts       the number of fact rows built
 * @param sample      the first rows of every table, null unless preview
 * @param elapsed     the wall time of the refresh, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RefreshResult(
    boolean swapped,
    ExtractionResult extraction,
    int rawRows,
    int skippedRows,
    int plants,
    int dates,
    int facts,
    ModeledTables sample,
    Duration elapsed
) {

  /** Validates required fields. */
  public RefreshResult {
    Objects.requireNonNull(extraction, "extraction must not be null");
    Objects.requireNonNull(elapsed, "elapsed must not be null");
  }

  /** @return "swapped" or "preview" */
  public String status() {
    return swapped ? "swapped" : "preview";
  }

  /** @return the preview sample, empty when the tables were swapped */
  public Optional<ModeledTables> preview() {
    return Optional.ofNullable(sample);
  }
}
