package org.waabox.outagewatch.server.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import org.waabox.outagewatch.QueryException;
import org.waabox.outagewatch.connector.ExtractionResult;
import org.waabox.outagewatch.model.DimDate;
import org.waabox.outagewatch.model.DimPlant;
import org.waabox.outagewatch.model.FactOutage;
import org.waabox.outagewatch.model.ModeledTables;
import org.waabox.outagewatch.query.OutageCatalog;
import org.waabox.outagewatch.refresh.RefreshOrchestrator;
import org.waabox.outagewatch.refresh.RefreshResult;
import org.waabox.outagewatch.refresh.RefreshStatus;

/** REST controller that triggers and reports on refreshes.
 *
 * <p>This controller provides two endpoints:
 * <ul>
 *   <li>{@code POST /refresh} - runs extract, build and swap; with
 *       {@code preview=true} the built tables are sampled and discarded
 *       instead</li>
 *   <li>{@code GET /refresh/status} - the orchestrator state, the last
 *       result or failure, and the cache version</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
@RequestMapping("/refresh")
public class RefreshController {

  /** The refresh orchestrator, never null. */
  private final RefreshOrchestrator orchestrator;

  /** The outage view cache, never null. */
  private final OutageCatalog catalog;

  /** Creates a new RefreshController.
   *
   * @param theOrchestrator the refresh orchestrator, never null
   * @param theCatalog the outage view cache, never null
   */
  public RefreshController(final RefreshOrchestrator theOrchestrator,
      final OutageCatalog theCatalog) {
    orchestrator = Objects.requireNonNull(theOrchestrator,
        "orchestrator cannot be null");
    catalog = Objects.requireNonNull(theCatalog, "catalog cannot be null");
  }

  /** Runs a refresh.
   *
   * @param preview whether to sample the rebuilt tables instead of
   *        swapping them in
   * @param head the rows per table in the preview, 1 to 100
   *
   * @return the refresh summary, never null
   */
  @PostMapping
  public Map<String, Object> refresh(
      @RequestParam(name = "preview", defaultValue = "false")
          final boolean preview,
      @RequestParam(name = "head", defaultValue = "5") final int head) {
    if (head < 1 || head > RefreshOrchestrator.MAX_PREVIEW_ROWS) {
      throw new QueryException("head must be between 1 and "
          + RefreshOrchestrator.MAX_PREVIEW_ROWS + ", got: " + head);
    }
    final RefreshResult result = orchestrator.refresh(preview, head);

    final Map<String, Object> body = summary(result);
    result.preview().ifPresent(tables -> body.put("preview",
        preview(tables)));
    return body;
  }

  /** Returns the refresh state and the cache version.
   *
   * @return the status, never null
   */
  @GetMapping("/status")
  public Map<String, Object> status() {
    final RefreshStatus status = orchestrator.status();

    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("state", status.state());
    body.put("last_started", status.lastStarted());
    body.put("last_finished", status.lastFinished());
    body.put("last_failure", status.lastFailure());
    body.put("last_result", status.result().map(this::summary).orElse(null));

    final Map<String, Object> cache = new LinkedHashMap<>();
    catalog.cached().ifPresentOrElse(snapshot -> {
      cache.put("loaded", true);
      cache.put("version", snapshot.version());
      cache.put("loaded_at", snapshot.createdAt());
      cache.put("rows", snapshot.rows().size());
    }, () -> cache.put("loaded", false));
    body.put("cache", cache);
    return body;
  }

  private Map<String, Object> summary(final RefreshResult result) {
    final ExtractionResult extraction = result.extraction();
    final Map<String, Object> ext = new LinkedHashMap<>();
    ext.put("incremental", extraction.incremental());
    ext.put("pages_fetched", extraction.pagesFetched());
    ext.put("rows_fetched", extraction.rowsFetched());
    ext.put("rows_added", extraction.rowsAdded());
    ext.put("rows_skipped", extraction.rowsSkipped());
    ext.put("duplicates_dropped", extraction.duplicatesDropped());
    ext.put("early_stopped", extraction.earlyStopped());
    ext.put("total_rows", extraction.totalRows());
    ext.put("store_written", extraction.storeWritten());

    final Map<String, Object> tables = new LinkedHashMap<>();
    tables.put("dim_plant", result.plants());
    tables.put("dim_date", result.dates());
    tables.put("fact_outage", result.facts());

    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", result.status());
    body.put("raw_rows", result.rawRows());
    body.put("skipped_rows", result.skippedRows());
    body.put("tables", tables);
    body.put("extraction", ext);
    body.put("elapsed_ms", result.elapsed().toMillis());
    return body;
  }

  private static Map<String, Object> preview(final ModeledTables tables) {
    final List<Map<String, Object>> plants = new ArrayList<>();
    for (final DimPlant plant : tables.plants()) {
      final Map<String, Object> row = new LinkedHashMap<>();
      row.put("PlantKey", plant.plantKey());
      row.put("EIA_FacilityID", plant.facilityId());
      row.put("PlantName", plant.plantName());
      plants.add(row);
    }

    final List<Map<String, Object>> dates = new ArrayList<>();
    for (final DimDate date : tables.dates()) {
      final Map<String, Object> row = new LinkedHashMap<>();
      row.put("DateKey", date.dateKey());
      row.put("Date", date.date());
      row.put("Year", date.year());
      row.put("Month", date.month());
      row.put("Day", date.day());
      row.put("DayOfWeek", date.dayOfWeek());
      row.put("IsWeekend", date.weekend());
      dates.add(row);
    }

    final List<Map<String, Object>> facts = new ArrayList<>();
    for (final FactOutage fact : tables.facts()) {
      final Map<String, Object> row = new LinkedHashMap<>();
      row.put("OutageKey", fact.outageKey());
      row.put("PlantKey", fact.plantKey());
      row.put("DateKey", fact.dateKey());
      row.put("Generator", fact.generator());
      row.put("OutageStartTimestamp", fact.outageStart());
      row.put("OutageEndTimestamp", fact.outageEnd());
      row.put("OutageDurationHours", fact.durationHours());
      row.put("CapacityAffectedMW", fact.capacityAffectedMw());
      row.put("EIA_OutageID", fact.eiaOutageId());
      facts.add(row);
    }

    final Map<String, Object> preview = new LinkedHashMap<>();
    preview.put("dim_plant", plants);
    preview.put("dim_date", dates);
    preview.put("fact_outage", facts);
    return preview;
  }
}
