package org.waabox.outagewatch.connector;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.outagewatch.ExtractionException;
import org.waabox.outagewatch.RetryPolicy;
import org.waabox.outagewatch.ValidationException;
import org.waabox.outagewatch.raw.NaturalKey;
import org.waabox.outagewatch.raw.RawObservation;
import org.waabox.outagewatch.raw.RawObservationCodec;
import org.waabox.outagewatch.raw.RawStore;

/**
 * Pages through an {@link OutagePageSource} and merges the fetched rows into
 * a {@link RawStore}.
 *
 * <p>Every run deduplicates on the natural key
 * {@code (period, facility, generator)}: the first row seen for a key wins.
 * In incremental mode the existing store is loaded first, so rows already
 * stored are never replaced or duplicated and new rows are appended after
 * them. In full mode the fetched rows replace the store.
 *
 * <p>The store is written once, after the whole page loop succeeded. A page
 * that keeps failing after the retry budget aborts the run with an
 * {@link ExtractionException} and the store keeps its previous content.
 *
 * <p>Early stop: when enabled in incremental mode, paging ends at the first
 * page whose rows are all no newer than the newest period already stored and
 * which contributed no new key. This relies on the feed being newest-first;
 * as soon as a page is seen out of order the rule is switched off for the
 * rest of the run. Disabling the rule never changes the resulting store, it
 * only reads more pages.
 *
 * <p>Instances are not meant to run concurrently against the same store;
 * the refresh orchestrator guarantees a single writer.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class OutageConnector {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(OutageConnector.class);

  /** The upstream page source, never null. */
  private final OutagePageSource source;

  /** The raw store to merge into, never null. */
  private final RawStore store;

  /** The connector configuration, never null. */
  private final ConnectorConfig config;

  /**
   * Creates a new connector.
   *
   * @param theSource the upstream page source, never null
   * @param theStore the raw store, never null
   * @param theConfig the configuration, never null
   */
  public OutageConnector(final OutagePageSource theSource,
      final RawStore theStore, final ConnectorConfig theConfig) {
    source = Objects.requireNonNull(theSource, "source cannot be null");
    store = Objects.requireNonNull(theStore, "store cannot be null");
    config = Objects.requireNonNull(theConfig, "config cannot be null");
  }

  /**
   * Runs an extraction with the configured incremental and early-stop
   * flags.
   *
   * @return the run summary, never null
   *
   * @throws ExtractionException if a page cannot be fetched or the store
   *                             cannot be written
   */
  public ExtractionResult extract() {
    return extract(config.incremental(), config.earlyStop());
  }

  /**
   * Runs an extraction.
   *
   * @param incremental whether to merge into the existing store; ignored
   *                    when the store does not exist yet
   * @param earlyStop   whether to apply the early-stop rule; only
   *                    meaningful for incremental runs
   *
   * @return the run summary, never null
   *
   * @throws ExtractionException if a page cannot be fetched or the store
   *                             cannot be written
   */
  public ExtractionResult extract(final boolean incremental,
      final boolean earlyStop) {

    final Map<NaturalKey, RawObservation> merged = new LinkedHashMap<>();
    final List<RawObservation> unkeyed = new ArrayList<>();
    LocalDate maxStoredPeriod = null;

    final boolean mergeIntoExisting = incremental && store.exists();
    if (mergeIntoExisting) {
      for (final RawObservation row : store.load()) {
        final Optional<NaturalKey> key = row.naturalKey();
        if (key.isEmpty()) {
          unkeyed.add(row);
          continue;
        }
        merged.putIfAbsent(key.get(), row);
        if (maxStoredPeriod == null || row.period().isAfter(maxStoredPeriod)) {
          maxStoredPeriod = row.period();
        }
      }
      log.info("Incremental mode: existing rows={} max_period={}",
          merged.size() + unkeyed.size(), maxStoredPeriod);
    } else if (incremental) {
      log.info("Incremental mode requested but no raw store exists yet;"
          + " running a full extraction");
    }

    boolean earlyStopActive = earlyStop && mergeIntoExisting
        && maxStoredPeriod != null;

    int offset = 0;
    int pages = 0;
    int fetched = 0;
    int added = 0;
    int skipped = 0;
    int duplicates = 0;
    boolean earlyStopped = false;
    LocalDate previousPageOldest = null;

    while (true) {
      final int length = nextPageLength(fetched);
      if (length == 0) {
        log.info("Reached maximum records limit ({}). Stopping pagination.",
            config.maxRecords());
        break;
      }

      log.info("Fetched {} records so far | fetching page at offset {}"
          + " with limit {}", fetched, offset, length);

      final List<JsonNode> page = fetchWithRetry(offset, length);
      pages++;

      if (page.isEmpty()) {
        log.info("Pagination complete: source returned an empty page.");
        break;
      }
      fetched += page.size();

      int pageAdded = 0;
      LocalDate pageNewest = null;
      LocalDate pageOldest = null;
      LocalDate previousRow = null;
      boolean pageOrdered = true;

      for (final JsonNode node : page) {
        final RawObservation row;
        try {
          row = RawObservationCodec.decode(node);
        } catch (final ValidationException e) {
          skipped++;
          log.debug("Skipping invalid row at offset {}: {}", offset,
              e.getMessage());
          continue;
        }

        final LocalDate period = row.period();
        if (previousRow != null && period.isAfter(previousRow)) {
          pageOrdered = false;
        }
        previousRow = period;
        if (pageNewest == null || period.isAfter(pageNewest)) {
          pageNewest = period;
        }
        if (pageOldest == null || period.isBefore(pageOldest)) {
          pageOldest = period;
        }

        final NaturalKey key = row.naturalKey().orElseThrow();
        if (merged.putIfAbsent(key, row) == null) {
          added++;
          pageAdded++;
        } else {
          duplicates++;
        }
      }

      if (earlyStopActive) {
        final boolean crossPageViolation = previousPageOldest != null
            && pageNewest != null && pageNewest.isAfter(previousPageOldest);
        if (!pageOrdered || crossPageViolation) {
          log.warn("Upstream page at offset {} is not newest-first;"
              + " early-stop disabled for the rest of this run", offset);
          earlyStopActive = false;
        }
      }
      if (pageOldest != null) {
        previousPageOldest = pageOldest;
      }

      if (earlyStopActive && pageNewest != null
          && !pageNewest.isAfter(maxStoredPeriod) && pageAdded == 0) {
        log.info("Incremental early-stop: reached periods <= {} with no new"
            + " rows.", maxStoredPeriod);
        earlyStopped = true;
        break;
      }

      if (page.size() < length) {
        log.info("Received {} records, less than limit. Pagination complete.",
            page.size());
        break;
      }
      offset += length;
    }

    if (skipped > 0) {
      log.warn("Dropped {} records with missing or invalid key fields",
          skipped);
    }

    final boolean written = persist(mergeIntoExisting, merged, unkeyed,
        added);
    final int total = written || mergeIntoExisting
        ? merged.size() + unkeyed.size() : countStored();

    log.info("Extraction finished: pages={} fetched={} new={} skipped={}"
        + " duplicates={} total={} written={}", pages, fetched, added,
        skipped, duplicates, total, written);

    return new ExtractionResult(mergeIntoExisting, pages, fetched, added,
        skipped, duplicates, earlyStopped, total, written);
  }

  /**
   * Writes the merged rows back to the store when there is something to
   * write.
   *
   * @param mergeIntoExisting whether the run was incremental
   * @param merged            the keyed rows, in store order
   * @param unkeyed           stored rows without a key, carried unchanged
   * @param added             the number of new keys seen in this run
   *
   * @return true if the store was rewritten
   */
  private boolean persist(final boolean mergeIntoExisting,
      final Map<NaturalKey, RawObservation> merged,
      final List<RawObservation> unkeyed, final int added) {

    if (mergeIntoExisting && added == 0) {
      log.info("Incremental run found 0 new records. Output unchanged.");
      return false;
    }
    if (!mergeIntoExisting && merged.isEmpty()) {
      log.error("Extraction collected zero valid records; nothing to save,"
          + " keeping the existing raw store");
      return false;
    }

    final List<RawObservation> rows = new ArrayList<>(merged.values());
    rows.addAll(unkeyed);
    try {
      store.save(rows);
    } catch (final RuntimeException e) {
      throw new ExtractionException("Failed to write the raw store", e);
    }
    return true;
  }

  /**
   * Returns how many rows the store holds, used when the run did not write.
   *
   * @return the stored row count, 0 if the store does not exist
   */
  private int countStored() {
    return store.exists() ? store.load().size() : 0;
  }

  /**
   * Computes the length of the next page, honoring the record cap.
   *
   * @param fetched the number of rows fetched so far
   *
   * @return the page length, 0 when the cap is reached
   */
  private int nextPageLength(final int fetched) {
    if (config.maxRecords() == 0) {
      return config.pageSize();
    }
    return Math.max(0, Math.min(config.pageSize(),
        config.maxRecords() - fetched));
  }

  /**
   * Fetches one page, retrying transient failures according to the retry
   * policy.
   *
   * @param offset the page offset
   * @param length the page length
   *
   * @return the page rows, never null
   *
   * @throws ExtractionException if the page cannot be fetched
   */
  private List<JsonNode> fetchWithRetry(final int offset, final int length) {
    final RetryPolicy policy = config.retryPolicy();
    for (int attempt = 1; ; attempt++) {
      try {
        return Objects.requireNonNull(source.fetchPage(offset, length),
            "page source returned null");
      } catch (final PageFetchException e) {
        if (!e.retryable()) {
          log.error("Attempt {}: non-retryable failure at offset {}: {}",
              attempt, offset, e.getMessage());
          throw new ExtractionException(
              "Upstream rejected the request at offset " + offset, e);
        }
        if (attempt >= policy.maxAttempts()) {
          log.error("Giving up on offset {} after {} attempts", offset,
              attempt);
          throw new ExtractionException("Failed to fetch page at offset "
              + offset + " after " + attempt + " attempts", e);
        }
        final Duration wait = policy.backoffAfter(attempt);
        log.warn("Attempt {}/{}: failed to fetch offset {}: {}; retrying in"
            + " {} ms", attempt, policy.maxAttempts(), offset,
            e.getMessage(), wait.toMillis());
        sleep(wait);
      }
    }
  }

  /**
   * Sleeps for the given duration.
   *
   * @param wait the time to sleep, never null
   *
   * @throws ExtractionException if the thread is interrupted
   */
  private static void sleep(final Duration wait) {
    if (wait.isZero()) {
      return;
    }
    try {
      Thread.sleep(wait.toMillis());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExtractionException("Interrupted while waiting to retry", e);
    }
  }
}
