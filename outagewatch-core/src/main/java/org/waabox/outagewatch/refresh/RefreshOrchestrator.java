package org.waabox.outagewatch.refresh;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.outagewatch.BuildException;
import org.waabox.outagewatch.OutageWatchException;
import org.waabox.outagewatch.RefreshInProgressException;
import org.waabox.outagewatch.SwapException;
import org.waabox.outagewatch.connector.ExtractionResult;
import org.waabox.outagewatch.connector.OutageConnector;
import org.waabox.outagewatch.metrics.OutageWatchMetrics;
import org.waabox.outagewatch.model.ModeledStore;
import org.waabox.outagewatch.model.ModeledTables;
import org.waabox.outagewatch.model.StagedTables;
import org.waabox.outagewatch.model.StarSchema;
import org.waabox.outagewatch.model.StarSchemaBuilder;
import org.waabox.outagewatch.query.OutageCatalog;
import org.waabox.outagewatch.raw.RawObservation;
import org.waabox.outagewatch.raw.RawStore;

/**
 * Runs the extract, build and swap cycle as one unit.
 *
 * <p>A refresh either swaps a complete new set of modeled tables and drops
 * the cached view, or fails and leaves both untouched:
 * <ul>
 *   <li>extraction failure: the raw store keeps its previous content;</li>
 *   <li>build failure: the staging location is discarded;</li>
 *   <li>swap failure: the store keeps the previous live tables and the
 *       cached view stays valid. Swaps are never retried.</li>
 * </ul>
 *
 * <p>At most one refresh runs at a time. A second request is either
 * rejected or queued behind the running one, per the
 * {@link ConcurrencyPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RefreshOrchestrator {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(RefreshOrchestrator.class);

  /** The largest preview sample per table. */
  public static final int MAX_PREVIEW_ROWS = 100;

  /** The preview sample size used when none is given. */
  public static final int DEFAULT_PREVIEW_ROWS = 5;

  /** The connector, never null. */
  private final OutageConnector connector;

  /** The raw store the build reads, never null. */
  private final RawStore rawStore;

  /** The star schema builder, never null. */
  private final StarSchemaBuilder builder;

  /** The modeled store, never null. */
  private final ModeledStore modeledStore;

  /** The cache to invalidate on swap, never null. */
  private final OutageCatalog catalog;

  /** What to do with concurrent requests, never null. */
  private final ConcurrencyPolicy concurrencyPolicy;

  /** The metrics sink, never null. */
  private final OutageWatchMetrics metrics;

  /** Guards the whole refresh cycle. */
  private final ReentrantLock refreshLock = new ReentrantLock();

  /** The latest status, replaced as a whole. */
  private final AtomicReference<RefreshStatus> status =
      new AtomicReference<>(new RefreshStatus(RefreshState.IDLE, null, null,
          null, null));

  /**
   * Creates a new orchestrator.
   *
   * @param theConnector    the connector, never null
   * @param theRawStore     the raw store, never null
   * @param theBuilder      the star schema builder, never null
   * @param theModeledStore the modeled store, never null
   * @param theCatalog      the cache, never null
   * @param thePolicy       the concurrency policy, never null
   * @param theMetrics      the metrics sink, never null
   */
  public RefreshOrchestrator(final OutageConnector theConnector,
      final RawStore theRawStore, final StarSchemaBuilder theBuilder,
      final ModeledStore theModeledStore, final OutageCatalog theCatalog,
      final ConcurrencyPolicy thePolicy, final OutageWatchMetrics theMetrics) {
    connector = Objects.requireNonNull(theConnector,
        "connector must not be null");
    rawStore = Objects.requireNonNull(theRawStore,
        "rawStore must not be null");
    builder = Objects.requireNonNull(theBuilder, "builder must not be null");
    modeledStore = Objects.requireNonNull(theModeledStore,
        "modeledStore must not be null");
    catalog = Objects.requireNonNull(theCatalog, "catalog must not be null");
    concurrencyPolicy = Objects.requireNonNull(thePolicy,
        "concurrencyPolicy must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Runs a full refresh and swaps the result in.
   *
   * @return the result, never null
   */
  public RefreshResult refresh() {
    return refresh(false, DEFAULT_PREVIEW_ROWS);
  }

  /**
   * Runs a refresh.
   *
   * @param preview when true, the built tables are sampled and discarded
   *                instead of swapped in; extraction still updates the
   *                raw store
   * @param head    the preview sample size per table, 1 to
   *                {@link #MAX_PREVIEW_ROWS}; ignored unless previewing
   *
   * @return the result, never null
   *
   * @throws IllegalArgumentException   if {@code head} is out of range
   * @throws RefreshInProgressException if another refresh runs and the
   *                                    policy is {@link ConcurrencyPolicy#REJECT}
   * @throws OutageWatchException       if any stage fails
   */
  public RefreshResult refresh(final boolean preview, final int head) {
    if (preview && (head < 1 || head > MAX_PREVIEW_ROWS)) {
      throw new IllegalArgumentException("head must be between 1 and "
          + MAX_PREVIEW_ROWS + ", got: " + head);
    }
    if (concurrencyPolicy == ConcurrencyPolicy.REJECT) {
      if (!refreshLock.tryLock()) {
        throw new RefreshInProgressException(
            "A refresh is already running (state "
                + status.get().state() + ")");
      }
    } else {
      refreshLock.lock();
    }
    try {
      return runLocked(preview, head);
    } finally {
      refreshLock.unlock();
    }
  }

  /**
   * Returns the current status.
   *
   * @return the status, never null
   */
  public RefreshStatus status() {
    return status.get();
  }

  /**
   * Runs the stages; the caller holds the refresh lock.
   *
   * @param preview whether to skip the swap
   * @param head    the preview sample size
   *
   * @return the result, never null
   */
  private RefreshResult runLocked(final boolean preview, final int head) {
    final Instant started = Instant.now();
    final RefreshStatus previous = status.get();
    log.info("Refresh started (preview={})", preview);

    enter(RefreshState.EXTRACTING, started, previous.lastResult());
    final ExtractionResult extraction;
    try {
      extraction = connector.extract();
    } catch (final RuntimeException e) {
      throw fail(RefreshState.EXTRACTING, started, previous, e);
    }
    metrics.extractionCompleted(extraction);

    enter(RefreshState.BUILDING, started, previous.lastResult());
    final List<RawObservation> raw;
    final StarSchema schema;
    final StagedTables staged;
    try {
      raw = rawStore.load();
      if (raw.isEmpty()) {
        throw new BuildException("The raw store is empty; nothing to build");
      }
      schema = builder.build(raw);
      staged = modeledStore.stage(schema.tables());
    } catch (final BuildException e) {
      throw fail(RefreshState.BUILDING, started, previous, e);
    } catch (final RuntimeException e) {
      throw fail(RefreshState.BUILDING, started, previous,
          new BuildException("Star schema build failed: " + e.getMessage(),
              e));
    }

    if (preview) {
      modeledStore.discard(staged);
      final RefreshResult result = result(false, extraction, raw, schema,
          schema.tables().head(head), started);
      finish(started, previous.lastResult());
      log.info("Refresh preview done: plants={} dates={} facts={}",
          result.plants(), result.dates(), result.facts());
      return result;
    }

    enter(RefreshState.SWAPPING, started, previous.lastResult());
    try {
      catalog.replaceAndInvalidate(() -> modeledStore.swap(staged));
    } catch (final RuntimeException e) {
      modeledStore.discard(staged);
      final SwapException swapFailure = e instanceof SwapException
          ? (SwapException) e
          : new SwapException("Swap failed: " + e.getMessage(), e);
      throw fail(RefreshState.SWAPPING, started, previous, swapFailure);
    }

    final RefreshResult result = result(true, extraction, raw, schema, null,
        started);
    finish(started, result);
    metrics.refreshCompleted(result.facts(), result.elapsed());
    log.info("Refresh swapped in: plants={} dates={} facts={} in {} ms",
        result.plants(), result.dates(), result.facts(),
        result.elapsed().toMillis());
    return result;
  }

  private RefreshResult result(final boolean swapped,
      final ExtractionResult extraction, final List<RawObservation> raw,
      final StarSchema schema, final ModeledTables sample,
      final Instant started) {
    return new RefreshResult(swapped, extraction, raw.size(),
        schema.skippedRows(), schema.tables().plants().size(),
        schema.tables().dates().size(), schema.tables().facts().size(),
        sample, Duration.between(started, Instant.now()));
  }

  private void enter(final RefreshState state, final Instant started,
      final RefreshResult lastResult) {
    status.set(new RefreshStatus(state, started, null, lastResult, null));
  }

  private void finish(final Instant started, final RefreshResult result) {
    status.set(new RefreshStatus(RefreshState.IDLE, started, Instant.now(),
        result, null));
  }

  /**
   * Records a failed stage and returns the exception to throw.
   *
   * @param stage    the stage that failed
   * @param started  when the refresh started
   * @param previous the status before this refresh
   * @param cause    the failure
   *
   * @return the failure, for the caller to throw
   */
  private RuntimeException fail(final RefreshState stage,
      final Instant started, final RefreshStatus previous,
      final RuntimeException cause) {
    log.error("Refresh failed while {}: {}", stage, cause.getMessage(),
        cause);
    status.set(new RefreshStatus(RefreshState.FAILED, started, Instant.now(),
        previous.lastResult(), stage + ": " + cause.getMessage()));
    metrics.refreshFailed(stage, cause);
    return cause;
  }
}
