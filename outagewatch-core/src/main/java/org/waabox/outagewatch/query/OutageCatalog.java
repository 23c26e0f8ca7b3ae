package org.waabox.outagewatch.query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.outagewatch.metrics.OutageWatchMetrics;
import org.waabox.outagewatch.model.ModeledStore;

/**
 * Serves filtered, paginated reads of the joined outage view.
 *
 * <p>The joined view is loaded lazily from the {@link ModeledStore} on the
 * first read and kept in an {@link OutageViewSnapshot}, which readers use
 * without locking. The load lock guards two things: only one thread joins
 * the tables at a time, and no thread can load while a swap of the modeled
 * store is in progress, so a reader never caches a half-replaced store.
 *
 * <p>After a successful swap the cached view is dropped; the next read
 * rebuilds it from the new tables. A failed swap keeps the cached view,
 * which still matches the live tables.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class OutageCatalog {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(OutageCatalog.class);

  /** The modeled store to read from, never null. */
  private final ModeledStore store;

  /** The metrics sink, never null. */
  private final OutageWatchMetrics metrics;

  /** The cached view, null when not loaded. */
  private final AtomicReference<OutageViewSnapshot> current;

  /** Serializes loads against each other and against swaps. */
  private final ReentrantLock loadLock;

  /** The monotonically increasing version counter. */
  private final AtomicLong versionCounter;

  /**
   * Creates a new catalog.
   *
   * @param theStore   the modeled store, never null
   * @param theMetrics the metrics sink, never null
   */
  public OutageCatalog(final ModeledStore theStore,
      final OutageWatchMetrics theMetrics) {
    store = Objects.requireNonNull(theStore, "store must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    current = new AtomicReference<>();
    loadLock = new ReentrantLock();
    versionCounter = new AtomicLong(0);
  }

  /**
   * Returns one page of the rows matching the filter, newest start first.
   *
   * <p>A page past the end of the result is empty, with the total still
   * reported.
   *
   * @param filter the filter, never null
   * @param page   the page to return, never null
   *
   * @return the page, never null
   *
   * @throws org.waabox.outagewatch.ModeledDataNotFoundException if no
   *         modeled tables have been built yet
   */
  public QueryResult query(final OutageFilter filter,
      final PageRequest page) {
    Objects.requireNonNull(filter, "filter must not be null");
    Objects.requireNonNull(page, "page must not be null");

    final OutageViewSnapshot snapshot = snapshot();
    final long from = page.offset();
    final long to = from + page.limit();

    final List<OutageView> rows = new ArrayList<>();
    int total = 0;
    for (final OutageView row : snapshot.candidates(filter)) {
      if (!filter.matches(row)) {
        continue;
      }
      if (total >= from && total < to) {
        rows.add(row);
      }
      total++;
    }
    return new QueryResult(rows, total, page.page(), page.limit(),
        snapshot.version());
  }

  /**
   * Returns the cached view, loading it when absent.
   *
   * @return the current view, never null
   *
   * @throws org.waabox.outagewatch.ModeledDataNotFoundException if no
   *         modeled tables have been built yet
   */
  public OutageViewSnapshot snapshot() {
    final OutageViewSnapshot cached = current.get();
    if (cached != null) {
      return cached;
    }
    loadLock.lock();
    try {
      final OutageViewSnapshot again = current.get();
      if (again != null) {
        return again;
      }
      final long started = System.nanoTime();
      final OutageViewSnapshot loaded = OutageViewSnapshot.join(store.load(),
          versionCounter.incrementAndGet());
      current.set(loaded);
      final Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
      log.info("Loaded outage view version {} with {} rows in {} ms",
          loaded.version(), loaded.rows().size(), elapsed.toMillis());
      metrics.cacheLoaded(loaded.rows().size(), elapsed);
      return loaded;
    } finally {
      loadLock.unlock();
    }
  }

  /**
   * Runs a replacement of the modeled store while no load can happen, then
   * drops the cached view.
   *
   * <p>If the replacement throws, the cached view is kept and the exception
   * propagates.
   *
   * @param replacement the action that replaces the modeled tables, never
   *                    null
   */
  public void replaceAndInvalidate(final Runnable replacement) {
    Objects.requireNonNull(replacement, "replacement must not be null");
    loadLock.lock();
    try {
      replacement.run();
      current.set(null);
      log.info("Outage view invalidated after the modeled tables changed");
    } finally {
      loadLock.unlock();
    }
  }

  /**
   * Returns the cached view without loading it.
   *
   * @return the cached view, empty if not loaded
   */
  public Optional<OutageViewSnapshot> cached() {
    return Optional.ofNullable(current.get());
  }
}
