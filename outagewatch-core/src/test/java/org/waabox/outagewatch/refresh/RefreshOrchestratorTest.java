package org.waabox.outagewatch.refresh;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.waabox.outagewatch.BuildException;
import org.waabox.outagewatch.ExtractionException;
import org.waabox.outagewatch.RefreshInProgressException;
import org.waabox.outagewatch.RetryPolicy;
import org.waabox.outagewatch.SwapException;
import org.waabox.outagewatch.connector.ConnectorConfig;
import org.waabox.outagewatch.connector.OutageConnector;
import org.waabox.outagewatch.connector.OutagePageSource;
import org.waabox.outagewatch.connector.PageFetchException;
import org.waabox.outagewatch.metrics.NoopOutageWatchMetrics;
import org.waabox.outagewatch.metrics.OutageWatchMetrics;
import org.waabox.outagewatch.model.InMemoryModeledStore;
import org.waabox.outagewatch.model.ModeledTables;
import org.waabox.outagewatch.model.StarSchemaBuilder;
import org.waabox.outagewatch.query.OutageCatalog;
import org.waabox.outagewatch.query.OutageFilter;
import org.waabox.outagewatch.query.OutageViewSnapshot;
import org.waabox.outagewatch.query.PageRequest;
import org.waabox.outagewatch.raw.InMemoryRawStore;

/**
 * Tests for {@link RefreshOrchestrator}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RefreshOrchestratorTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final InMemoryRawStore rawStore = new InMemoryRawStore();

  private final InMemoryModeledStore modeledStore =
      new InMemoryModeledStore();

  private final OutageCatalog catalog = new OutageCatalog(modeledStore,
      NoopOutageWatchMetrics.INSTANCE);

  private final ExecutorService executor = Executors.newFixedThreadPool(2);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void whenRefreshing_givenFeed_shouldSwapAndServeTheNewTables() {
    final RefreshOrchestrator orchestrator = orchestrator(feed(feedRows()),
        ConcurrencyPolicy.REJECT, NoopOutageWatchMetrics.INSTANCE);

    final RefreshResult result = orchestrator.refresh();

    assertTrue(result.swapped());
    assertEquals("swapped", result.status());
    assertEquals(5, result.rawRows());
    assertEquals(2, result.plants());
    assertEquals(3, result.facts());
    assertFalse(result.preview().isPresent());
    assertEquals(3, catalog.query(OutageFilter.none(),
        PageRequest.of(1, 10)).totalCount());
    assertEquals(0, modeledStore.pendingStages());

    final RefreshStatus status = orchestrator.status();
    assertEquals(RefreshState.IDLE, status.state());
    assertSame(result, status.lastResult());
    assertFalse(status.failure().isPresent());
  }

  @Test
  void whenRefreshing_givenPreview_shouldSampleAndDiscard() {
    final RefreshOrchestrator orchestrator = orchestrator(feed(feedRows()),
        ConcurrencyPolicy.REJECT, NoopOutageWatchMetrics.INSTANCE);

    final RefreshResult result = orchestrator.refresh(true, 2);

    assertFalse(result.swapped());
    assertEquals("preview", result.status());
    final ModeledTables sample = result.preview().orElseThrow();
    assertEquals(2, sample.facts().size());
    assertEquals(2, sample.plants().size());
    assertEquals(3, result.facts());
    assertFalse(modeledStore.exists());
    assertEquals(0, modeledStore.pendingStages());
    assertEquals(5, rawStore.load().size());
  }

  @Test
  void whenRefreshing_givenPreviewHeadOutOfRange_shouldThrow() {
    final RefreshOrchestrator orchestrator = orchestrator(feed(feedRows()),
        ConcurrencyPolicy.REJECT, NoopOutageWatchMetrics.INSTANCE);

    assertThrows(IllegalArgumentException.class,
        () -> orchestrator.refresh(true, 0));
    assertThrows(IllegalArgumentException.class,
        () -> orchestrator.refresh(true, RefreshOrchestrator.MAX_PREVIEW_ROWS
            + 1));
    assertFalse(rawStore.exists());
  }

  @Test
  void whenRefreshing_givenUpstreamFailure_shouldKeepPreviousData() {
    final List<JsonNode> rows = new ArrayList<>(feedRows());
    final AtomicInteger calls = new AtomicInteger();
    final OutagePageSource source = (offset, length) -> {
      if (calls.incrementAndGet() > 1) {
        throw new PageFetchException("HTTP 403", false);
      }
      return rows;
    };
    final OutageWatchMetrics metrics = createMock(OutageWatchMetrics.class);
    metrics.extractionCompleted(anyObject());
    metrics.refreshCompleted(eq(3), anyObject(Duration.class));
    metrics.refreshFailed(eq(RefreshState.EXTRACTING),
        anyObject(Throwable.class));
    replay(metrics);
    final RefreshOrchestrator orchestrator = orchestrator(source,
        ConcurrencyPolicy.REJECT, metrics);
    final RefreshResult first = orchestrator.refresh();
    final OutageViewSnapshot served = catalog.snapshot();

    assertThrows(ExtractionException.class, orchestrator::refresh);

    final RefreshStatus status = orchestrator.status();
    assertEquals(RefreshState.FAILED, status.state());
    assertTrue(status.failure().orElseThrow().startsWith("EXTRACTING"));
    assertSame(first, status.lastResult());
    assertSame(served, catalog.snapshot());
    assertEquals(1, rawStore.saves());
    verify(metrics);
  }

  @Test
  void whenRefreshing_givenSwapFailure_shouldKeepLiveTablesAndCache() {
    final RefreshOrchestrator orchestrator = orchestrator(feed(feedRows()),
        ConcurrencyPolicy.REJECT, NoopOutageWatchMetrics.INSTANCE);
    orchestrator.refresh();
    final OutageViewSnapshot served = catalog.snapshot();
    modeledStore.failSwaps(true);

    assertThrows(SwapException.class, orchestrator::refresh);

    assertEquals(RefreshState.FAILED, orchestrator.status().state());
    assertTrue(orchestrator.status().failure().orElseThrow()
        .startsWith("SWAPPING"));
    assertSame(served, catalog.snapshot());
    assertEquals(0, modeledStore.pendingStages());
  }

  @Test
  void whenRefreshing_givenEmptyFeedAndNoRawData_shouldFailTheBuild() {
    final RefreshOrchestrator orchestrator = orchestrator(feed(List.of()),
        ConcurrencyPolicy.REJECT, NoopOutageWatchMetrics.INSTANCE);

    assertThrows(BuildException.class, orchestrator::refresh);

    assertEquals(RefreshState.FAILED, orchestrator.status().state());
    assertTrue(orchestrator.status().failure().orElseThrow()
        .startsWith("BUILDING"));
    assertFalse(modeledStore.exists());
  }

  @Test
  void whenRefreshing_givenFailureThenSuccess_shouldClearTheFailure() {
    final AtomicInteger calls = new AtomicInteger();
    final OutagePageSource source = (offset, length) -> {
      if (calls.incrementAndGet() == 1) {
        throw new PageFetchException("HTTP 401", false);
      }
      return feedRows();
    };
    final RefreshOrchestrator orchestrator = orchestrator(source,
        ConcurrencyPolicy.REJECT, NoopOutageWatchMetrics.INSTANCE);

    assertThrows(ExtractionException.class, orchestrator::refresh);
    orchestrator.refresh();

    assertEquals(RefreshState.IDLE, orchestrator.status().state());
    assertFalse(orchestrator.status().failure().isPresent());
  }

  @Test
  void whenRefreshing_givenRunningRefreshAndReject_shouldThrowConflict()
      throws Exception {
    final BlockingSource source = new BlockingSource();
    final RefreshOrchestrator orchestrator = orchestrator(source,
        ConcurrencyPolicy.REJECT, NoopOutageWatchMetrics.INSTANCE);

    final Future<RefreshResult> running = executor.submit(
        () -> orchestrator.refresh());
    assertTrue(source.entered.await(5, TimeUnit.SECONDS));

    assertThrows(RefreshInProgressException.class, orchestrator::refresh);
    assertEquals(RefreshState.EXTRACTING, orchestrator.status().state());

    source.release.countDown();
    assertTrue(running.get(5, TimeUnit.SECONDS).swapped());
    assertEquals(1, source.calls.get());
  }

  @Test
  void whenRefreshing_givenRunningRefreshAndQueue_shouldRunBothInTurn()
      throws Exception {
    final BlockingSource source = new BlockingSource();
    final RefreshOrchestrator orchestrator = orchestrator(source,
        ConcurrencyPolicy.QUEUE, NoopOutageWatchMetrics.INSTANCE);

    final Future<RefreshResult> first = executor.submit(
        () -> orchestrator.refresh());
    assertTrue(source.entered.await(5, TimeUnit.SECONDS));
    final Future<RefreshResult> second = executor.submit(
        () -> orchestrator.refresh());

    source.release.countDown();
    assertTrue(first.get(5, TimeUnit.SECONDS).swapped());
    assertTrue(second.get(5, TimeUnit.SECONDS).swapped());
    assertEquals(2, source.calls.get());
    assertEquals(1, source.maxConcurrent.get());
  }

  private RefreshOrchestrator orchestrator(final OutagePageSource source,
      final ConcurrencyPolicy policy, final OutageWatchMetrics metrics) {
    final OutageConnector connector = new OutageConnector(source, rawStore,
        ConnectorConfig.builder()
            .pageSize(100)
            .retryPolicy(RetryPolicy.of(1, Duration.ZERO))
            .build());
    return new RefreshOrchestrator(connector, rawStore,
        new StarSchemaBuilder(), modeledStore, catalog, policy, metrics);
  }

  private static OutagePageSource feed(final List<JsonNode> rows) {
    return (offset, length) -> rows.subList(Math.min(offset, rows.size()),
        Math.min(offset + length, rows.size()));
  }

  /** 1715 unit 1 on Jan 5 and Jan 1-3, 46 unit 2 on Jan 3. */
  private static List<JsonNode> feedRows() {
    final List<JsonNode> rows = new ArrayList<>();
    rows.add(row("2025-01-05", "1715", "1", "Palo Verde"));
    rows.add(row("2025-01-03", "1715", "1", "Palo Verde"));
    rows.add(row("2025-01-03", "46", "2", "Browns Ferry"));
    rows.add(row("2025-01-02", "1715", "1", "Palo Verde"));
    rows.add(row("2025-01-01", "1715", "1", "Palo Verde"));
    return rows;
  }

  private static JsonNode row(final String period, final String facility,
      final String generator, final String name) {
    final ObjectNode row = MAPPER.createObjectNode();
    row.put("period", period);
    row.put("facility", facility);
    row.put("facilityName", name);
    row.put("generator", generator);
    row.put("outage", 1000);
    return row;
  }

  /** Holds every fetch until released, tracking overlapping calls. */
  private static final class BlockingSource implements OutagePageSource {

    private final CountDownLatch entered = new CountDownLatch(1);

    private final CountDownLatch release = new CountDownLatch(1);

    private final AtomicInteger calls = new AtomicInteger();

    private final AtomicInteger active = new AtomicInteger();

    private final AtomicInteger maxConcurrent = new AtomicInteger();

    @Override
    public List<JsonNode> fetchPage(final int offset, final int length) {
      calls.incrementAndGet();
      maxConcurrent.accumulateAndGet(active.incrementAndGet(), Math::max);
      try {
        entered.countDown();
        if (!release.await(5, TimeUnit.SECONDS)) {
          throw new PageFetchException("never released", false);
        }
        return feedRows();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new PageFetchException("interrupted", e, false);
      } finally {
        active.decrementAndGet();
      }
    }
  }
}
