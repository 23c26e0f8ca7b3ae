package org.waabox.outagewatch.metrics;

import java.time.Duration;

import org.waabox.outagewatch.connector.ExtractionResult;
import org.waabox.outagewatch.refresh.RefreshState;

/**
 * A no-op implementation of {@link OutageWatchMetrics} that discards all
 * recorded metrics.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NoopOutageWatchMetrics implements OutageWatchMetrics {

  /** The shared instance. */
  public static final NoopOutageWatchMetrics INSTANCE =
      new NoopOutageWatchMetrics();

  /** Use {@link #INSTANCE}. */
  private NoopOutageWatchMetrics() {
  }

  /** {@inheritDoc} */
  @Override
  public void extractionCompleted(final ExtractionResult result) {
  }

  /** {@inheritDoc} */
  @Override
  public void refreshCompleted(final int facts, final Duration elapsed) {
  }

  /** {@inheritDoc} */
  @Override
  public void refreshFailed(final RefreshState stage,
      final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void cacheLoaded(final int rows, final Duration elapsed) {
  }
}
