package org.waabox.outagewatch.metrics;

import java.time.Duration;

import org.waabox.outagewatch.connector.ExtractionResult;
import org.waabox.outagewatch.refresh.RefreshState;

/**
 * An abstraction for recording operational metrics of the outage pipeline.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopOutageWatchMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface OutageWatchMetrics {

  /**
   * Records a completed extraction.
   *
   * @param result the extraction summary, never null
   */
  void extractionCompleted(ExtractionResult result);

  /**
   * Records a refresh that was swapped in.
   *
   * @param facts   the number of fact rows now live
   * @param elapsed the wall time of the whole refresh, never null
   */
  void refreshCompleted(int facts, Duration elapsed);

  /**
   * Records a failed refresh.
   *
   * @param stage the stage that failed, never null
   * @param cause the throwable that caused the failure, never null
   */
  void refreshFailed(RefreshState stage, Throwable cause);

  /**
   * Records a load of the joined view into the cache.
   *
   * @param rows    the number of joined rows
   * @param elapsed the time the load and join took, never null
   */
  void cacheLoaded(int rows, Duration elapsed);
}
