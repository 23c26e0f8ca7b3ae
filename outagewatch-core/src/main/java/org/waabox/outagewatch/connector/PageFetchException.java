package org.waabox.outagewatch.connector;

import org.waabox.outagewatch.OutageWatchException;

/**
 * Thrown by an {@link OutagePageSource} when a single page cannot be
 * fetched.
 *
 * <p>The {@link #retryable()} flag tells the connector whether another
 * attempt can succeed: network failures, timeouts, 5xx answers and malformed
 * bodies are retryable, rejected credentials are not.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PageFetchException extends OutageWatchException {

  private static final long serialVersionUID = 1L;

  /** Whether another attempt may succeed. */
  private final boolean retryable;

  /** Creates a new exception.
   *
   * @param message the detail message, cannot be null.
   * @param isRetryable whether another attempt may succeed.
   */
  public PageFetchException(final String message, final boolean isRetryable) {
    super(message);
    retryable = isRetryable;
  }

  /** Creates a new exception with a cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   * @param isRetryable whether another attempt may succeed.
   */
  public PageFetchException(final String message, final Throwable cause,
      final boolean isRetryable) {
    super(message, cause);
    retryable = isRetryable;
  }

  /** Returns whether another attempt at the same page may succeed.
   *
   * @return true for transient failures.
   */
  public boolean retryable() {
    return retryable;
  }
}
