package org.waabox.outagewatch;

/**
 * Thrown when a refresh is requested while another one is running and the
 * orchestrator is configured to reject concurrent requests.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RefreshInProgressException extends OutageWatchException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public RefreshInProgressException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public RefreshInProgressException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
