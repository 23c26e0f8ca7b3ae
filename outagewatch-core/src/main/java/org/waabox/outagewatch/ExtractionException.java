package org.waabox.outagewatch;

/**
 * Thrown when the upstream feed cannot be paged to completion.
 *
 * <p>Raised after the retry budget for a page is exhausted, on a malformed
 * page, or immediately on an authentication failure. The raw store is never
 * written when this exception escapes an extraction.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ExtractionException extends OutageWatchException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ExtractionException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ExtractionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
