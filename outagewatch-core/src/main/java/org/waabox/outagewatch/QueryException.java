package org.waabox.outagewatch;

/**
 * Thrown when a read request carries invalid filter or paging parameters.
 *
 * <p>Nothing is mutated; the message describes the offending parameter.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class QueryException extends OutageWatchException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public QueryException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public QueryException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
