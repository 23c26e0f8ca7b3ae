package org.waabox.outagewatch;

/**
 * Thrown when the staged modeled tables cannot replace the live ones.
 *
 * <p>The previous live store is restored before this exception is thrown.
 * A swap failure is not retried automatically.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SwapException extends OutageWatchException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public SwapException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public SwapException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
