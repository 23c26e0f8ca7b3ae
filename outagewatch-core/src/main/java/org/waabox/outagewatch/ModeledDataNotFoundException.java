package org.waabox.outagewatch;

/**
 * Thrown when the modeled store has never been built, so there is nothing
 * to serve yet.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ModeledDataNotFoundException extends OutageWatchException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ModeledDataNotFoundException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ModeledDataNotFoundException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
