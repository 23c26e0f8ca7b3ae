package org.waabox.outagewatch;

/**
 * Thrown when the star-schema transform or the staging write fails.
 *
 * <p>The staging location is discarded and the live modeled store is left
 * untouched.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BuildException extends OutageWatchException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public BuildException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public BuildException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
