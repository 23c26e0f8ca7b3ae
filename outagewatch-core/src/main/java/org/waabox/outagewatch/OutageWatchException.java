package org.waabox.outagewatch;

/**
 * Base exception for all outagewatch errors.
 *
 * <p>This is an unchecked exception intended to wrap infrastructure and
 * pipeline failures that cannot be meaningfully recovered from at the call
 * site. Each pipeline stage throws its own subtype so callers (the web layer
 * in particular) can map failures to a response without inspecting
 * messages.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class OutageWatchException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public OutageWatchException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public OutageWatchException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
