package org.waabox.outagewatch;

/**
 * Thrown when a raw upstream row is missing a natural key field or carries
 * a value that cannot be parsed.
 *
 * <p>Validation failures are row-level: the connector counts and skips the
 * row and the run continues.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ValidationException extends OutageWatchException {

  private static final long serialVersionUID = 1L;

  /** The name of the offending field, never null. */
  private final String field;

  /** Creates a new exception for the given field.
   *
   * @param theField the name of the offending field, cannot be null.
   * @param message the detail message, cannot be null.
   */
  public ValidationException(final String theField, final String message) {
    super(message);
    field = theField;
  }

  /** Returns the name of the field that failed validation.
   *
   * @return the field name, never null.
   */
  public String field() {
    return field;
  }
}
