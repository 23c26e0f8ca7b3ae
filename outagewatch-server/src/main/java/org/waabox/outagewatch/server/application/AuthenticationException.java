package org.waabox.outagewatch.server.application;

import org.waabox.outagewatch.OutageWatchException;

/**
 * Thrown when a protected endpoint is called without the configured bearer
 * token.
 *
 * <p>A missing token maps to HTTP 401, a wrong one to HTTP 403.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AuthenticationException extends OutageWatchException {

  private static final long serialVersionUID = 1L;

  /** Whether no token was presented at all. */
  private final boolean missing;

  /** Creates a new exception.
   *
   * @param message the detail message, cannot be null.
   * @param isMissing whether no token was presented.
   */
  private AuthenticationException(final String message,
      final boolean isMissing) {
    super(message);
    missing = isMissing;
  }

  /** Creates the exception for a request without a bearer token.
   *
   * @return the exception, never null.
   */
  public static AuthenticationException missingToken() {
    return new AuthenticationException("Missing bearer token", true);
  }

  /** Creates the exception for a request with the wrong bearer token.
   *
   * @return the exception, never null.
   */
  public static AuthenticationException invalidToken() {
    return new AuthenticationException("Invalid token", false);
  }

  /** @return true if no token was presented, false if it was wrong */
  public boolean missing() {
    return missing;
  }
}
