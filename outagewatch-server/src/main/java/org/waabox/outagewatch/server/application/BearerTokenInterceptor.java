package org.waabox.outagewatch.server.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Requires {@code Authorization: Bearer <token>} on every request it
 * intercepts.
 *
 * <p>A blank configured token disables the check.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class BearerTokenInterceptor implements HandlerInterceptor {

  /** The authorization scheme prefix. */
  private static final String BEARER = "Bearer ";

  /** The expected token bytes, null when the check is disabled. */
  private final byte[] expected;

  /** Creates a new interceptor.
   *
   * @param token the required token, null or blank to disable the check
   */
  public BearerTokenInterceptor(final String token) {
    expected = token == null || token.isBlank()
        ? null : token.getBytes(StandardCharsets.UTF_8);
  }

  /** @return true if requests must carry the token */
  public boolean enabled() {
    return expected != null;
  }

  /** {@inheritDoc}
   *
   * @throws AuthenticationException if the token is missing or wrong
   */
  @Override
  public boolean preHandle(final HttpServletRequest request,
      final HttpServletResponse response, final Object handler) {
    if (expected == null) {
      return true;
    }
    final String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || !header.regionMatches(true, 0, BEARER, 0,
        BEARER.length()) || header.substring(BEARER.length()).isBlank()) {
      throw AuthenticationException.missingToken();
    }
    final byte[] presented = header.substring(BEARER.length()).trim()
        .getBytes(StandardCharsets.UTF_8);
    if (!MessageDigest.isEqual(expected, presented)) {
      throw AuthenticationException.invalidToken();
    }
    return true;
  }
}
