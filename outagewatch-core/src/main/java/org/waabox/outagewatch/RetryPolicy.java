package org.waabox.outagewatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines the retry behavior for upstream page fetches.
 *
 * <p>Instances are created through static factory methods. The default
 * policy makes up to 3 attempts per page, waiting 5 seconds after the first
 * failure and doubling the wait after every further failure.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default number of attempts. */
  private static final int DEFAULT_MAX_ATTEMPTS = 3;

  /** The default initial backoff duration. */
  private static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(5);

  /** The upper bound for a single backoff, regardless of the attempt. */
  private static final Duration MAX_BACKOFF = Duration.ofMinutes(2);

  /** The maximum number of attempts per page. */
  private final int maxAttempts;

  /** The duration to wait after the first failed attempt. */
  private final Duration backoff;

  /**
   * Creates a new retry policy.
   *
   * @param maxAttempts the maximum number of attempts, greater than zero
   * @param backoff     the initial backoff, never null
   */
  private RetryPolicy(final int maxAttempts, final Duration backoff) {
    this.maxAttempts = maxAttempts;
    this.backoff = backoff;
  }

  /**
   * Creates a retry policy with the given parameters.
   *
   * @param maxAttempts the maximum number of attempts per page, must be
   *                    greater than zero
   * @param backoff     the wait after the first failed attempt, never null,
   *                    zero is allowed (no wait)
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxAttempts is less than or equal
   *                                  to zero or backoff is negative
   * @throws NullPointerException if backoff is null
   */
  public static RetryPolicy of(final int maxAttempts,
      final Duration backoff) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be greater than 0, got: " + maxAttempts);
    }
    Objects.requireNonNull(backoff, "backoff must not be null");
    if (backoff.isNegative()) {
      throw new IllegalArgumentException(
          "backoff must not be negative, got: " + backoff);
    }
    return new RetryPolicy(maxAttempts, backoff);
  }

  /**
   * Creates a retry policy with sensible defaults: 3 attempts with a
   * 5-second initial backoff.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF);
  }

  /**
   * Returns the maximum number of attempts per page.
   *
   * @return the maximum number of attempts, always greater than zero
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns the wait after the first failed attempt.
   *
   * @return the initial backoff, never null
   */
  public Duration backoff() {
    return backoff;
  }

  /**
   * Returns the wait that follows the given failed attempt.
   *
   * <p>The wait doubles with every attempt: {@code backoff * 2^(attempt-1)},
   * capped at two minutes.
   *
   * @param attempt the 1-based number of the attempt that just failed
   * @return the duration to wait before the next attempt, never null
   *
   * @throws IllegalArgumentException if attempt is less than 1
   */
  public Duration backoffAfter(final int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException(
          "attempt must be at least 1, got: " + attempt);
    }
    final int shift = Math.min(attempt - 1, 16);
    final Duration wait = backoff.multipliedBy(1L << shift);
    return wait.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : wait;
  }
}
