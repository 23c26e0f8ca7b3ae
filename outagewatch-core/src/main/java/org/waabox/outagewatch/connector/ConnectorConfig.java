package org.waabox.outagewatch.connector;

import java.util.Objects;

import org.waabox.outagewatch.RetryPolicy;

/**
 * Configuration holder for the {@link OutageConnector}.
 *
 * <p>Use {@link #builder()} to create instances. Unset values fall back to
 * the defaults below:
 * <ul>
 *   <li>page size: 5000 rows</li>
 *   <li>record cap: none ({@code 0})</li>
 *   <li>retry policy: {@link RetryPolicy#defaultPolicy()}</li>
 *   <li>incremental: off</li>
 *   <li>early stop: off, because the newest-first ordering of the feed
 *       cannot be verified up front</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConnectorConfig {

  /** The default page size, the upstream maximum. */
  private static final int DEFAULT_PAGE_SIZE = 5000;

  /** The number of rows requested per page. */
  private final int pageSize;

  /** The cap on fetched rows, 0 for no cap. */
  private final int maxRecords;

  /** The retry policy applied to every page, never null. */
  private final RetryPolicy retryPolicy;

  /** Whether to merge into the existing raw store. */
  private final boolean incremental;

  /** Whether to stop paging once pages only hold already-known periods. */
  private final boolean earlyStop;

  /** Creates a config from the builder.
   *
   * @param builder the builder, never null
   */
  private ConnectorConfig(final Builder builder) {
    if (builder.pageSize <= 0) {
      throw new IllegalArgumentException(
          "pageSize must be greater than 0, got: " + builder.pageSize);
    }
    if (builder.maxRecords < 0) {
      throw new IllegalArgumentException(
          "maxRecords must not be negative, got: " + builder.maxRecords);
    }
    pageSize = builder.pageSize;
    maxRecords = builder.maxRecords;
    retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : RetryPolicy.defaultPolicy();
    incremental = builder.incremental;
    earlyStop = builder.earlyStop;
  }

  /** Returns a configuration with every default applied.
   *
   * @return the default configuration, never null
   */
  public static ConnectorConfig defaults() {
    return builder().build();
  }

  /** Creates a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** @return the number of rows requested per page, always positive */
  public int pageSize() {
    return pageSize;
  }

  /** @return the cap on fetched rows, 0 when uncapped */
  public int maxRecords() {
    return maxRecords;
  }

  /** @return the retry policy, never null */
  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /** @return whether runs merge into the existing raw store */
  public boolean incremental() {
    return incremental;
  }

  /** @return whether the early-stop rule is enabled */
  public boolean earlyStop() {
    return earlyStop;
  }

  /** Builder for {@link ConnectorConfig}. */
  public static final class Builder {

    /** The page size. */
    private int pageSize = DEFAULT_PAGE_SIZE;

    /** The record cap. */
    private int maxRecords;

    /** The retry policy, null means default. */
    private RetryPolicy retryPolicy;

    /** The incremental flag. */
    private boolean incremental;

    /** The early-stop flag. */
    private boolean earlyStop;

    /** Private constructor, use {@link ConnectorConfig#builder()}. */
    private Builder() {
    }

    /** Sets the page size.
     *
     * @param thePageSize rows per page, greater than zero
     * @return this builder, never null
     */
    public Builder pageSize(final int thePageSize) {
      pageSize = thePageSize;
      return this;
    }

    /** Sets the cap on fetched rows.
     *
     * @param theMaxRecords the cap, 0 for none
     * @return this builder, never null
     */
    public Builder maxRecords(final int theMaxRecords) {
      maxRecords = theMaxRecords;
      return this;
    }

    /** Sets the retry policy.
     *
     * @param theRetryPolicy the policy, never null
     * @return this builder, never null
     */
    public Builder retryPolicy(final RetryPolicy theRetryPolicy) {
      retryPolicy = Objects.requireNonNull(theRetryPolicy,
          "retryPolicy cannot be null");
      return this;
    }

    /** Enables or disables incremental merging.
     *
     * @param isIncremental true to merge into the existing store
     * @return this builder, never null
     */
    public Builder incremental(final boolean isIncremental) {
      incremental = isIncremental;
      return this;
    }

    /** Enables or disables the early-stop rule.
     *
     * @param isEarlyStop true to stop on pages with only known periods
     * @return this builder, never null
     */
    public Builder earlyStop(final boolean isEarlyStop) {
      earlyStop = isEarlyStop;
      return this;
    }

    /** Builds the configuration.
     *
     * @return the configuration, never null
     * @throws IllegalArgumentException if a numeric value is out of range
     */
    public ConnectorConfig build() {
      return new ConnectorConfig(this);
    }
  }
}
