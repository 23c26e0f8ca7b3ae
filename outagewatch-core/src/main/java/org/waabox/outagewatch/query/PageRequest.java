package org.waabox.outagewatch.query;

import org.waabox.outagewatch.QueryException;

/**
 * A 1-based page of a filtered result.
 *
 * <p>Limits above {@link #MAX_LIMIT} are clamped, never rejected.
 *
 * @param page  the 1-based page number
 * @param limit the page size, between 1 and {@link #MAX_LIMIT}
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PageRequest(int page, int limit) {

  /** The page size used when the caller does not ask for one. */
  public static final int DEFAULT_LIMIT = 100;

  /** The largest page size served. */
  public static final int MAX_LIMIT = 1000;

  /** Validates and clamps. */
  public PageRequest {
    if (page < 1) {
      throw new QueryException("page must be >= 1, got: " + page);
    }
    if (limit < 1) {
      throw new QueryException("limit must be >= 1, got: " + limit);
    }
    limit = Math.min(limit, MAX_LIMIT);
  }

  /**
   * Creates a page request, applying defaults for missing values.
   *
   * @param page  the page number, null for 1
   * @param limit the page size, null for {@link #DEFAULT_LIMIT}
   * @return the request, never null
   *
   * @throws QueryException if a value is below 1
   */
  public static PageRequest of(final Integer page, final Integer limit) {
    return new PageRequest(page == null ? 1 : page,
        limit == null ? DEFAULT_LIMIT : limit);
  }

  /**
   * Returns the index of the first row of this page.
   *
   * @return the zero-based offset, may exceed any result size
   */
  public long offset() {
    return (long) (page - 1) * limit;
  }
}
