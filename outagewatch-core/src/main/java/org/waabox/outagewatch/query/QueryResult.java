package org.waabox.outagewatch.query;

import java.util.List;
import java.util.Objects;

/**
 * A page of the filtered outage view.
 *
 * @param rows       the rows of the page, never null
 * @param totalCount the size of the whole filtered result
 * @param page       the served page number
 * @param limit      the served page size, after clamping
 * @param version    the version of the cached view that answered
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record QueryResult(List<OutageView> rows, int totalCount, int page,
    int limit, long version) {

  /** Copies the rows into an unmodifiable list. */
  public QueryResult {
    rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
  }
}
