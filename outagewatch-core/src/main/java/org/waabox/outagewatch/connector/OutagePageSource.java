package org.waabox.outagewatch.connector;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A paginated, read-only source of raw outage rows.
 *
 * <p>Implementations talk to the upstream API. Pages are addressed by a row
 * offset and a page length, and the source is expected to return rows
 * newest-{@code period} first. The connector does not trust that ordering
 * for correctness; it only uses it to stop paging early.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface OutagePageSource {

  /**
   * Fetches a single page.
   *
   * @param offset the zero-based row offset of the page
   * @param length the maximum number of rows to return, greater than zero
   *
   * @return the rows of the page as JSON objects, empty when the offset is
   *         past the end of the feed, never null
   *
   * @throws PageFetchException if the page cannot be fetched or parsed
   */
  List<JsonNode> fetchPage(int offset, int length);
}
