package org.waabox.outagewatch.refresh;

/**
 * The stages of a refresh.
 *
 * <p>A refresh moves {@code IDLE -> EXTRACTING -> BUILDING -> SWAPPING ->
 * IDLE}; a failure in any stage leads to {@code FAILED}, which is left on
 * the next refresh.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum RefreshState {

  /** No refresh is running. */
  IDLE,

  /** The connector is fetching upstream pages. */
  EXTRACTING,

  /** The star schema is being built and staged. */
  BUILDING,

  /** The staged tables are replacing the live ones. */
  SWAPPING,

  /** The last refresh failed; live data is unchanged. */
  FAILED
}
