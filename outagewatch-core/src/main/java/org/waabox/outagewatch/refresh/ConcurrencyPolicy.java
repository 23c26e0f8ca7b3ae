package org.waabox.outagewatch.refresh;

/**
 * What to do with a refresh requested while another one runs.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ConcurrencyPolicy {

  /** Fail the request with a {@code RefreshInProgressException}. */
  REJECT,

  /** Wait for the running refresh to end, then run. */
  QUEUE
}
