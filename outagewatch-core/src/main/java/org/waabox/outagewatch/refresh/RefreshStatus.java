package org.waabox.outagewatch.refresh;

import java.time.Instant;
import java.util.Optional;

/**
 * A point-in-time view of the orchestrator.
 *
 * @param state        the current stage, never null
 * @param lastStarted  when the last refresh started, null if none ran
 * @param lastFinished when the last refresh ended, null if none ended
 * @param lastResult   the last successful result, null if none
 * @param lastFailure  the message of the last failure, null if the last
 *                     refresh succeeded
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RefreshStatus(RefreshState state, Instant lastStarted,
    Instant lastFinished, RefreshResult lastResult, String lastFailure) {

  /** @return the last successful result, if any */
  public Optional<RefreshResult> result() {
    return Optional.ofNullable(lastResult);
  }

  /** @return the last failure message, if the last refresh failed */
  public Optional<String> failure() {
    return Optional.ofNullable(lastFailure);
  }
}
