package org.chucc.configstore.eventlog;

import java.util.List;

/**
 * Acknowledgement of a successful append.
 *
 * @param streamId the stream appended to
 * @param newVersion the stream version after the append
 * @param recorded the envelopes of the appended events, in append order
 */
public record AppendResult(String streamId, long newVersion, List<RecordedEvent> recorded) {

  /**
   * Creates an AppendResult holding an immutable copy of the recorded events.
   */
  public AppendResult {
    recorded = List.copyOf(recorded);
  }
}
