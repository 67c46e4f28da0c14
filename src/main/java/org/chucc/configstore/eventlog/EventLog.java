package org.chucc.configstore.eventlog;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Flow;
import org.chucc.configstore.event.ConfigEvent;
import org.chucc.configstore.exception.EventLogUnavailableException;
import org.chucc.configstore.exception.WrongExpectedVersionException;

/**
 * Durable, per-stream ordered, append-only event log.
 * The source of truth for the config store; everything else is derived from it.
 *
 * <p>Implementations must surface I/O failures and timeouts as
 * {@link EventLogUnavailableException} rather than retrying indefinitely.
 */
public interface EventLog {

  /**
   * Atomically appends events to a stream if its current version matches the expectation.
   * Either all events are stored or none are.
   *
   * @param streamId the stream to append to
   * @param expectedVersion the version the writer observed, or {@link ExpectedVersion#ANY}
   * @param events the events to append (at least one)
   * @return the acknowledgement with the recorded envelopes
   * @throws WrongExpectedVersionException if the stream version does not match
   * @throws EventLogUnavailableException if the log cannot be reached
   * @throws IllegalArgumentException if {@code events} is empty
   */
  AppendResult append(String streamId, ExpectedVersion expectedVersion, List<ConfigEvent> events);

  /**
   * Reads all events of a stream in append order.
   *
   * @param streamId the stream to read
   * @return the events, or empty if the stream was never written
   * @throws EventLogUnavailableException if the log cannot be reached
   */
  Optional<List<RecordedEvent>> readForward(String streamId);

  /**
   * Reads every event across every stream in global append order.
   * Used for full projection rebuilds.
   *
   * @return all recorded events
   * @throws EventLogUnavailableException if the log cannot be reached
   */
  List<RecordedEvent> readAllForward();

  /**
   * Subscribes to events appended from now on.
   * Delivery is at-least-once and ordered within a stream; ordering between streams
   * is not guaranteed. A subscriber receives {@code onError} when the feed is lost.
   *
   * @return the live event feed
   */
  Flow.Publisher<RecordedEvent> subscribeAll();
}
