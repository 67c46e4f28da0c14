package org.chucc.configstore.eventlog;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicInteger;
import org.chucc.configstore.event.ConfigEvent;
import org.chucc.configstore.exception.EventLogUnavailableException;
import org.chucc.configstore.exception.WrongExpectedVersionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process reference implementation of {@link EventLog}.
 *
 * <p>Streams and the global log live in plain collections guarded by this
 * instance's monitor. Appended events are offered to a {@link SubmissionPublisher}
 * while the monitor is held, so subscribers see each stream in append order.
 * Offers never block: a subscriber whose buffer is full misses the event and
 * notices the gap on the next event of that stream. Nothing survives a restart.
 *
 * <p>Once {@link #close() closed}, appends fail with {@link EventLogUnavailableException}
 * and store nothing. Reads keep returning what was stored.
 */
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public final class InMemoryEventLog implements EventLog, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(InMemoryEventLog.class);

  private static final AtomicInteger INSTANCES = new AtomicInteger();

  private final Map<String, List<RecordedEvent>> streams = new HashMap<>();
  private final List<RecordedEvent> all = new ArrayList<>();
  private final Clock clock;
  private final int subscriberBufferSize;
  private final ExecutorService deliveryExecutor;
  private SubmissionPublisher<RecordedEvent> bus;
  private boolean closed;

  /**
   * Creates an in-memory event log.
   *
   * @param clock the clock used to stamp recorded events
   * @param subscriberBufferSize the per-subscriber buffer of the live feed
   */
  public InMemoryEventLog(Clock clock, int subscriberBufferSize) {
    this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    if (subscriberBufferSize < 1) {
      throw new IllegalArgumentException(
          "Subscriber buffer size must be positive: " + subscriberBufferSize);
    }
    this.subscriberBufferSize = subscriberBufferSize;
    String threadName = "event-log-feed-" + INSTANCES.incrementAndGet();
    this.deliveryExecutor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, threadName);
      thread.setDaemon(true);
      return thread;
    });
    this.bus = newBus();
  }

  @Override
  public synchronized AppendResult append(
      String streamId, ExpectedVersion expectedVersion, List<ConfigEvent> events) {
    Objects.requireNonNull(streamId, "Stream ID cannot be null");
    Objects.requireNonNull(expectedVersion, "Expected version cannot be null");
    if (events == null || events.isEmpty()) {
      throw new IllegalArgumentException("At least one event is required");
    }
    ensureOpen();

    List<RecordedEvent> stream = streams.getOrDefault(streamId, List.of());
    long currentVersion = stream.size();
    if (!expectedVersion.matches(currentVersion)) {
      logger.debug("Rejecting append to {}: expected version {} but stream is at {}",
          streamId, expectedVersion, currentVersion);
      throw new WrongExpectedVersionException(
          streamId, expectedVersion.version(), currentVersion);
    }

    List<RecordedEvent> recorded = new ArrayList<>(events.size());
    long version = currentVersion;
    for (ConfigEvent event : events) {
      version++;
      recorded.add(new RecordedEvent(
          streamId,
          version,
          all.size() + recorded.size() + 1L,
          event,
          ConfigStreams.metadata(event.key()),
          clock.instant()));
    }

    streams.computeIfAbsent(streamId, k -> new ArrayList<>()).addAll(recorded);
    all.addAll(recorded);
    recorded.forEach(event -> bus.offer(event, this::onDrop));

    logger.debug("Appended {} event(s) to {}, stream now at version {}",
        recorded.size(), streamId, version);
    return new AppendResult(streamId, version, recorded);
  }

  @Override
  public synchronized Optional<List<RecordedEvent>> readForward(String streamId) {
    List<RecordedEvent> stream = streams.get(streamId);
    return stream == null ? Optional.empty() : Optional.of(List.copyOf(stream));
  }

  @Override
  public synchronized List<RecordedEvent> readAllForward() {
    return List.copyOf(all);
  }

  @Override
  public synchronized Flow.Publisher<RecordedEvent> subscribeAll() {
    ensureOpen();
    return bus;
  }

  /**
   * Drops every current live subscription with the given cause, as a lost broker
   * connection would. Later calls to {@link #subscribeAll()} get a fresh feed.
   *
   * @param cause the failure reported to subscribers
   */
  public synchronized void disconnectSubscribers(Throwable cause) {
    ensureOpen();
    logger.warn("Disconnecting {} live subscriber(s): {}",
        bus.getNumberOfSubscribers(), cause.getMessage());
    bus.closeExceptionally(cause);
    bus = newBus();
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    bus.close();
    deliveryExecutor.shutdown();
  }

  private void ensureOpen() {
    if (closed) {
      throw new EventLogUnavailableException("Event log is closed");
    }
  }

  private boolean onDrop(Flow.Subscriber<? super RecordedEvent> subscriber, RecordedEvent event) {
    logger.warn("Live subscriber buffer full, dropped {} v{} (global position {})",
        event.streamId(), event.streamVersion(), event.globalPosition());
    return false;
  }

  private SubmissionPublisher<RecordedEvent> newBus() {
    return new SubmissionPublisher<>(deliveryExecutor, subscriberBufferSize);
  }
}
