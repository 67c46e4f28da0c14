package org.chucc.configstore.projection;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicReference;
import org.chucc.configstore.config.ProjectionProperties;
import org.chucc.configstore.eventlog.EventLog;
import org.chucc.configstore.eventlog.RecordedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the {@link ConfigStateProjection} current by consuming the event log's live feed.
 * Only started in {@link ConsistencyMode#LIVE}.
 *
 * <h2>Recovery Strategy</h2>
 *
 * <p>The projection is never patched forward after a doubt about its correctness:
 * <ul>
 *   <li><strong>Redelivery:</strong> events already seen (by event ID, then by stream
 *       version) are skipped.</li>
 *   <li><strong>Gap:</strong> a stream version arriving out of sequence triggers a
 *       full {@link ConfigStateProjection#rebuild()}.</li>
 *   <li><strong>Disconnect:</strong> when the feed fails, the updater re-subscribes
 *       first and then rebuilds, so no event falls between the two.</li>
 * </ul>
 *
 * <p>A failure while handling an event cancels the current subscription and
 * goes through the disconnect path. It never propagates into the publisher.
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class LiveProjectionUpdater {
  private static final Logger logger = LoggerFactory.getLogger(LiveProjectionUpdater.class);

  /**
   * Connection state of the live feed.
   */
  public enum FeedState {
    /** Not started, or stopped on shutdown. */
    STOPPED,
    /** Subscribed and receiving events. */
    CONNECTED,
    /** The feed was lost and could not be re-established. */
    DISCONNECTED
  }

  private final ConfigStateProjection projection;
  private final EventLog eventLog;
  private final ProjectionProperties projectionProperties;

  // Deduplication: LRU cache of processed event IDs
  private final Cache<String, Boolean> processedEventIds;

  private final AtomicReference<FeedSubscriber> activeSubscriber = new AtomicReference<>();
  private volatile FeedState state = FeedState.STOPPED;
  private volatile boolean rebuildPending;

  /**
   * Constructs a LiveProjectionUpdater.
   *
   * @param projection the projection to keep current
   * @param eventLog the event log providing the live feed
   * @param projectionProperties the projection configuration properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Dependencies are Spring-managed beans and are intentionally shared")
  public LiveProjectionUpdater(
      ConfigStateProjection projection,
      EventLog eventLog,
      ProjectionProperties projectionProperties) {
    this.projection = projection;
    this.eventLog = eventLog;
    this.projectionProperties = projectionProperties;

    this.processedEventIds = Caffeine.newBuilder()
        .maximumSize(projectionProperties.getDeduplication().getCacheSize())
        .<String, Boolean>build();
  }

  /**
   * Subscribes to the live feed. The caller rebuilds the projection afterwards.
   */
  public void start() {
    logger.info("Starting live projection updates");
    connect();
  }

  /**
   * Cancels the live subscription.
   */
  @PreDestroy
  public void stop() {
    FeedSubscriber subscriber = activeSubscriber.getAndSet(null);
    if (subscriber != null) {
      subscriber.cancel();
      logger.info("Stopped live projection updates");
    }
    state = FeedState.STOPPED;
  }

  /**
   * Gets the connection state of the live feed.
   *
   * @return the feed state
   */
  public FeedState state() {
    return state;
  }

  /**
   * Handles one event from the live feed.
   *
   * @param recorded the recorded event
   */
  void handleEvent(RecordedEvent recorded) {
    String eventId = recorded.event().eventId();
    boolean deduplicate = projectionProperties.getDeduplication().isEnabled();
    if (deduplicate && processedEventIds.getIfPresent(eventId) != null) {
      logger.debug("Skipping duplicate delivery of event {} for stream {}",
          eventId, recorded.streamId());
      return;
    }

    if (rebuildPending) {
      logger.info("Retrying pending projection rebuild before applying event {}", eventId);
      rebuild();
    }

    ApplyOutcome outcome = projection.apply(recorded);
    if (outcome == ApplyOutcome.GAP) {
      logger.warn("Live feed skipped events of stream {} before v{}, rebuilding projection",
          recorded.streamId(), recorded.streamVersion());
      rebuild();
    }

    if (deduplicate) {
      processedEventIds.put(eventId, Boolean.TRUE);
    }
  }

  /**
   * Recovers from a lost feed: re-subscribe, then rebuild.
   *
   * @param subscriber the subscriber whose feed failed
   * @param cause the failure
   */
  void handleFeedFailure(FeedSubscriber subscriber, Throwable cause) {
    if (!activeSubscriber.compareAndSet(subscriber, null)) {
      logger.debug("Ignoring failure of a superseded subscription: {}", cause.getMessage());
      return;
    }
    logger.warn("Live event feed lost ({}), re-subscribing and rebuilding projection",
        cause.getMessage());
    state = FeedState.DISCONNECTED;
    if (connect()) {
      rebuild();
    }
  }

  private boolean connect() {
    FeedSubscriber subscriber = new FeedSubscriber();
    activeSubscriber.set(subscriber);
    try {
      eventLog.subscribeAll().subscribe(subscriber);
      state = FeedState.CONNECTED;
      return true;
    } catch (RuntimeException ex) {
      activeSubscriber.compareAndSet(subscriber, null);
      state = FeedState.DISCONNECTED;
      logger.error("Failed to subscribe to the live event feed,"
          + " projection will only change on rebuild", ex);
      return false;
    }
  }

  private void rebuild() {
    try {
      projection.rebuild();
      rebuildPending = false;
    } catch (RuntimeException ex) {
      rebuildPending = true;
      logger.error("Projection rebuild from live updater failed, retrying on next event: {}",
          ex.getMessage(), ex);
    }
  }

  /**
   * Subscriber bound to one connection of the live feed.
   */
  final class FeedSubscriber implements Flow.Subscriber<RecordedEvent> {
    private volatile Flow.Subscription subscription;

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
      this.subscription = subscription;
      logger.info("Subscribed to live event feed");
      subscription.request(1);
    }

    @Override
    @SuppressFBWarnings(
        value = "REC_CATCH_EXCEPTION",
        justification = "Any projection failure is turned into a feed recovery")
    public void onNext(RecordedEvent item) {
      if (activeSubscriber.get() != this) {
        return;
      }
      try {
        handleEvent(item);
        subscription.request(1);
      } catch (RuntimeException ex) {
        logger.error("Failed to project live event {} (stream {} v{})",
            item.event().eventId(), item.streamId(), item.streamVersion(), ex);
        subscription.cancel();
        handleFeedFailure(this, ex);
      }
    }

    @Override
    public void onError(Throwable throwable) {
      handleFeedFailure(this, throwable);
    }

    @Override
    public void onComplete() {
      if (activeSubscriber.compareAndSet(this, null)) {
        logger.info("Live event feed completed");
        state = FeedState.STOPPED;
      }
    }

    void cancel() {
      Flow.Subscription current = subscription;
      if (current != null) {
        current.cancel();
      }
    }
  }
}
