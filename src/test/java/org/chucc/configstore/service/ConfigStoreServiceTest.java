package org.chucc.configstore.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.chucc.configstore.audit.ConfigChangeNotifier;
import org.chucc.configstore.audit.ConfigChangedNotification;
import org.chucc.configstore.command.DeleteConfigValueCommandHandler;
import org.chucc.configstore.command.SetConfigValueCommandHandler;
import org.chucc.configstore.config.ProjectionProperties;
import org.chucc.configstore.domain.ConfigValueAggregate;
import org.chucc.configstore.event.ConfigEvent;
import org.chucc.configstore.event.ConfigEventSerializer;
import org.chucc.configstore.eventlog.AppendResult;
import org.chucc.configstore.eventlog.EventLog;
import org.chucc.configstore.eventlog.ExpectedVersion;
import org.chucc.configstore.eventlog.InMemoryEventLog;
import org.chucc.configstore.eventlog.RecordedEvent;
import org.chucc.configstore.exception.ConfigAlreadyDeletedException;
import org.chucc.configstore.exception.ConfigNotFoundException;
import org.chucc.configstore.exception.EventLogUnavailableException;
import org.chucc.configstore.exception.InvalidTimestampException;
import org.chucc.configstore.projection.ConfigEntry;
import org.chucc.configstore.projection.ConfigStateProjection;
import org.chucc.configstore.projection.ConsistencyMode;
import org.chucc.configstore.repository.ConfigValueRepository;
import org.chucc.configstore.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Tests for ConfigStoreService wired to the in-memory event log.
 */
class ConfigStoreServiceTest {

  private MutableClock clock;
  private InMemoryEventLog eventLog;
  private ApplicationEventPublisher publisher;
  private MeterRegistry meterRegistry;
  private ProjectionProperties properties;
  private ConfigStateProjection projection;
  private ConfigValueRepository repository;
  private ConfigStoreService service;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2025-01-01T00:00:00Z");
    eventLog = new InMemoryEventLog(clock, 64);
    publisher = mock(ApplicationEventPublisher.class);
    properties = new ProjectionProperties();
    service = wire(eventLog);
  }

  @AfterEach
  void tearDown() {
    eventLog.close();
  }

  @Test
  void putThenGet_returnsLatestValueAndFullHistory() {
    service.put("x", "a");
    assertThat(service.get("x")).contains("a");

    service.put("x", "b");
    assertThat(service.get("x")).contains("b");

    List<HistoryEntry> history = service.history("x");
    assertThat(history).hasSize(2);
    assertThat(history).extracting(entry -> entry.data().get("value"))
        .containsExactly("a", "b");
    assertThat(history).extracting(HistoryEntry::streamVersion).containsExactly(1L, 2L);
    assertThat(history.get(1).data()).containsEntry("previous_value", "a");
    assertThat(history.get(0).metadata()).containsEntry("aggregate_id", "x");
  }

  @Test
  void deleteThenPut_resurrectsKey() {
    service.put("y", "1");
    service.delete("y");

    assertThat(service.get("y")).isEmpty();
    assertThat(service.history("y")).extracting(HistoryEntry::eventType)
        .containsExactly("ConfigValueSet", "ConfigValueDeleted");

    service.put("y", "2");

    assertThat(service.get("y")).contains("2");
    assertThat(service.history("y")).hasSize(3);
    assertThat(service.history("y").get(2).data()).containsEntry("previous_value", "1");
  }

  @Test
  void deleteNeverSetKey_isNotFoundEveryTime() {
    assertThatThrownBy(() -> service.delete("never_set"))
        .isInstanceOf(ConfigNotFoundException.class);
    assertThatThrownBy(() -> service.delete("never_set"))
        .isInstanceOf(ConfigNotFoundException.class);

    assertThat(service.history("never_set")).isEmpty();
    assertThat(eventLog.readAllForward()).isEmpty();
  }

  @Test
  void deleteTwice_isAlreadyDeletedWithoutNewEvent() {
    service.put("k", "v");
    service.delete("k");

    assertThatThrownBy(() -> service.delete("k"))
        .isInstanceOf(ConfigAlreadyDeletedException.class);
    assertThat(service.history("k")).hasSize(2);
  }

  @Test
  void concurrentPuts_oneRetriesAndBothAreRecorded() throws Exception {
    // Given: both writers observe version 0 before either appends
    BarrierEventLog barrierLog = new BarrierEventLog(eventLog, 2);
    ConfigStoreService racing = wire(barrierLog);
    ExecutorService writers = Executors.newFixedThreadPool(2);

    try {
      // When
      CompletableFuture<String> first =
          CompletableFuture.supplyAsync(() -> racing.put("z", "v1"), writers);
      CompletableFuture<String> second =
          CompletableFuture.supplyAsync(() -> racing.put("z", "v2"), writers);
      CompletableFuture.allOf(first, second).get(10, TimeUnit.SECONDS);
    } finally {
      writers.shutdownNow();
    }

    // Then
    List<HistoryEntry> history = racing.history("z");
    assertThat(history).hasSize(2);
    String last = (String) history.get(1).data().get("value");
    assertThat(history.get(1).data().get("previous_value"))
        .isEqualTo(history.get(0).data().get("value"));
    assertThat(racing.get("z")).contains(last);
    assertThat(meterRegistry.counter(
        "config.commands", "command", "set", "outcome", "success").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter(
        "config.commands", "command", "set", "outcome", "success_after_retry").count())
        .isEqualTo(1.0);
  }

  @Test
  void at_resolvesValuesOverTimeInclusively() {
    Instant t1 = clock.instant();
    service.put("k", "a");
    clock.advance(Duration.ofMinutes(1));
    Instant t2 = clock.instant();
    service.put("k", "b");
    clock.advance(Duration.ofMinutes(1));
    Instant t3 = clock.instant();
    service.delete("k");

    assertThat(service.at("k", t1.minusMillis(1).toString())).isEmpty();
    assertThat(service.at("k", t1.toString())).contains("a");
    assertThat(service.at("k", t2.minusMillis(1).toString())).contains("a");
    assertThat(service.at("k", t2.toString())).contains("b");
    assertThat(service.at("k", t3.toString())).isEmpty();
  }

  @Test
  void at_followsHistoryPrefixes() {
    for (int i = 0; i < 6; i++) {
      if (i == 3) {
        service.delete("k");
      } else {
        service.put("k", "v" + i);
      }
      clock.advance(Duration.ofSeconds(10));
    }

    List<RecordedEvent> recorded = eventLog.readForward("config-k").orElseThrow();
    for (int i = 0; i < recorded.size(); i++) {
      List<ConfigEvent> prefix = recorded.subList(0, i + 1).stream()
          .map(RecordedEvent::event)
          .toList();
      Optional<String> expected = ConfigValueAggregate.replay(prefix).currentValue();
      assertThat(service.at("k", recorded.get(i).recordedAt().toString()))
          .as("value at version %d", i + 1)
          .isEqualTo(expected);
    }
  }

  @Test
  void at_malformedTimestamp_neverTouchesLog() {
    EventLog log = mock(EventLog.class);
    ConfigStoreService isolated = wire(log);

    assertThatThrownBy(() -> isolated.at("k", "not-a-time"))
        .isInstanceOf(InvalidTimestampException.class);

    verifyNoInteractions(log);
  }

  @Test
  void unavailableLog_propagatesWithoutRetry() {
    EventLog log = mock(EventLog.class);
    when(log.readForward("config-k")).thenThrow(new EventLogUnavailableException("log down"));
    ConfigStoreService isolated = wire(log);

    assertThatThrownBy(() -> isolated.put("k", "v"))
        .isInstanceOf(EventLogUnavailableException.class);
    verify(log, times(1)).readForward("config-k");
  }

  @Test
  void restartOnlyMode_showsWritesAfterRebuild() {
    properties.setMode(ConsistencyMode.RESTART_ONLY);

    service.put("k", "v");

    assertThat(service.consistencyMode()).isEqualTo(ConsistencyMode.RESTART_ONLY);
    assertThat(service.get("k")).isEmpty();
    assertThat(service.history("k")).hasSize(1);

    service.rebuildProjection();

    assertThat(service.get("k")).contains("v");
  }

  @Test
  void put_publishesAuditNotification() {
    service.put("k", "a");
    service.put("k", "b");
    service.delete("k");

    ArgumentCaptor<ConfigChangedNotification> captor =
        ArgumentCaptor.forClass(ConfigChangedNotification.class);
    verify(publisher, times(3)).publishEvent(captor.capture());
    List<ConfigChangedNotification> notifications = captor.getAllValues();
    assertThat(notifications.get(1).oldValue()).isEqualTo("a");
    assertThat(notifications.get(1).newValue()).isEqualTo("b");
    assertThat(notifications.get(2).changeType())
        .isEqualTo(ConfigChangedNotification.ChangeType.DELETED);
  }

  @Test
  void auditFailure_doesNotFailCommand() {
    doThrow(new IllegalStateException("audit sink down"))
        .when(publisher).publishEvent(any(Object.class));

    assertThat(service.put("k", "v")).isEqualTo("v");
    service.delete("k");

    assertThat(service.history("k")).hasSize(2);
  }

  @Test
  void projectionAgreesWithLogAfterRebuild() {
    Random random = new Random(42);
    List<String> keys = List.of("a", "b", "c", "d");
    for (int i = 0; i < 200; i++) {
      String key = keys.get(random.nextInt(keys.size()));
      if (random.nextInt(3) == 0) {
        try {
          service.delete(key);
        } catch (ConfigNotFoundException | ConfigAlreadyDeletedException expected) {
          // expected outcome for absent keys
        }
      } else {
        service.put(key, "v" + i);
      }
    }

    service.rebuildProjection();

    List<String> visible = new ArrayList<>();
    for (String key : keys) {
      Optional<String> fromLog = repository.load(key).currentValue();
      assertThat(service.get(key)).as("key %s", key).isEqualTo(fromLog);
      fromLog.ifPresent(value -> visible.add(key));
    }
    assertThat(service.all()).extracting(ConfigEntry::key).containsExactlyElementsOf(visible);
  }

  private ConfigStoreService wire(EventLog log) {
    meterRegistry = new SimpleMeterRegistry();
    repository = new ConfigValueRepository(log);
    projection = new ConfigStateProjection(log, meterRegistry, clock);
    return new ConfigStoreService(
        new SetConfigValueCommandHandler(repository, meterRegistry, clock),
        new DeleteConfigValueCommandHandler(repository, meterRegistry, clock),
        projection,
        new HistoryService(repository, ConfigEventSerializer.withDefaultMapper()),
        new TimeTravelQueryService(repository),
        new ConfigChangeNotifier(publisher),
        properties);
  }

  /**
   * Holds the first reads of a stream until the given number of writers have read it.
   */
  private static final class BarrierEventLog implements EventLog {
    private final EventLog delegate;
    private final CyclicBarrier barrier;
    private final AtomicInteger gatedReads = new AtomicInteger();
    private final int parties;

    BarrierEventLog(EventLog delegate, int parties) {
      this.delegate = delegate;
      this.parties = parties;
      this.barrier = new CyclicBarrier(parties);
    }

    @Override
    public AppendResult append(
        String streamId, ExpectedVersion expectedVersion, List<ConfigEvent> events) {
      return delegate.append(streamId, expectedVersion, events);
    }

    @Override
    public Optional<List<RecordedEvent>> readForward(String streamId) {
      Optional<List<RecordedEvent>> result = delegate.readForward(streamId);
      if (gatedReads.getAndIncrement() < parties) {
        try {
          barrier.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException(e);
        } catch (BrokenBarrierException | TimeoutException e) {
          throw new IllegalStateException(e);
        }
      }
      return result;
    }

    @Override
    public List<RecordedEvent> readAllForward() {
      return delegate.readAllForward();
    }

    @Override
    public Flow.Publisher<RecordedEvent> subscribeAll() {
      return delegate.subscribeAll();
    }
  }
}
