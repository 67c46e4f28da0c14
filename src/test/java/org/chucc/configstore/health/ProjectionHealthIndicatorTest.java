package org.chucc.configstore.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.chucc.configstore.config.ProjectionProperties;
import org.chucc.configstore.projection.ConfigStateProjection;
import org.chucc.configstore.projection.ConsistencyMode;
import org.chucc.configstore.projection.LiveProjectionUpdater;
import org.chucc.configstore.projection.LiveProjectionUpdater.FeedState;
import org.chucc.configstore.projection.ProjectionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

/**
 * Unit tests for ProjectionHealthIndicator.
 */
@ExtendWith(MockitoExtension.class)
class ProjectionHealthIndicatorTest {

  @Mock
  private ConfigStateProjection projection;

  @Mock
  private LiveProjectionUpdater liveProjectionUpdater;

  private ProjectionProperties properties;
  private MeterRegistry meterRegistry;
  private ProjectionHealthIndicator indicator;

  @BeforeEach
  void setUp() {
    properties = new ProjectionProperties();
    meterRegistry = new SimpleMeterRegistry();
    indicator = new ProjectionHealthIndicator(
        projection, liveProjectionUpdater, properties, meterRegistry);
    when(projection.status()).thenReturn(
        new ProjectionStatus(3, Instant.parse("2025-01-01T00:00:00Z"), 1, 5));
  }

  @Test
  void health_liveAndConnected_isUp() {
    when(liveProjectionUpdater.state()).thenReturn(FeedState.CONNECTED);

    Health health = indicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails())
        .containsEntry("mode", ConsistencyMode.LIVE)
        .containsEntry("entries", 3)
        .containsEntry("lastRebuiltAt", "2025-01-01T00:00:00Z")
        .containsEntry("liveFeed", FeedState.CONNECTED)
        .doesNotContainKey("failedRebuilds");
  }

  @Test
  void health_liveAndDisconnected_isDown() {
    when(liveProjectionUpdater.state()).thenReturn(FeedState.DISCONNECTED);

    Health health = indicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    assertThat(health.getDetails()).containsKey("error");
  }

  @Test
  void health_restartOnly_isUpWithoutFeed() {
    properties.setMode(ConsistencyMode.RESTART_ONLY);
    when(liveProjectionUpdater.state()).thenReturn(FeedState.STOPPED);
    meterRegistry.counter("config.projection.rebuild.total", "outcome", "failure").increment();

    Health health = indicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails()).containsEntry("failedRebuilds", 1L);
  }
}
