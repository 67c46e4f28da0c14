package org.chucc.configstore.health;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.Search;
import java.util.LinkedHashMap;
import java.util.Map;
import org.chucc.configstore.config.ProjectionProperties;
import org.chucc.configstore.projection.ConfigStateProjection;
import org.chucc.configstore.projection.LiveProjectionUpdater;
import org.chucc.configstore.projection.LiveProjectionUpdater.FeedState;
import org.chucc.configstore.projection.ProjectionStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the configuration projection.
 *
 * <p>Reports the consistency mode, the number of visible keys, the last rebuild
 * and the state of the live feed. In {@code LIVE} mode a lost feed is reported
 * as DOWN, since the projection no longer follows the log.
 *
 * <p>Accessible via {@code GET /actuator/health/configProjection}.
 */
@Component("configProjection")
public class ProjectionHealthIndicator implements HealthIndicator {

  private final ConfigStateProjection projection;
  private final LiveProjectionUpdater liveProjectionUpdater;
  private final ProjectionProperties projectionProperties;
  private final MeterRegistry meterRegistry;

  /**
   * Constructs a new health indicator.
   *
   * @param projection the projection to monitor
   * @param liveProjectionUpdater the live feed consumer
   * @param projectionProperties the projection configuration
   * @param meterRegistry the meter registry holding rebuild metrics
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Dependencies are Spring-managed beans and are intentionally shared")
  public ProjectionHealthIndicator(
      ConfigStateProjection projection,
      LiveProjectionUpdater liveProjectionUpdater,
      ProjectionProperties projectionProperties,
      MeterRegistry meterRegistry) {
    this.projection = projection;
    this.liveProjectionUpdater = liveProjectionUpdater;
    this.projectionProperties = projectionProperties;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public Health health() {
    ProjectionStatus status = projection.status();
    FeedState feedState = liveProjectionUpdater.state();

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("mode", projectionProperties.getMode());
    details.put("entries", status.entries());
    details.put("lastRebuiltAt", status.lastRebuiltAt() == null
        ? "never" : status.lastRebuiltAt().toString());
    details.put("rebuilds", status.rebuildCount());
    details.put("appliedSinceRebuild", status.appliedSinceRebuild());
    details.put("liveFeed", feedState);

    double failedRebuilds = getFailedRebuildCount();
    if (failedRebuilds > 0) {
      details.put("failedRebuilds", (long) failedRebuilds);
    }

    if (projectionProperties.isLive() && feedState == FeedState.DISCONNECTED) {
      return Health.down()
          .withDetails(details)
          .withDetail("error", "Live event feed lost, projection is not following the log")
          .build();
    }
    return Health.up()
        .withDetails(details)
        .build();
  }

  private double getFailedRebuildCount() {
    return Search.in(meterRegistry)
        .name("config.projection.rebuild.total")
        .tag("outcome", "failure")
        .counters()
        .stream()
        .mapToDouble(counter -> counter.count())
        .sum();
  }
}
