package org.chucc.configstore.projection;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.chucc.configstore.config.ProjectionProperties;
import org.chucc.configstore.exception.ConfigStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically discards and rebuilds the projection.
 * Enabled by {@code projection.scheduled-rebuild.enabled}; this is how
 * {@link ConsistencyMode#RESTART_ONLY} deployments pick up writes without a restart.
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class ScheduledProjectionRebuilder {
  private static final Logger logger = LoggerFactory.getLogger(ScheduledProjectionRebuilder.class);

  private final ConfigStateProjection projection;
  private final ProjectionProperties projectionProperties;

  /**
   * Constructs a ScheduledProjectionRebuilder.
   *
   * @param projection the projection to rebuild
   * @param projectionProperties the projection configuration properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Dependencies are Spring-managed beans and are intentionally shared")
  public ScheduledProjectionRebuilder(
      ConfigStateProjection projection,
      ProjectionProperties projectionProperties) {
    this.projection = projection;
    this.projectionProperties = projectionProperties;
  }

  /**
   * Rebuilds the projection if scheduled rebuilds are enabled.
   * A failed rebuild keeps the previous read model and is retried on the next tick.
   */
  @Scheduled(
      fixedDelayString = "${projection.scheduled-rebuild.fixed-delay:PT5M}",
      initialDelayString = "${projection.scheduled-rebuild.fixed-delay:PT5M}")
  public void rebuildIfEnabled() {
    if (!projectionProperties.getScheduledRebuild().isEnabled()) {
      return;
    }
    try {
      RebuildResult result = projection.rebuild();
      logger.debug("Scheduled projection rebuild restored {} configurations", result.entries());
    } catch (ConfigStoreException ex) {
      logger.error("Scheduled projection rebuild failed ({}), retrying in {}",
          ex.getCode(), projectionProperties.getScheduledRebuild().getFixedDelay(), ex);
    }
  }
}
