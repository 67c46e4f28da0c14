package org.chucc.configstore.projection;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.chucc.configstore.config.ProjectionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Populates the projection once the application is ready.
 * In {@link ConsistencyMode#LIVE} the live feed is subscribed before the rebuild,
 * so events appended during the rebuild are not missed.
 */
@Component
public class ProjectionInitializer {
  private static final Logger logger = LoggerFactory.getLogger(ProjectionInitializer.class);

  private final ConfigStateProjection projection;
  private final LiveProjectionUpdater liveProjectionUpdater;
  private final ProjectionProperties projectionProperties;

  /**
   * Constructs a ProjectionInitializer.
   *
   * @param projection the projection to populate
   * @param liveProjectionUpdater the live feed consumer
   * @param projectionProperties the projection configuration properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Dependencies are Spring-managed beans and are intentionally shared")
  public ProjectionInitializer(
      ConfigStateProjection projection,
      LiveProjectionUpdater liveProjectionUpdater,
      ProjectionProperties projectionProperties) {
    this.projection = projection;
    this.liveProjectionUpdater = liveProjectionUpdater;
    this.projectionProperties = projectionProperties;
  }

  /**
   * Starts live updates if configured and rebuilds the projection.
   */
  @EventListener(ApplicationReadyEvent.class)
  public void initialize() {
    logger.info("Initializing configuration projection in {} mode",
        projectionProperties.getMode());
    if (projectionProperties.isLive()) {
      liveProjectionUpdater.start();
    }
    projection.rebuild();
  }
}
