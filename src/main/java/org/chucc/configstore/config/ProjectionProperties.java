package org.chucc.configstore.config;

import java.time.Duration;
import org.chucc.configstore.projection.ConsistencyMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the configuration state projection.
 */
@Component
@ConfigurationProperties(prefix = "projection")
public class ProjectionProperties {
  /**
   * Consistency policy of the read model. Default is {@link ConsistencyMode#LIVE}.
   */
  private ConsistencyMode mode = ConsistencyMode.LIVE;

  /**
   * Deduplication configuration for the live event feed.
   */
  private Deduplication deduplication = new Deduplication();

  /**
   * Periodic full-rebuild configuration.
   */
  private ScheduledRebuild scheduledRebuild = new ScheduledRebuild();

  public ConsistencyMode getMode() {
    return mode;
  }

  public void setMode(ConsistencyMode mode) {
    this.mode = mode;
  }

  /**
   * Checks whether the projection follows the live event feed.
   *
   * @return true in {@link ConsistencyMode#LIVE}
   */
  public boolean isLive() {
    return mode == ConsistencyMode.LIVE;
  }

  /**
   * Gets the deduplication configuration.
   * Note: This returns the actual internal object (not a copy) as required by Spring Boot
   * configuration properties binding.
   *
   * @return the deduplication configuration
   */
  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Spring Boot ConfigurationProperties requires direct access"
          + " to nested objects")
  public Deduplication getDeduplication() {
    return deduplication;
  }

  /**
   * Sets the deduplication configuration.
   *
   * @param deduplication the deduplication configuration
   */
  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring Boot ConfigurationProperties requires direct access"
          + " to nested objects")
  public void setDeduplication(Deduplication deduplication) {
    this.deduplication = deduplication;
  }

  /**
   * Gets the scheduled rebuild configuration.
   *
   * @return the scheduled rebuild configuration
   */
  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Spring Boot ConfigurationProperties requires direct access"
          + " to nested objects")
  public ScheduledRebuild getScheduledRebuild() {
    return scheduledRebuild;
  }

  /**
   * Sets the scheduled rebuild configuration.
   *
   * @param scheduledRebuild the scheduled rebuild configuration
   */
  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring Boot ConfigurationProperties requires direct access"
          + " to nested objects")
  public void setScheduledRebuild(ScheduledRebuild scheduledRebuild) {
    this.scheduledRebuild = scheduledRebuild;
  }

  /**
   * Deduplication configuration.
   */
  public static class Deduplication {
    /**
     * Maximum number of event IDs to remember.
     * Default: 100,000 event IDs.
     */
    private int cacheSize = 100_000;

    /**
     * Enable/disable deduplication by event ID.
     * Stream-version checks in the projection still apply when disabled.
     */
    private boolean enabled = true;

    public int getCacheSize() {
      return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
      this.cacheSize = cacheSize;
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }
  }

  /**
   * Periodic full-rebuild configuration.
   */
  public static class ScheduledRebuild {
    /**
     * Whether the projection is rebuilt on a fixed delay.
     */
    private boolean enabled = false;

    /**
     * Delay between the end of one rebuild and the start of the next.
     * Read by the scheduler through {@code projection.scheduled-rebuild.fixed-delay}.
     */
    private Duration fixedDelay = Duration.ofMinutes(5);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getFixedDelay() {
      return fixedDelay;
    }

    public void setFixedDelay(Duration fixedDelay) {
      this.fixedDelay = fixedDelay;
    }
  }
}
