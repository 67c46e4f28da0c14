package org.chucc.configstore.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for audit delivery.
 */
@Component
@ConfigurationProperties(prefix = "audit")
public class AuditProperties {

  /**
   * Thread pool that runs audit listeners.
   */
  private Executor executor = new Executor();

  public Executor getExecutor() {
    return executor;
  }

  public void setExecutor(Executor executor) {
    this.executor = executor;
  }

  /**
   * Audit thread pool settings. Notifications beyond the queue capacity are dropped.
   */
  public static class Executor {
    private int corePoolSize = 1;
    private int maxPoolSize = 2;
    private int queueCapacity = 1000;
    private Duration awaitTermination = Duration.ofSeconds(10);

    public int getCorePoolSize() {
      return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
      this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
      return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    public Duration getAwaitTermination() {
      return awaitTermination;
    }

    public void setAwaitTermination(Duration awaitTermination) {
      this.awaitTermination = awaitTermination;
    }
  }
}
