package org.chucc.configstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the in-process event log.
 */
@Component
@ConfigurationProperties(prefix = "event-log")
public class EventLogProperties {
  /**
   * Per-subscriber buffer of the live event feed.
   * Events offered to a full buffer are dropped for that subscriber.
   */
  private int subscriberBufferSize = 256;

  public int getSubscriberBufferSize() {
    return subscriberBufferSize;
  }

  public void setSubscriberBufferSize(int subscriberBufferSize) {
    this.subscriberBufferSize = subscriberBufferSize;
  }
}
