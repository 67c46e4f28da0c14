package org.chucc.configstore.config;

import java.time.Clock;
import org.chucc.configstore.eventlog.EventLog;
import org.chucc.configstore.eventlog.InMemoryEventLog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the time source and the event log.
 * A durable backend adapter replaces the in-memory log by declaring a
 * {@code @Primary} {@link EventLog} bean.
 */
@Configuration
public class EventLogConfig {

  /**
   * UTC clock used for event timestamps and recording times.
   *
   * @return the system UTC clock
   */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * In-process reference event log.
   *
   * @param clock the clock stamping recorded events
   * @param properties event log properties
   * @return the event log
   */
  @Bean(destroyMethod = "close")
  public InMemoryEventLog eventLog(Clock clock, EventLogProperties properties) {
    return new InMemoryEventLog(clock, properties.getSubscriberBufferSize());
  }
}
