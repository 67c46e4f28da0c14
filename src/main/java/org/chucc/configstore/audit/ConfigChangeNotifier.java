package org.chucc.configstore.audit;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Counted;
import org.chucc.configstore.eventlog.RecordedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes a {@link ConfigChangedNotification} for each appended event.
 * Failures are logged and never reach the caller: the event is already durable.
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class ConfigChangeNotifier {
  private static final Logger logger = LoggerFactory.getLogger(ConfigChangeNotifier.class);

  private final ApplicationEventPublisher publisher;

  /**
   * Constructs a ConfigChangeNotifier.
   *
   * @param publisher the Spring application event publisher
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Dependencies are Spring-managed beans and are intentionally shared")
  public ConfigChangeNotifier(ApplicationEventPublisher publisher) {
    this.publisher = publisher;
  }

  /**
   * Notifies listeners about an appended event.
   *
   * @param recorded the recorded event
   */
  @Counted(
      value = "config.notifications",
      description = "Change notifications published count"
  )
  public void notifyChanged(RecordedEvent recorded) {
    try {
      publisher.publishEvent(ConfigChangedNotification.of(recorded.event()));
    } catch (RuntimeException ex) {
      logger.warn("Failed to publish change notification for key: {} (stream {} v{}): {}",
          recorded.event().key(), recorded.streamId(), recorded.streamVersion(),
          ex.getMessage(), ex);
    }
  }
}
