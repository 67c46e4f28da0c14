package org.chucc.configstore.audit;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.time.Instant;
import java.util.Map;
import org.chucc.configstore.event.ConfigValueSetEvent;
import org.chucc.configstore.eventlog.RecordedEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for ConfigChangeNotifier.
 */
@ExtendWith(MockitoExtension.class)
class ConfigChangeNotifierTest {

  private static final Instant AT = Instant.parse("2025-07-04T09:15:00Z");

  @Mock
  private ApplicationEventPublisher publisher;

  @Test
  void notifyChanged_publishesNotification() {
    ConfigChangeNotifier notifier = new ConfigChangeNotifier(publisher);
    ConfigValueSetEvent event = new ConfigValueSetEvent("k", "v", null, AT);

    notifier.notifyChanged(recorded(event));

    verify(publisher).publishEvent((Object) ConfigChangedNotification.of(event));
  }

  @Test
  void notifyChanged_swallowsPublisherFailure() {
    doThrow(new IllegalStateException("queue full"))
        .when(publisher).publishEvent(any(Object.class));
    ConfigChangeNotifier notifier = new ConfigChangeNotifier(publisher);

    assertThatCode(() -> notifier.notifyChanged(
        recorded(new ConfigValueSetEvent("k", "v", null, AT))))
        .doesNotThrowAnyException();
  }

  private static RecordedEvent recorded(ConfigValueSetEvent event) {
    return new RecordedEvent("config-k", 1, 1, event, Map.of(), AT);
  }
}
