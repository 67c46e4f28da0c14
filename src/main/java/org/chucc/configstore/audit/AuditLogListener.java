package org.chucc.configstore.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Writes an audit line for every configuration change, off the command thread.
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class AuditLogListener {
  private static final Logger logger = LoggerFactory.getLogger(AuditLogListener.class);

  static final String NIL = "nil";

  /**
   * Logs a configuration change.
   *
   * @param notification the change notification
   */
  @Async("auditExecutor")
  @EventListener
  public void onConfigChanged(ConfigChangedNotification notification) {
    logger.info(format(notification));
  }

  /**
   * Renders the audit line of a change.
   *
   * @param notification the change notification
   * @return the audit line
   */
  static String format(ConfigChangedNotification notification) {
    return switch (notification.changeType()) {
      case UPDATED -> String.format("Config updated at %s: name=%s, old_value=%s, new_value=%s",
          notification.timestamp(), notification.key(),
          orNil(notification.oldValue()), orNil(notification.newValue()));
      case DELETED -> String.format("Config deleted at %s: name=%s, old_value=%s",
          notification.timestamp(), notification.key(), orNil(notification.oldValue()));
    };
  }

  private static String orNil(String value) {
    return value == null ? NIL : value;
  }
}
