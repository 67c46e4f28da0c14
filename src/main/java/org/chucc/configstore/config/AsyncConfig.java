package org.chucc.configstore.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs audit listeners off the command thread.
 *
 * <p>Audit is best effort: a full queue drops the notification with a warning,
 * and listener failures are logged instead of reaching the writer.
 */
@Configuration
@EnableAsync
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class AsyncConfig implements AsyncConfigurer {
  private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

  private final AuditProperties auditProperties;

  /**
   * Constructs an AsyncConfig.
   *
   * @param auditProperties the audit configuration properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "AuditProperties is a Spring-managed configuration bean")
  public AsyncConfig(AuditProperties auditProperties) {
    this.auditProperties = auditProperties;
  }

  /**
   * Bounded pool for audit listeners.
   *
   * @return the audit executor
   */
  @Bean(name = "auditExecutor")
  public Executor auditExecutor() {
    AuditProperties.Executor settings = auditProperties.getExecutor();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(settings.getCorePoolSize());
    executor.setMaxPoolSize(settings.getMaxPoolSize());
    executor.setQueueCapacity(settings.getQueueCapacity());
    executor.setThreadNamePrefix("audit-");
    executor.setRejectedExecutionHandler(dropWithWarning());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(settings.getAwaitTermination().toMillis());
    executor.initialize();
    return executor;
  }

  @Override
  public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
    return (ex, method, params) -> logger.warn("Async {}.{} failed: {}",
        method.getDeclaringClass().getSimpleName(), method.getName(), ex.getMessage(), ex);
  }

  static RejectedExecutionHandler dropWithWarning() {
    return (task, pool) -> logger.warn(
        "Audit queue full ({} pending), dropping notification", pool.getQueue().size());
  }
}
