package org.chucc.configstore.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Tests for the audit executor.
 */
class AsyncConfigTest {

  private final CountDownLatch release = new CountDownLatch(1);
  private ThreadPoolTaskExecutor executor;

  @BeforeEach
  void setUp() {
    AuditProperties properties = new AuditProperties();
    properties.getExecutor().setCorePoolSize(1);
    properties.getExecutor().setMaxPoolSize(1);
    properties.getExecutor().setQueueCapacity(1);
    properties.getExecutor().setAwaitTermination(Duration.ofSeconds(1));

    Executor bean = new AsyncConfig(properties).auditExecutor();
    executor = (ThreadPoolTaskExecutor) bean;
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    executor.shutdown();
  }

  @Test
  void auditExecutor_usesConfiguredPool() {
    assertThat(executor.getCorePoolSize()).isEqualTo(1);
    assertThat(executor.getMaxPoolSize()).isEqualTo(1);
    assertThat(executor.getThreadNamePrefix()).isEqualTo("audit-");
  }

  @Test
  void auditExecutor_fullQueue_dropsWithoutThrowing() throws InterruptedException {
    // Given: one running task and one queued task fill the pool
    CountDownLatch started = new CountDownLatch(1);
    AtomicInteger completed = new AtomicInteger();
    executor.execute(() -> {
      started.countDown();
      awaitRelease();
      completed.incrementAndGet();
    });
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    executor.execute(completed::incrementAndGet);

    // When / Then: the third notification is dropped instead of rejected
    assertThatCode(() -> executor.execute(completed::incrementAndGet))
        .doesNotThrowAnyException();
    release.countDown();
    executor.shutdown();
    assertThat(executor.getThreadPoolExecutor().awaitTermination(5, TimeUnit.SECONDS))
        .isTrue();
    assertThat(completed.get()).isEqualTo(2);
  }

  @Test
  void uncaughtHandler_logsInsteadOfThrowing() {
    AsyncConfig config = new AsyncConfig(new AuditProperties());

    assertThatCode(() -> config.getAsyncUncaughtExceptionHandler().handleUncaughtException(
        new IllegalStateException("sink down"),
        Object.class.getMethod("toString")))
        .doesNotThrowAnyException();
  }

  @Test
  void defaults_matchShippedConfiguration() {
    AuditProperties.Executor defaults = new AuditProperties().getExecutor();

    assertThat(defaults.getQueueCapacity()).isEqualTo(1000);
    assertThat(defaults.getAwaitTermination()).isEqualTo(Duration.ofSeconds(10));
  }

  private void awaitRelease() {
    try {
      release.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
