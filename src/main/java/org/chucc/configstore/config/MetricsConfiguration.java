package org.chucc.configstore.config;

import io.micrometer.core.aop.CountedAspect;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Metrics setup of the config store.
 *
 * <p>Meters recorded by the application:
 * <ul>
 *   <li>{@code config.put}, {@code config.delete} - Timers on the facade</li>
 *   <li>{@code config.commands} - Counter per command and outcome</li>
 *   <li>{@code config.notifications} - Counter of published change notifications</li>
 *   <li>{@code config.projection.rebuild.total}, {@code config.projection.rebuild.duration}</li>
 * </ul>
 * Every meter carries an {@code application} tag.
 */
@Configuration
@EnableAspectJAutoProxy
public class MetricsConfiguration {

  @Bean
  MeterRegistryCustomizer<MeterRegistry> applicationTag(
      @Value("${spring.application.name:config-store}") String application) {
    return registry -> registry.config().commonTags("application", application);
  }

  @Bean
  TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  CountedAspect countedAspect(MeterRegistry registry) {
    return new CountedAspect(registry);
  }
}
