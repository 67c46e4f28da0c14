package org.chucc.configstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the event-sourced configuration store.
 */
@SpringBootApplication
@EnableScheduling
@SuppressWarnings("PMD.UseUtilityClass") // Spring Boot requires instantiable main class
public class ConfigStoreApplication {

  /**
   * Application entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(ConfigStoreApplication.class, args);
  }
}
