package org.chucc.configstore;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Basic application context test.
 */
@SpringBootTest
@ActiveProfiles("test")
class ConfigStoreApplicationTests {

  @Test
  void contextLoads() {
    // This test verifies that the application context loads successfully
  }
}
