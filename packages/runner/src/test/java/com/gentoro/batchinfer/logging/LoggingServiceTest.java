package com.gentoro.batchinfer.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.io.StringReader;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LoggingServiceTest {

  @Test
  @DisplayName("Logger levels are applied from configuration")
  void appliesLevels() throws Exception {
    YAMLConfiguration config = new YAMLConfiguration();
    config.read(
        new StringReader(
            "logging:\n"
                + "  levels:\n"
                + "    - logger: test.alpha\n"
                + "      level: DEBUG\n"
                + "    - logger: test.beta\n"
                + "      level: ERROR\n"));

    LoggingService.applyConfiguration(config);

    assertEquals(Level.DEBUG, level("test.alpha"));
    assertEquals(Level.ERROR, level("test.beta"));
  }

  @Test
  @DisplayName("Unknown level names fall back to INFO")
  void unknownLevel() {
    LoggingService.setLevel("test.gamma", "LOUD");

    assertEquals(Level.INFO, level("test.gamma"));
  }

  private static Level level(String name) {
    return ((Logger) org.slf4j.LoggerFactory.getLogger(name)).getLevel();
  }
}
