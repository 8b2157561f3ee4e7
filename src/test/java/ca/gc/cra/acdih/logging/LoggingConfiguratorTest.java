package ca.gc.cra.acdih.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.acdih.config.Settings;
import ca.gc.cra.acdih.config.source.MapEnvironmentSource;
import ca.gc.cra.acdih.testutil.TestEnvironments;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  @TempDir Path tempDir;

  private Logger root;
  private Level originalLevel;

  @BeforeEach
  void setUp() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    originalLevel = root.getLevel();
  }

  @AfterEach
  void tearDown() {
    LoggingConfigurator.detachFileAppender();
    root.setLevel(originalLevel);
  }

  @Test
  void applySetsLevelAndWritesToLogFile() throws IOException {
    Path logFile = tempDir.resolve("acdih.log");

    assertTrue(LoggingConfigurator.apply(settings("warning", logFile), false));
    LoggerFactory.getLogger(LoggingConfiguratorTest.class).warn("graph cache warming");
    LoggerFactory.getLogger(LoggingConfiguratorTest.class).info("suppressed at WARN");

    assertEquals(Level.WARN, root.getLevel());
    assertNotNull(root.getAppender(LoggingConfigurator.FILE_APPENDER_NAME));
    String written = Files.readString(logFile);
    assertTrue(written.contains("graph cache warming"));
    assertFalse(written.contains("suppressed at WARN"));
  }

  @Test
  void verboseOverridesConfiguredLevel() {
    assertTrue(LoggingConfigurator.apply(settings("ERROR", tempDir.resolve("verbose.log")), true));

    assertEquals(Level.DEBUG, root.getLevel());
  }

  @Test
  void reapplyingReplacesFileAppender() throws IOException {
    Path first = tempDir.resolve("first.log");
    Path second = tempDir.resolve("second.log");
    LoggingConfigurator.apply(settings("INFO", first), false);
    LoggingConfigurator.apply(settings("INFO", second), false);

    LoggerFactory.getLogger(LoggingConfiguratorTest.class).info("after switch");

    assertTrue(Files.readString(second).contains("after switch"));
    assertFalse(Files.readString(first).contains("after switch"));
  }

  @Test
  void detachRemovesAppender() {
    LoggingConfigurator.apply(settings("INFO", tempDir.resolve("detach.log")), false);

    assertTrue(LoggingConfigurator.detachFileAppender());
    assertNull(root.getAppender(LoggingConfigurator.FILE_APPENDER_NAME));
    assertFalse(LoggingConfigurator.detachFileAppender());
  }

  private static Settings settings(String level, Path logFile) {
    Map<String, String> values = TestEnvironments.validValues();
    values.put("LOG_LEVEL", level);
    values.put("LOG_FILE", logFile.toString());
    return Settings.load(new MapEnvironmentSource(values)).orElseThrow();
  }
}
