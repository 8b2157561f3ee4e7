package ca.gc.cra.acdih.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.acdih.config.source.MapEnvironmentSource;
import ca.gc.cra.acdih.logging.LoggingConfigurator;
import ca.gc.cra.acdih.testutil.TestEnvironments;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ConfigCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Logger root;
  private Level originalRootLevel;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    logger = (Logger) LoggerFactory.getLogger(ConfigCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    originalRootLevel = root.getLevel();
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    CliPrinter.clearTestWriter();
    LoggingConfigurator.detachFileAppender();
    root.setLevel(originalRootLevel);
    System.clearProperty(TelemetryConfigurator.EXPORTER_PROPERTY);
    System.clearProperty(TelemetryConfigurator.ENDPOINT_PROPERTY);
  }

  @Test
  void checkReportsLayeredSource() {
    ExitCode code = ConfigCli.run("check", args(), environment(Map.of()));

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.startsWith("Configuration OK (test-env > dotenv:"), output);
  }

  @Test
  void showRedactsPrivateKey() {
    ExitCode code = ConfigCli.run("show", args(), environment(Map.of("MAX_WORKERS", "4")));

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Effective configuration:"));
    assertTrue(output.contains("FIREBASE_PRIVATE_KEY        : <redacted PEM>"));
    assertTrue(output.contains("MAX_WORKERS                 : 4"));
    assertFalse(output.contains("MIIEvQ"));
  }

  @Test
  void poolPrintsDerivedConnectionLimit() {
    ExitCode code = ConfigCli.run("pool", args(), environment(Map.of("MAX_WORKERS", "4")));

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains(" endpoint        : redis://localhost:6379/0"));
    assertTrue(output.contains(" decodeResponses : true"));
    assertTrue(output.contains(" maxConnections  : 8"));
  }

  @Test
  void dotenvAndYamlLayersFillMissingValues() throws IOException {
    Path envFile = tempDir.resolve("acdih.env");
    Files.writeString(envFile, "MAX_WORKERS=3\n");
    Path yaml = tempDir.resolve("acdih.yaml");
    Files.writeString(yaml, """
        max_workers: 10
        redis_url: redis://yaml-cache:6379/4
        """);

    ExitCode code = ConfigCli.run("pool", new String[] {
        "metricsExporter=none", "envFile=" + envFile, "yaml=" + yaml},
        environment(Map.of()));

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains(" endpoint        : redis://yaml-cache:6379/4"));
    assertTrue(output.contains(" maxConnections  : 6"));
  }

  @Test
  void invalidConfigurationReturnsConfigError() {
    ExitCode code = ConfigCli.run("check", args(),
        environment(Map.of("CAUSAL_CONFIDENCE_THRESHOLD", "1.5")));

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(buffer.toString().contains(
        "Configuration invalid: OUT_OF_RANGE_VALUE [CAUSAL_CONFIDENCE_THRESHOLD]"));
  }

  @Test
  void malformedYamlReturnsConfigError() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "- just\n- a list\n");

    ExitCode code = ConfigCli.run("check", new String[] {
        "metricsExporter=none", "envFile=" + tempDir.resolve("none.env"), "yaml=" + yaml},
        environment(Map.of()));

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("Invalid configuration file")));
  }

  @Test
  void unreadableYamlReturnsIoError() throws IOException {
    Path directory = Files.createDirectory(tempDir.resolve("conf.yaml"));

    ExitCode code = ConfigCli.run("check", new String[] {
        "metricsExporter=none", "envFile=" + tempDir.resolve("none.env"), "yaml=" + directory},
        environment(Map.of()));

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void unknownOptionIsRejected() {
    ExitCode code = ConfigCli.run("check", new String[] {"metricsExporter=none", "colour=blue"},
        environment(Map.of()));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: acdih"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("unknown option: colour")));
  }

  @Test
  void unknownFlagIsRejected() {
    ExitCode code = ConfigCli.run("check", new String[] {"--frobnicate"}, environment(Map.of()));

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void invalidExporterIsRejected() {
    ExitCode code = ConfigCli.run("check", new String[] {"metricsExporter=prometheus"}, environment(Map.of()));

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  private String[] args() {
    return new String[] {"metricsExporter=none", "envFile=" + tempDir.resolve("absent.env")};
  }

  private MapEnvironmentSource environment(Map<String, String> overrides) {
    Map<String, String> values = TestEnvironments.validValues();
    values.put("LOG_FILE", tempDir.resolve("cli.log").toString());
    values.putAll(overrides);
    return new MapEnvironmentSource(values, "test-env");
  }
}
