package ca.gc.cra.acdih.api;

import ca.gc.cra.acdih.config.ConfigManager;
import ca.gc.cra.acdih.config.ConfigResult;
import ca.gc.cra.acdih.config.ConfigSnapshot;
import ca.gc.cra.acdih.config.Credentials;
import ca.gc.cra.acdih.config.PoolConfig;
import ca.gc.cra.acdih.config.Settings;
import ca.gc.cra.acdih.config.source.DotenvEnvironmentSource;
import ca.gc.cra.acdih.config.source.EnvironmentSource;
import ca.gc.cra.acdih.config.source.EnvironmentSourceException;
import ca.gc.cra.acdih.config.source.LayeredEnvironmentSource;
import ca.gc.cra.acdih.config.source.YamlEnvironmentSource;
import ca.gc.cra.acdih.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.acdih.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the {@code check}, {@code show} and {@code pool} commands against a layered configuration source.
 *
 * @since 0.1.0
 */
final class ConfigCli {
  private static final Logger log = LoggerFactory.getLogger(ConfigCli.class);
  static final Set<String> COMMANDS = Set.of("check", "show", "pool");
  private static final Set<String> KNOWN_KEYS = Set.of("envFile", "yaml");
  private static final String SUMMARY_USAGE =
      "usage: acdih <check|show|pool> [envFile=PATH] [yaml=PATH] [metricsExporter=otlp|none] "
          + "[otelEndpoint=URL] [--verbose]";

  private ConfigCli() {}

  /**
   * Loads the configuration and executes {@code command}.
   *
   * @param command one of {@link #COMMANDS}
   * @param args command options
   * @param environment highest-precedence variable layer (normally the process environment)
   * @return exit code describing the outcome
   */
  static ExitCode run(String command, String[] args, EnvironmentSource environment) {
    CliInput input = CliInput.parse(args);
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", command);
    }
    if (!input.otherFlags().isEmpty()) {
      log.error("Unknown flags: {}", input.otherFlags());
      CliPrinter.printLines(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      TelemetryConfigurator.configureMetrics(kv);
      for (String key : kv.keySet()) {
        if (!KNOWN_KEYS.contains(key)) {
          throw new IllegalArgumentException("unknown option: " + key);
        }
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.printLines(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    EnvironmentSource source;
    try {
      source = buildSource(environment, kv);
    } catch (IOException | EnvironmentSourceException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      ConfigManager manager = new ConfigManager(source, metrics);
      ConfigResult<ConfigSnapshot> result = manager.initializeOnce();
      if (result instanceof ConfigResult.Failure<ConfigSnapshot> failure) {
        CliPrinter.printLines("Configuration invalid: " + failure.error());
        return ExitCode.CONFIG_ERROR;
      }
      ConfigSnapshot snapshot = manager.snapshot();
      LoggingConfigurator.apply(snapshot.settings(), input.verbose());
      switch (command) {
        case "check" -> CliPrinter.printLines("Configuration OK (" + manager.sourceDescription() + ")");
        case "show" -> CliPrinter.printLines(describe(snapshot.settings()).toArray(String[]::new));
        case "pool" -> printPool(manager.getDerivedPoolConfig());
        default -> throw new IllegalStateException("Unhandled command " + command);
      }
      metrics.forceFlush();
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure running {}", command, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static String usage() {
    return SUMMARY_USAGE;
  }

  private static EnvironmentSource buildSource(EnvironmentSource environment, Map<String, String> kv)
      throws IOException {
    List<EnvironmentSource> layers = new ArrayList<>(3);
    layers.add(environment);
    String envFile = kv.getOrDefault("envFile", DotenvEnvironmentSource.DEFAULT_FILE);
    layers.add(DotenvEnvironmentSource.load(path("envFile", envFile)));
    String yaml = kv.get("yaml");
    if (yaml != null) {
      layers.add(YamlEnvironmentSource.load(path("yaml", yaml)));
    }
    return new LayeredEnvironmentSource(layers);
  }

  private static Path path(String name, String value) {
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  static List<String> describe(Settings settings) {
    List<String> lines = new ArrayList<>();
    lines.add("Effective configuration:");
    lines.add(" FIREBASE_PROJECT_ID         : " + settings.firebaseProjectId());
    lines.add(" FIREBASE_PRIVATE_KEY        : "
        + (Credentials.hasPemHeader(settings.firebasePrivateKey()) ? "<redacted PEM>" : "<redacted>"));
    lines.add(" FIREBASE_CLIENT_EMAIL       : " + settings.firebaseClientEmail());
    lines.add(" FIRESTORE_DATABASE_URL      : " + settings.firestoreDatabaseUrl());
    lines.add(" MAX_GRAPH_NODES             : " + settings.maxGraphNodes());
    lines.add(" MAX_GRAPH_EDGES             : " + settings.maxGraphEdges());
    lines.add(" GRAPH_CACHE_TTL             : " + settings.graphCacheTtlSeconds());
    lines.add(" CAUSAL_CONFIDENCE_THRESHOLD : " + settings.causalConfidenceThreshold());
    lines.add(" CORRELATION_THRESHOLD       : " + settings.correlationThreshold());
    lines.add(" DISCOVERY_BATCH_SIZE        : " + settings.discoveryBatchSize());
    lines.add(" LOG_LEVEL                   : " + settings.logLevel());
    lines.add(" LOG_FILE                    : " + settings.logFile());
    lines.add(" MAX_WORKERS                 : " + settings.maxWorkers());
    lines.add(" REDIS_URL                   : " + settings.redisUrl());
    return lines;
  }

  private static void printPool(PoolConfig pool) {
    CliPrinter.printLines(
        "Pool configuration:",
        " endpoint        : " + pool.endpoint(),
        " decodeResponses : " + pool.decodeResponses(),
        " maxConnections  : " + pool.maxConnections());
  }
}
