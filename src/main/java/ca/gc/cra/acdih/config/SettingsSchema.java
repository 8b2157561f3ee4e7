package ca.gc.cra.acdih.config;

import ca.gc.cra.acdih.config.source.EnvironmentSource;
import ca.gc.cra.acdih.validation.Numbers;
import ca.gc.cra.acdih.validation.Strings;
import ca.gc.cra.acdih.validation.Urls;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Declarative binding of every {@link Settings} field to its environment variable.
 * <p><strong>Why:</strong> Keeps variable names, defaults and bounds in one table that is evaluated once
 * against an injected {@link EnvironmentSource}.</p>
 * <p><strong>Role:</strong> Factory behind {@link Settings#load(EnvironmentSource)}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; options are immutable.</p>
 * <p><strong>Observability:</strong> Emits no logs; failures are returned as {@link ConfigurationError}s.</p>
 *
 * @since 0.1.0
 */
public final class SettingsSchema {
  /** Default document-database endpoint. */
  public static final String DEFAULT_DATABASE_URL = "https://firestore.googleapis.com";
  /** Default cache/queue endpoint. */
  public static final String DEFAULT_REDIS_URL = "redis://localhost:6379/0";
  /** Default log file name. */
  public static final String DEFAULT_LOG_FILE = "acdih_synaptic.log";
  /** Lower bound applied to the processor-derived worker default. */
  public static final int MIN_DEFAULT_WORKERS = 4;

  public static final ConfigOption<String> FIREBASE_PROJECT_ID =
      ConfigOption.required("FIREBASE_PROJECT_ID", Function.identity());
  public static final ConfigOption<String> FIREBASE_PRIVATE_KEY =
      ConfigOption.required("FIREBASE_PRIVATE_KEY", Function.identity());
  public static final ConfigOption<String> FIREBASE_CLIENT_EMAIL =
      ConfigOption.required("FIREBASE_CLIENT_EMAIL", Function.identity());
  public static final ConfigOption<String> FIRESTORE_DATABASE_URL =
      ConfigOption.optional("FIRESTORE_DATABASE_URL", () -> DEFAULT_DATABASE_URL, String::trim)
          .validatedBy(url -> Urls.requireUrl("FIRESTORE_DATABASE_URL", url, Settings.DATABASE_SCHEMES),
              ConfigErrorKind.INVALID_VALUE);

  public static final ConfigOption<Integer> MAX_GRAPH_NODES = positiveInt("MAX_GRAPH_NODES", 1_000_000);
  public static final ConfigOption<Integer> MAX_GRAPH_EDGES = positiveInt("MAX_GRAPH_EDGES", 5_000_000);
  public static final ConfigOption<Integer> GRAPH_CACHE_TTL = positiveInt("GRAPH_CACHE_TTL", 300);

  public static final ConfigOption<Double> CAUSAL_CONFIDENCE_THRESHOLD =
      unitInterval("CAUSAL_CONFIDENCE_THRESHOLD", 0.8d);
  public static final ConfigOption<Double> CORRELATION_THRESHOLD =
      unitInterval("CORRELATION_THRESHOLD", 0.7d);
  public static final ConfigOption<Integer> DISCOVERY_BATCH_SIZE = positiveInt("DISCOVERY_BATCH_SIZE", 1_000);

  public static final ConfigOption<String> LOG_LEVEL =
      ConfigOption.optional("LOG_LEVEL", () -> "INFO", SettingsSchema::parseLogLevel);
  public static final ConfigOption<String> LOG_FILE =
      ConfigOption.optional("LOG_FILE", () -> DEFAULT_LOG_FILE, String::trim)
          .validatedBy(file -> Strings.requireNonBlank("LOG_FILE", file),
              ConfigErrorKind.INVALID_VALUE);

  public static final ConfigOption<Integer> MAX_WORKERS =
      ConfigOption.optional("MAX_WORKERS", SettingsSchema::defaultWorkers, SettingsSchema::parseInt)
          .validatedBy(
              workers -> Numbers.requireRange("MAX_WORKERS", workers, 1, Settings.MAX_WORKERS_LIMIT),
              ConfigErrorKind.OUT_OF_RANGE_VALUE);
  public static final ConfigOption<String> REDIS_URL =
      ConfigOption.optional("REDIS_URL", () -> DEFAULT_REDIS_URL, String::trim)
          .validatedBy(url -> Urls.requireUrl("REDIS_URL", url, Settings.CACHE_SCHEMES),
              ConfigErrorKind.INVALID_VALUE);

  private static final List<ConfigOption<?>> OPTIONS = List.of(
      FIREBASE_PROJECT_ID,
      FIREBASE_PRIVATE_KEY,
      FIREBASE_CLIENT_EMAIL,
      FIRESTORE_DATABASE_URL,
      MAX_GRAPH_NODES,
      MAX_GRAPH_EDGES,
      GRAPH_CACHE_TTL,
      CAUSAL_CONFIDENCE_THRESHOLD,
      CORRELATION_THRESHOLD,
      DISCOVERY_BATCH_SIZE,
      LOG_LEVEL,
      LOG_FILE,
      MAX_WORKERS,
      REDIS_URL);

  private SettingsSchema() {}

  /**
   * Returns every option in resolution order.
   *
   * @return immutable option list
   */
  public static List<ConfigOption<?>> options() {
    return OPTIONS;
  }

  /**
   * Evaluates the schema against {@code source}, stopping at the first failure.
   *
   * @param source variable source; must not be {@code null}
   * @return validated settings or the first error in declaration order
   */
  public static ConfigResult<Settings> resolve(EnvironmentSource source) {
    Objects.requireNonNull(source, "source");
    Resolution r = new Resolution(source);
    String projectId = r.take(FIREBASE_PROJECT_ID);
    String privateKey = r.take(FIREBASE_PRIVATE_KEY);
    String clientEmail = r.take(FIREBASE_CLIENT_EMAIL);
    String databaseUrl = r.take(FIRESTORE_DATABASE_URL);
    Integer maxNodes = r.take(MAX_GRAPH_NODES);
    Integer maxEdges = r.take(MAX_GRAPH_EDGES);
    Integer cacheTtl = r.take(GRAPH_CACHE_TTL);
    Double confidence = r.take(CAUSAL_CONFIDENCE_THRESHOLD);
    Double correlation = r.take(CORRELATION_THRESHOLD);
    Integer batchSize = r.take(DISCOVERY_BATCH_SIZE);
    String logLevel = r.take(LOG_LEVEL);
    String logFile = r.take(LOG_FILE);
    Integer workers = r.take(MAX_WORKERS);
    String redisUrl = r.take(REDIS_URL);
    if (r.error != null) {
      return ConfigResult.failure(r.error);
    }
    try {
      return ConfigResult.success(new Settings(
          projectId,
          privateKey,
          clientEmail,
          databaseUrl,
          maxNodes,
          maxEdges,
          cacheTtl,
          confidence,
          correlation,
          batchSize,
          logLevel,
          logFile,
          workers,
          redisUrl));
    } catch (IllegalArgumentException ex) {
      return ConfigResult.failure(new ConfigurationError(ConfigErrorKind.INVALID_VALUE, "", ex.getMessage()));
    }
  }

  static int defaultWorkers() {
    return Math.max(MIN_DEFAULT_WORKERS, Runtime.getRuntime().availableProcessors());
  }

  static String parseLogLevel(String raw) {
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "WARNING" -> "WARN";
      case "CRITICAL", "FATAL" -> "ERROR";
      case "NOTSET", "ALL" -> "TRACE";
      default -> {
        if (!Settings.LOG_LEVELS.contains(normalized)) {
          throw new IllegalArgumentException("unknown log level '" + raw.trim() + "'");
        }
        yield normalized;
      }
    };
  }

  private static Integer parseInt(String raw) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("expected an integer (was '" + raw.trim() + "')", ex);
    }
  }

  private static Double parseDouble(String raw) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("expected a number (was '" + raw.trim() + "')", ex);
    }
  }

  private static ConfigOption<Integer> positiveInt(String variable, int defaultValue) {
    return ConfigOption.optional(variable, () -> defaultValue, SettingsSchema::parseInt)
        .validatedBy(value -> Numbers.requirePositive(variable, value), ConfigErrorKind.OUT_OF_RANGE_VALUE);
  }

  private static ConfigOption<Double> unitInterval(String variable, double defaultValue) {
    return ConfigOption.optional(variable, () -> defaultValue, SettingsSchema::parseDouble)
        .validatedBy(value -> Numbers.requireRange(variable, value, 0d, 1d), ConfigErrorKind.OUT_OF_RANGE_VALUE);
  }

  private static final class Resolution {
    private final EnvironmentSource source;
    private ConfigurationError error;

    private Resolution(EnvironmentSource source) {
      this.source = source;
    }

    <T> T take(ConfigOption<T> option) {
      if (error != null) {
        return null;
      }
      ConfigResult<T> result = option.resolve(source);
      if (result instanceof ConfigResult.Failure<T> failure) {
        error = failure.error();
        return null;
      }
      return ((ConfigResult.Success<T>) result).value();
    }
  }
}
