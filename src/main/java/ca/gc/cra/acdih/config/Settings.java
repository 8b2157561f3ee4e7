package ca.gc.cra.acdih.config;

import ca.gc.cra.acdih.config.source.EnvironmentSource;
import ca.gc.cra.acdih.validation.Numbers;
import ca.gc.cra.acdih.validation.Strings;
import ca.gc.cra.acdih.validation.Urls;
import java.util.Objects;
import java.util.Set;

/**
 * Validated snapshot of ACDIH process configuration.
 *
 * @param firebaseProjectId document-database project identifier ({@code FIREBASE_PROJECT_ID})
 * @param firebasePrivateKey service-account private key ({@code FIREBASE_PRIVATE_KEY}); never logged
 * @param firebaseClientEmail service-account identity ({@code FIREBASE_CLIENT_EMAIL})
 * @param firestoreDatabaseUrl document-database base URL ({@code FIRESTORE_DATABASE_URL})
 * @param maxGraphNodes node capacity guard ({@code MAX_GRAPH_NODES})
 * @param maxGraphEdges edge capacity guard ({@code MAX_GRAPH_EDGES})
 * @param graphCacheTtlSeconds cache freshness guard in seconds ({@code GRAPH_CACHE_TTL})
 * @param causalConfidenceThreshold confidence policy knob in [0.0, 1.0] ({@code CAUSAL_CONFIDENCE_THRESHOLD})
 * @param correlationThreshold correlation policy knob in [0.0, 1.0] ({@code CORRELATION_THRESHOLD})
 * @param discoveryBatchSize processing chunk size ({@code DISCOVERY_BATCH_SIZE})
 * @param logLevel normalized root log level ({@code LOG_LEVEL})
 * @param logFile diagnostics file ({@code LOG_FILE})
 * @param maxWorkers worker count used for concurrency sizing ({@code MAX_WORKERS})
 * @param redisUrl cache/queue endpoint used as the pool target ({@code REDIS_URL})
 * @since 0.1.0
 */
public record Settings(
    String firebaseProjectId,
    String firebasePrivateKey,
    String firebaseClientEmail,
    String firestoreDatabaseUrl,
    int maxGraphNodes,
    int maxGraphEdges,
    int graphCacheTtlSeconds,
    double causalConfidenceThreshold,
    double correlationThreshold,
    int discoveryBatchSize,
    String logLevel,
    String logFile,
    int maxWorkers,
    String redisUrl) {

  static final Set<String> DATABASE_SCHEMES = Set.of("http", "https");
  static final Set<String> CACHE_SCHEMES = Set.of("redis", "rediss", Urls.SOCKET_SCHEME);
  static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");
  static final int MAX_WORKERS_LIMIT = Integer.MAX_VALUE / 2;

  /**
   * Re-checks every constraint so an invalid instance cannot be constructed directly.
   *
   * @throws IllegalArgumentException when a field violates its constraint
   */
  public Settings {
    Objects.requireNonNull(firebaseProjectId, "firebaseProjectId");
    Objects.requireNonNull(firebasePrivateKey, "firebasePrivateKey");
    Objects.requireNonNull(firebaseClientEmail, "firebaseClientEmail");
    firestoreDatabaseUrl = Urls.requireUrl("firestoreDatabaseUrl", firestoreDatabaseUrl, DATABASE_SCHEMES);
    Numbers.requirePositive("maxGraphNodes", maxGraphNodes);
    Numbers.requirePositive("maxGraphEdges", maxGraphEdges);
    Numbers.requirePositive("graphCacheTtlSeconds", graphCacheTtlSeconds);
    Numbers.requireRange("causalConfidenceThreshold", causalConfidenceThreshold, 0d, 1d);
    Numbers.requireRange("correlationThreshold", correlationThreshold, 0d, 1d);
    Numbers.requirePositive("discoveryBatchSize", discoveryBatchSize);
    logLevel = Strings.requireNonBlank("logLevel", logLevel);
    if (!LOG_LEVELS.contains(logLevel)) {
      throw new IllegalArgumentException("logLevel must be one of " + LOG_LEVELS + " (was " + logLevel + ")");
    }
    logFile = Strings.requireNonBlank("logFile", logFile);
    Numbers.requireRange("maxWorkers", maxWorkers, 1, MAX_WORKERS_LIMIT);
    redisUrl = Urls.requireUrl("redisUrl", redisUrl, CACHE_SCHEMES);
  }

  /**
   * Resolves settings from {@code source} using {@link SettingsSchema}.
   *
   * @param source variable source
   * @return validated settings or the first error encountered
   */
  public static ConfigResult<Settings> load(EnvironmentSource source) {
    return SettingsSchema.resolve(source);
  }

  /**
   * Derives the connection-pool description for the cache endpoint.
   *
   * @return pool configuration
   */
  public PoolConfig poolConfig() {
    return PoolConfig.fromSettings(this);
  }

  @Override
  public String toString() {
    return "Settings[firebaseProjectId=" + firebaseProjectId
        + ", firebasePrivateKey=" + Credentials.redact(firebasePrivateKey)
        + ", firebaseClientEmail=" + firebaseClientEmail
        + ", firestoreDatabaseUrl=" + firestoreDatabaseUrl
        + ", maxGraphNodes=" + maxGraphNodes
        + ", maxGraphEdges=" + maxGraphEdges
        + ", graphCacheTtlSeconds=" + graphCacheTtlSeconds
        + ", causalConfidenceThreshold=" + causalConfidenceThreshold
        + ", correlationThreshold=" + correlationThreshold
        + ", discoveryBatchSize=" + discoveryBatchSize
        + ", logLevel=" + logLevel
        + ", logFile=" + logFile
        + ", maxWorkers=" + maxWorkers
        + ", redisUrl=" + redisUrl
        + ']';
  }
}
