package ca.gc.cra.acdih.config;

import ca.gc.cra.acdih.application.port.MetricsPort;
import ca.gc.cra.acdih.config.source.DotenvEnvironmentSource;
import ca.gc.cra.acdih.config.source.EnvironmentSource;
import ca.gc.cra.acdih.config.source.EnvironmentSourceException;
import ca.gc.cra.acdih.config.source.LayeredEnvironmentSource;
import ca.gc.cra.acdih.config.source.SystemEnvironmentSource;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads, validates and caches {@link Settings} and {@link Credentials} once.
 * <p><strong>Why:</strong> Every consumer must see the same validated configuration, and configuration
 * problems must stop the process at first access instead of surfacing later as connection failures.</p>
 * <p><strong>Role:</strong> Constructed once by the application bootstrap and passed to consumers.</p>
 * <p><strong>Thread-safety:</strong> The first load runs under a {@link ReentrantLock} so concurrent first
 * callers trigger exactly one load; afterwards reads go through a {@code volatile} field without locking.
 * A failed load caches nothing.</p>
 * <p><strong>Observability:</strong> Logs the load outcome and records {@code config.load.attempt},
 * {@code config.load.success}, {@code config.load.failure} and {@code config.load.duration.ms}.</p>
 *
 * @since 0.1.0
 */
public final class ConfigManager {
  private static final Logger log = LoggerFactory.getLogger(ConfigManager.class);

  static final String METRIC_ATTEMPT = "config.load.attempt";
  static final String METRIC_SUCCESS = "config.load.success";
  static final String METRIC_FAILURE = "config.load.failure";
  static final String METRIC_DURATION = "config.load.duration.ms";

  private final EnvironmentSource source;
  private final MetricsPort metrics;
  private final ReentrantLock initLock = new ReentrantLock();
  private volatile ConfigSnapshot snapshot;

  /**
   * Creates a manager that resolves settings from {@code source}. Nothing is read until the first
   * accessor or {@link #initializeOnce()} call.
   *
   * @param source variable source; must not be {@code null}
   */
  public ConfigManager(EnvironmentSource source) {
    this(source, MetricsPort.NO_OP);
  }

  /**
   * Creates a manager that resolves settings from {@code source} and reports to {@code metrics}.
   *
   * @param source variable source; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public ConfigManager(EnvironmentSource source, MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Creates a manager over the process environment layered above {@code ./.env}.
   *
   * @return unloaded manager
   */
  public static ConfigManager fromEnvironment() {
    return fromEnvironment(Path.of(DotenvEnvironmentSource.DEFAULT_FILE), MetricsPort.NO_OP);
  }

  /**
   * Creates a manager over the process environment layered above the given {@code .env} file.
   *
   * <p>The file is read during the first load. An unreadable file fails that load with
   * {@link ConfigErrorKind#UNREADABLE_SOURCE}.</p>
   *
   * @param envFile dotenv file; a missing file is ignored
   * @param metrics metrics sink
   * @return unloaded manager
   */
  public static ConfigManager fromEnvironment(Path envFile, MetricsPort metrics) {
    EnvironmentSource layered = LayeredEnvironmentSource.of(
        new SystemEnvironmentSource(), DotenvEnvironmentSource.deferred(envFile));
    return new ConfigManager(layered, metrics);
  }

  /**
   * Loads and validates the configuration unless a snapshot is already cached.
   *
   * <p>Concurrent callers block on the initialization lock while the first load runs and then
   * observe its result. After a failure nothing is cached, so a later call performs a fresh load.</p>
   *
   * @return cached snapshot or the load failure
   */
  public ConfigResult<ConfigSnapshot> initializeOnce() {
    ConfigSnapshot current = snapshot;
    if (current != null) {
      return ConfigResult.success(current);
    }
    initLock.lock();
    try {
      current = snapshot;
      if (current != null) {
        return ConfigResult.success(current);
      }
      ConfigResult<ConfigSnapshot> loaded = load();
      if (loaded instanceof ConfigResult.Success<ConfigSnapshot> success) {
        snapshot = success.value();
      }
      return loaded;
    } finally {
      initLock.unlock();
    }
  }

  /**
   * Indicates whether a validated snapshot is cached.
   *
   * @return {@code true} after a successful load
   */
  public boolean isInitialized() {
    return snapshot != null;
  }

  /**
   * Returns the cached settings, loading them on first use.
   *
   * @return validated settings
   * @throws ConfigurationException when loading fails
   */
  public Settings getSettings() {
    return snapshot().settings();
  }

  /**
   * Returns the cached credentials, loading them on first use.
   *
   * @return validated credentials
   * @throws ConfigurationException when loading fails
   */
  public Credentials getCredentials() {
    return snapshot().credentials();
  }

  /**
   * Derives the connection-pool description from the cached settings.
   *
   * @return pool configuration with {@code maxConnections = 2 x maxWorkers}
   * @throws ConfigurationException when loading fails
   */
  public PoolConfig getDerivedPoolConfig() {
    return snapshot().poolConfig();
  }

  /**
   * Returns the cached snapshot, loading it on first use.
   *
   * @return settings and credentials
   * @throws ConfigurationException when loading fails
   */
  public ConfigSnapshot snapshot() {
    ConfigSnapshot current = snapshot;
    return current != null ? current : initializeOnce().orElseThrow();
  }

  /**
   * Describes the variable source without revealing values.
   *
   * @return source description
   */
  public String sourceDescription() {
    return source.description();
  }

  private ConfigResult<ConfigSnapshot> load() {
    metrics.increment(METRIC_ATTEMPT);
    long started = System.nanoTime();
    ConfigResult<ConfigSnapshot> result;
    try {
      result = Settings.load(source)
          .flatMap(settings -> Credentials.fromSettings(settings, metrics)
              .map(credentials -> new ConfigSnapshot(settings, credentials)));
    } catch (EnvironmentSourceException ex) {
      result = ConfigResult.failure(
          new ConfigurationError(ConfigErrorKind.UNREADABLE_SOURCE, "", ex.getMessage()));
    }
    metrics.observe(METRIC_DURATION, (System.nanoTime() - started) / 1_000_000L);
    if (result instanceof ConfigResult.Failure<ConfigSnapshot> failure) {
      metrics.increment(METRIC_FAILURE);
      log.error("Failed to load configuration: {}", failure.error());
    } else {
      metrics.increment(METRIC_SUCCESS);
      log.info("Configuration loaded successfully from {}", source.description());
    }
    return result;
  }
}
