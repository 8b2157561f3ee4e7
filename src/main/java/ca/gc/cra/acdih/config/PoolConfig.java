package ca.gc.cra.acdih.config;

import ca.gc.cra.acdih.validation.Numbers;
import ca.gc.cra.acdih.validation.Strings;
import java.util.Objects;

/**
 * Connection-pool description for the cache/queue endpoint.
 *
 * @param endpoint pool target URL
 * @param decodeResponses whether clients decode responses to text
 * @param maxConnections upper bound on concurrent connections
 * @since 0.1.0
 */
public record PoolConfig(String endpoint, boolean decodeResponses, int maxConnections) {
  /** Connections granted per configured worker. */
  public static final int CONNECTIONS_PER_WORKER = 2;

  /**
   * Validates the pool description.
   */
  public PoolConfig {
    endpoint = Strings.requireNonBlank("endpoint", endpoint);
    Numbers.requirePositive("maxConnections", maxConnections);
  }

  /**
   * Derives the pool description from settings; performs no I/O.
   *
   * @param settings validated settings
   * @return pool with {@code maxConnections = 2 x maxWorkers}
   */
  public static PoolConfig fromSettings(Settings settings) {
    Objects.requireNonNull(settings, "settings");
    return new PoolConfig(settings.redisUrl(), true, settings.maxWorkers() * CONNECTIONS_PER_WORKER);
  }
}
