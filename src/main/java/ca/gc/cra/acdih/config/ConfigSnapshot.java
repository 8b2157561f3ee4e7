package ca.gc.cra.acdih.config;

import java.util.Objects;

/**
 * Settings and credentials published together by {@link ConfigManager}.
 *
 * @param settings validated settings
 * @param credentials credentials derived from {@code settings}
 * @since 0.1.0
 */
public record ConfigSnapshot(Settings settings, Credentials credentials) {

  /**
   * Rejects partial snapshots.
   */
  public ConfigSnapshot {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(credentials, "credentials");
  }

  /**
   * Derives the pool configuration from the snapshot's settings.
   *
   * @return pool configuration
   */
  public PoolConfig poolConfig() {
    return settings.poolConfig();
  }
}
