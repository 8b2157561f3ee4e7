package ca.gc.cra.acdih.config.source;

import java.util.Optional;

/**
 * <strong>What:</strong> Read-only key/value view the settings schema is evaluated against.
 * <p><strong>Why:</strong> Decouples settings resolution from {@link System#getenv()} so tests and embedders can
 * inject their own values.</p>
 * <p><strong>Role:</strong> Port implemented by the process environment, {@code .env} files, YAML files and
 * in-memory maps.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads.</p>
 *
 * @since 0.1.0
 */
public interface EnvironmentSource {

  /**
   * Looks up a variable by name. Implementations match the exact name first and fall back to a
   * case-insensitive match.
   *
   * @param variable variable name such as {@code FIREBASE_PROJECT_ID}; must not be {@code null}
   * @return raw value, possibly blank, or empty when the variable is not defined
   * @throws EnvironmentSourceException when a lazily read backing file cannot be read
   */
  Optional<String> get(String variable);

  /**
   * Short human-readable description used in logs (never includes values).
   *
   * @return description such as {@code env} or {@code dotenv:/app/.env}
   */
  String description();
}
