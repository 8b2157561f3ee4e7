package ca.gc.cra.acdih.config;

import java.util.Objects;

/**
 * Unchecked exception raised by {@link ConfigManager} accessors when configuration cannot be loaded.
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ConfigurationError error;

  /**
   * Creates an exception describing {@code error}.
   *
   * @param error failure description; must not be {@code null}
   */
  public ConfigurationException(ConfigurationError error) {
    super(Objects.requireNonNull(error, "error").toString());
    this.error = error;
  }

  /**
   * Returns the typed failure.
   *
   * @return configuration error
   */
  public ConfigurationError error() {
    return error;
  }

  /**
   * Shorthand for {@code error().kind()}.
   *
   * @return failure category
   */
  public ConfigErrorKind kind() {
    return error.kind();
  }
}
