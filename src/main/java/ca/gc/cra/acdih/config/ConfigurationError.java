package ca.gc.cra.acdih.config;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed description of a fatal configuration failure.
 *
 * @param kind failure category
 * @param variable environment variable the failure relates to; empty when it spans several variables
 * @param message operator-facing explanation
 * @since 0.1.0
 */
public record ConfigurationError(ConfigErrorKind kind, String variable, String message)
    implements Serializable {
  private static final long serialVersionUID = 1L;

  /**
   * Validates the error fields.
   */
  public ConfigurationError {
    Objects.requireNonNull(kind, "kind");
    variable = variable == null ? "" : variable;
    message = message == null || message.isBlank() ? kind.name() : message;
  }

  static ConfigurationError missing(String variable) {
    return new ConfigurationError(
        ConfigErrorKind.MISSING_REQUIRED_VALUE,
        variable,
        variable + " is required but was not set");
  }

  static ConfigurationError invalid(String variable, String detail) {
    return new ConfigurationError(ConfigErrorKind.INVALID_VALUE, variable, detail);
  }

  @Override
  public String toString() {
    return variable.isEmpty() ? kind + ": " + message : kind + " [" + variable + "]: " + message;
  }
}
