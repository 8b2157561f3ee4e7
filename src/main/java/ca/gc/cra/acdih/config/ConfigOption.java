package ca.gc.cra.acdih.config;

import ca.gc.cra.acdih.config.source.EnvironmentSource;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Declarative binding of one setting to an environment variable.
 *
 * <p>Resolution order: a present value is parsed; an absent value (or a blank one for optional
 * settings) falls back to the default; a required setting without a value fails with
 * {@link ConfigErrorKind#MISSING_REQUIRED_VALUE}. The validator runs on every resolved value, defaults
 * included.</p>
 *
 * @param variable environment variable name
 * @param required whether the variable must be present
 * @param defaultValue default supplier; evaluated lazily, ignored for required options
 * @param parser converts the raw text; throws {@link IllegalArgumentException} on malformed input
 * @param validator checks the parsed value; throws {@link IllegalArgumentException} on violation
 * @param violationKind error kind reported when the validator rejects a value
 * @param <T> value type
 * @since 0.1.0
 */
public record ConfigOption<T>(
    String variable,
    boolean required,
    Supplier<T> defaultValue,
    Function<String, T> parser,
    Consumer<T> validator,
    ConfigErrorKind violationKind) {

  /**
   * Validates the option definition.
   */
  public ConfigOption {
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(parser, "parser");
    validator = validator == null ? value -> {} : validator;
    violationKind = Objects.requireNonNullElse(violationKind, ConfigErrorKind.INVALID_VALUE);
    if (!required) {
      Objects.requireNonNull(defaultValue, "defaultValue for optional " + variable);
    }
  }

  /**
   * Declares a required variable without default.
   *
   * @param variable environment variable name
   * @param parser value parser
   * @param <T> value type
   * @return option definition
   */
  public static <T> ConfigOption<T> required(String variable, Function<String, T> parser) {
    return new ConfigOption<>(variable, true, null, parser, null, ConfigErrorKind.INVALID_VALUE);
  }

  /**
   * Declares an optional variable with a default.
   *
   * @param variable environment variable name
   * @param defaultValue default supplier
   * @param parser value parser
   * @param <T> value type
   * @return option definition
   */
  public static <T> ConfigOption<T> optional(
      String variable, Supplier<T> defaultValue, Function<String, T> parser) {
    return new ConfigOption<>(variable, false, defaultValue, parser, null, ConfigErrorKind.INVALID_VALUE);
  }

  /**
   * Returns a copy that applies {@code check} and reports violations as {@code kind}.
   *
   * @param check validator throwing {@link IllegalArgumentException}
   * @param kind error kind for violations
   * @return new option definition
   */
  public ConfigOption<T> validatedBy(Consumer<T> check, ConfigErrorKind kind) {
    return new ConfigOption<>(variable, required, defaultValue, parser, check, kind);
  }

  /**
   * Resolves the option against {@code source}.
   *
   * @param source variable source
   * @return resolved value or typed error
   */
  public ConfigResult<T> resolve(EnvironmentSource source) {
    Optional<String> raw = source.get(variable);
    T value;
    if (raw.isEmpty() || (!required && raw.get().isBlank())) {
      if (required) {
        return ConfigResult.failure(ConfigurationError.missing(variable));
      }
      value = defaultValue.get();
    } else {
      try {
        value = parser.apply(raw.get());
      } catch (IllegalArgumentException ex) {
        return ConfigResult.failure(ConfigurationError.invalid(
            variable, variable + " has an invalid value: " + ex.getMessage()));
      }
    }
    try {
      validator.accept(value);
    } catch (IllegalArgumentException ex) {
      return ConfigResult.failure(new ConfigurationError(violationKind, variable, ex.getMessage()));
    }
    return ConfigResult.success(value);
  }
}
