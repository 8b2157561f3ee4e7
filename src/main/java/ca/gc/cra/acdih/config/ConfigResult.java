package ca.gc.cra.acdih.config;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a configuration factory: either a validated value or a {@link ConfigurationError}.
 *
 * <p><strong>Thread-safety:</strong> Implementations are immutable records.</p>
 *
 * @param <T> value type
 * @since 0.1.0
 */
public sealed interface ConfigResult<T> permits ConfigResult.Success, ConfigResult.Failure {

  /**
   * Wraps a successful value.
   *
   * @param value validated value; must not be {@code null}
   * @param <T> value type
   * @return success result
   */
  static <T> ConfigResult<T> success(T value) {
    return new Success<>(value);
  }

  /**
   * Wraps a failure.
   *
   * @param error failure description; must not be {@code null}
   * @param <T> value type
   * @return failure result
   */
  static <T> ConfigResult<T> failure(ConfigurationError error) {
    return new Failure<>(error);
  }

  /**
   * Indicates whether this result carries a value.
   *
   * @return {@code true} for {@link Success}
   */
  default boolean isSuccess() {
    return this instanceof Success<T>;
  }

  /**
   * Transforms the value of a successful result; failures pass through unchanged.
   *
   * @param mapper value transformation
   * @param <R> new value type
   * @return mapped result
   */
  default <R> ConfigResult<R> map(Function<? super T, ? extends R> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    if (this instanceof Success<T> success) {
      return new Success<>(mapper.apply(success.value()));
    }
    return new Failure<>(((Failure<T>) this).error());
  }

  /**
   * Chains a further factory onto a successful result; failures pass through unchanged.
   *
   * @param mapper factory producing the next result
   * @param <R> new value type
   * @return chained result
   */
  default <R> ConfigResult<R> flatMap(Function<? super T, ConfigResult<R>> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    if (this instanceof Success<T> success) {
      return Objects.requireNonNull(mapper.apply(success.value()), "mapper result");
    }
    return new Failure<>(((Failure<T>) this).error());
  }

  /**
   * Returns the value or throws the failure as a {@link ConfigurationException}.
   *
   * @return validated value
   * @throws ConfigurationException when this result is a {@link Failure}
   */
  default T orElseThrow() {
    if (this instanceof Success<T> success) {
      return success.value();
    }
    throw new ConfigurationException(((Failure<T>) this).error());
  }

  /**
   * Successful outcome.
   *
   * @param value validated value
   * @param <T> value type
   */
  record Success<T>(T value) implements ConfigResult<T> {
    /** Rejects {@code null} values. */
    public Success {
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * Failed outcome.
   *
   * @param error failure description
   * @param <T> value type
   */
  record Failure<T>(ConfigurationError error) implements ConfigResult<T> {
    /** Rejects {@code null} errors. */
    public Failure {
      Objects.requireNonNull(error, "error");
    }
  }
}
