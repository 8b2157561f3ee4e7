package ca.gc.cra.acdih.config.source;

/**
 * Raised when an {@link EnvironmentSource} cannot read its backing file.
 *
 * @since 0.1.0
 */
public final class EnvironmentSourceException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception.
   *
   * @param message description naming the source
   * @param cause underlying failure
   */
  public EnvironmentSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
