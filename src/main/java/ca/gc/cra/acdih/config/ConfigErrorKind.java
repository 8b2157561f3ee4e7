package ca.gc.cra.acdih.config;

/**
 * Categories of fatal configuration failures.
 *
 * <p>A private key that does not look like PEM is deliberately absent: that check only produces a
 * warning.</p>
 *
 * @since 0.1.0
 */
public enum ConfigErrorKind {
  /** A required environment variable is absent. */
  MISSING_REQUIRED_VALUE,
  /** A numeric field lies outside its declared bound. */
  OUT_OF_RANGE_VALUE,
  /** A value is present but cannot be parsed (number, URL, log level). */
  INVALID_VALUE,
  /** Identity fields are blank after an otherwise successful load. */
  INCOMPLETE_CREDENTIALS,
  /** A configuration file backing the variable source exists but cannot be read. */
  UNREADABLE_SOURCE
}
