package ca.gc.cra.acdih.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by ACDIH configuration parsing.
 * <p><strong>Why:</strong> Guards capacity limits (graph sizes, batch sizes), policy thresholds
 * (confidence, correlation) and concurrency sizing before consumers allocate resources.
 * <p><strong>Role:</strong> Support utilities invoked by the settings schema and configuration records.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce inclusive numeric bounds declared in the settings schema.</li>
 *   <li>Provide consistent error messaging for CLI feedback.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Performance:</strong> Constant-time range checks.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., seconds, nodes)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   *
   * <p><strong>Concurrency:</strong> Safe for concurrent use.</p>
   * <p><strong>Performance:</strong> Constant-time comparisons.</p>
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value; {@code NaN} is always rejected
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} is {@code NaN} or lies outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (Double.isNaN(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be within [" + min + "," + max + "] (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a count or size limit is strictly positive.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is zero or negative
   */
  public static int requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(label(name) + " must be positive (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
