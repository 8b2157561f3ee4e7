package ca.gc.cra.acdih.config.source;

/**
 * {@link EnvironmentSource} backed by a snapshot of the process environment taken at construction.
 *
 * @since 0.1.0
 */
public final class SystemEnvironmentSource extends MapEnvironmentSource {

  /**
   * Captures {@link System#getenv()}.
   */
  public SystemEnvironmentSource() {
    super(System.getenv(), "env");
  }
}
