package ca.gc.cra.acdih.logging;

import ca.gc.cra.acdih.config.Settings;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies ACDIH logging settings to the running logging backend.
 * <p><strong>Why:</strong> {@code LOG_LEVEL} and {@code LOG_FILE} are part of the validated configuration, so
 * they can only be applied after the configuration has loaded.</p>
 * <p><strong>Role:</strong> Adapter-side utility that bridges {@link Settings} and CLI flags to Logback.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Set the root logging level from settings or from {@code --verbose}.</li>
 *   <li>Attach a single file appender for the configured log file.</li>
 *   <li>Warn when the backend does not support dynamic changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded bootstrap; the appender swap is
 * synchronized on the class.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Name given to the file appender so repeated calls replace rather than stack it. */
  public static final String FILE_APPENDER_NAME = "ACDIH_FILE";
  private static final String FILE_PATTERN = "%d{ISO8601} %-5level [%thread] %logger{36} - %msg%n";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    Logger root = rootLogger();
    if (root != null && !Level.DEBUG.equals(root.getLevel())) {
      root.setLevel(Level.DEBUG);
    }
  }

  /**
   * Applies the root level and log file from validated settings.
   *
   * @param settings validated settings
   * @param verbose when {@code true} DEBUG overrides the configured level
   * @return {@code true} when the backend accepted the configuration
   */
  public static boolean apply(Settings settings, boolean verbose) {
    Objects.requireNonNull(settings, "settings");
    Logger root = rootLogger();
    if (root == null) {
      return false;
    }
    Level level = verbose ? Level.DEBUG : Level.toLevel(settings.logLevel(), Level.INFO);
    root.setLevel(level);
    attachFileAppender(root, Path.of(settings.logFile()));
    log.debug("Logging configured: level={} file={}", level, settings.logFile());
    return true;
  }

  /**
   * Stops and removes the file appender installed by {@link #apply(Settings, boolean)}, if any.
   *
   * @return {@code true} when an appender was removed
   */
  public static synchronized boolean detachFileAppender() {
    Logger root = rootLogger();
    if (root == null) {
      return false;
    }
    Appender<ILoggingEvent> appender = root.getAppender(FILE_APPENDER_NAME);
    if (appender == null) {
      return false;
    }
    root.detachAppender(appender);
    appender.stop();
    return true;
  }

  private static synchronized void attachFileAppender(Logger root, Path file) {
    LoggerContext context = root.getLoggerContext();
    Appender<ILoggingEvent> previous = root.getAppender(FILE_APPENDER_NAME);
    if (previous != null) {
      root.detachAppender(previous);
      previous.stop();
    }

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(FILE_PATTERN);
    encoder.start();

    FileAppender<ILoggingEvent> appender = new FileAppender<>();
    appender.setContext(context);
    appender.setName(FILE_APPENDER_NAME);
    appender.setFile(file.toAbsolutePath().normalize().toString());
    appender.setAppend(true);
    appender.setEncoder(encoder);
    appender.start();
    root.addAppender(appender);
  }

  private static Logger rootLogger() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      return context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
    log.warn("Logging reconfiguration requested but backend {} does not support dynamic updates",
        factory.getClass().getName());
    return null;
  }
}
