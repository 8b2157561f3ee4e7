package ca.gc.cra.acdih.api;

import ca.gc.cra.acdih.config.source.SystemEnvironmentSource;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code acdih} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String HELP_TEXT = """
      ACDIH configuration tool

      Usage:
        acdih <command> [options]

      Commands:
        check   Load and validate the configuration
        show    Print the effective configuration with secrets redacted
        pool    Print the derived cache connection-pool configuration

      Options:
        envFile=PATH              dotenv file layered below the process environment (default .env)
        yaml=PATH                 YAML file layered below the dotenv file
        metricsExporter=otlp|none OpenTelemetry metrics exporter (default otlp)
        otelEndpoint=URL          OTLP endpoint (default http://localhost:4317)
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Exit codes:
        0 success, 2 invalid arguments, 3 unreadable file, 4 invalid configuration, 5 unexpected failure
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the command)
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (input.help()) {
      CliPrinter.printLines(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.printLines(ConfigCli.usage());
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    if (!ConfigCli.COMMANDS.contains(command)) {
      log.error("Unknown command: {}", command);
      CliPrinter.printLines(ConfigCli.usage());
      return ExitCode.INVALID_ARGS;
    }
    String[] delegateArgs = Arrays.copyOfRange(remainder, 1, remainder.length);
    if (input.verbose()) {
      delegateArgs = Arrays.copyOf(delegateArgs, delegateArgs.length + 1);
      delegateArgs[delegateArgs.length - 1] = "--verbose";
    }
    for (String flag : input.otherFlags()) {
      delegateArgs = Arrays.copyOf(delegateArgs, delegateArgs.length + 1);
      delegateArgs[delegateArgs.length - 1] = flag;
    }
    return ConfigCli.run(command, delegateArgs, new SystemEnvironmentSource());
  }
}
