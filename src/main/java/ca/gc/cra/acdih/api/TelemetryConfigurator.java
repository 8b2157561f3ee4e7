package ca.gc.cra.acdih.api;

import ca.gc.cra.acdih.validation.Urls;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry CLI options as system properties read by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter} and {@code otelEndpoint} from {@code args}.
   *
   * @param args mutable CLI map; recognized keys are removed
   * @throws IllegalArgumentException when a value is invalid
   */
  static void configureMetrics(Map<String, String> args) {
    String exporter = args.remove("metricsExporter");
    if (exporter != null && !exporter.isBlank()) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty(EXPORTER_PROPERTY, normalized);
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      String validated = Urls.requireUrl("otelEndpoint", endpoint, Set.of("http", "https"));
      log.debug("Configuring OTLP endpoint: {}", validated);
      System.setProperty(ENDPOINT_PROPERTY, validated);
    }
  }
}
