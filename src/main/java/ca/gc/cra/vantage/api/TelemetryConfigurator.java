package ca.gc.cra.vantage.api;

import ca.gc.cra.vantage.config.ResolverConfig;
import ca.gc.cra.vantage.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies metrics settings from the effective configuration into the {@code otel.*} system properties read by
 * the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Applies exporter, endpoint, and resource attribute settings.
   *
   * @param config effective configuration
   * @throws IllegalArgumentException when the endpoint is not an http(s) URI or the attributes are not printable
   *     ASCII
   */
  static void configureMetrics(ResolverConfig config) {
    Objects.requireNonNull(config, "config");
    log.debug("Configuring OpenTelemetry metrics exporter: {}", config.metricsExporter());
    System.setProperty("otel.metrics.exporter", config.metricsExporter());

    String endpoint = config.otelEndpoint().trim();
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String attributes = config.otelResourceAttributes().trim();
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", attributes);
    }
  }

  static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }
}
