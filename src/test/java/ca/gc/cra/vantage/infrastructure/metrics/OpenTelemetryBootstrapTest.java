package ca.gc.cra.vantage.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void exporterModeDefaultsToNone() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from(null));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
  }

  @Test
  void settingsPreferSystemPropertiesOverEnvironment() {
    Map<String, String> props = Map.of("otel.metrics.exporter", "otlp");
    Map<String, String> env = Map.of(
        "OTEL_METRICS_EXPORTER", "none",
        "OTEL_EXPORTER_OTLP_ENDPOINT", "http://collector:4317",
        "OTEL_RESOURCE_ATTRIBUTES", "deployment.environment=test");

    OpenTelemetryBootstrap.Settings settings = OpenTelemetryBootstrap.Settings.resolve(props::get, env::get);

    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals("test", settings.resourceAttributes().get(AttributeKey.stringKey("deployment.environment")));
  }

  @Test
  void settingsDefaultEndpoint() {
    OpenTelemetryBootstrap.Settings settings = OpenTelemetryBootstrap.Settings.resolve(key -> null, key -> null);

    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, settings.exporter());
    assertEquals("http://localhost:4317", settings.endpoint());
    assertTrue(settings.resourceAttributes().isEmpty());
  }

  @Test
  void malformedResourceAttributesAreSkipped() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("team=net, broken, =x, zone = a ,");

    assertEquals(2, attributes.size());
    assertEquals("net", attributes.get(AttributeKey.stringKey("team")));
    assertEquals("a", attributes.get(AttributeKey.stringKey("zone")));
  }
}
