package ca.gc.cra.vantage.api;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @Test
  void acceptsHttpEndpoints() {
    assertDoesNotThrow(() -> TelemetryConfigurator.validateEndpoint("http://collector:4317"));
    assertDoesNotThrow(() -> TelemetryConfigurator.validateEndpoint("HTTPS://otel.example.org"));
  }

  @Test
  void rejectsOtherSchemesAndMissingHosts() {
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.validateEndpoint("grpc://collector"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.validateEndpoint("http:///path"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.validateEndpoint("http://bad host"));
  }
}
