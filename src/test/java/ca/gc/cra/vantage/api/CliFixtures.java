package ca.gc.cra.vantage.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Topology and agent files shared by the CLI tests. */
final class CliFixtures {
  static final String TOPOLOGY = """
      {
        "vinterfaces": [
          {"id": 1, "mac": "aa:01", "networkId": 10},
          {"id": 2, "mac": "aa:02", "networkId": 10},
          {"id": 3, "mac": "aa:03", "networkId": 20}
        ],
        "hosts": [{"id": 1, "vinterfaces": [1]}],
        "vms": [{"id": 11, "launchServer": "10.0.0.1", "vinterfaces": [2]}]
      }
      """;

  static final String AGENTS = """
      {"agents": [
        {"name": "kvm-1", "type": "kvm", "launchServer": "10.0.0.1"},
        {"name": "collector", "type": "dedicated"}
      ]}
      """;

  private CliFixtures() {}

  static Path topology(Path dir) throws IOException {
    return Files.writeString(dir.resolve("topology.json"), TOPOLOGY);
  }

  static Path agents(Path dir) throws IOException {
    return Files.writeString(dir.resolve("agents.json"), AGENTS);
  }

  static void clearTelemetryProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }
}
