package ca.gc.cra.vantage.infrastructure.topology;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vantage.domain.agent.AgentDescriptor;
import ca.gc.cra.vantage.domain.agent.AgentType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonAgentRegistryTest {
  @TempDir Path tempDir;

  @Test
  void readsAgentsInOrder() throws IOException {
    Path file = tempDir.resolve("agents.json");
    Files.writeString(file, """
        {"agents": [
          {"name": "kvm-1", "type": "kvm", "launchServer": "10.0.0.1"},
          {"name": "pods", "type": "pod-host", "podNodeId": 21},
          {"name": "collector", "type": "DEDICATED"}
        ]}
        """, StandardCharsets.UTF_8);

    List<AgentDescriptor> agents = new JsonAgentRegistry(file).agents();

    assertEquals(List.of(
        new AgentDescriptor("kvm-1", AgentType.KVM, "10.0.0.1", 0, 0, 0),
        new AgentDescriptor("pods", AgentType.POD_HOST, "", 0, 0, 21),
        new AgentDescriptor("collector", AgentType.DEDICATED, "", 0, 0, 0)), agents);
  }

  @Test
  void unknownTypeIsReportedWithPath() throws IOException {
    Path file = tempDir.resolve("agents.json");
    Files.writeString(file, "{\"agents\": [{\"name\": \"x\", \"type\": \"mainframe\"}]}", StandardCharsets.UTF_8);

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> new JsonAgentRegistry(file).agents());

    assertTrue(ex.getMessage().contains("$.agents[0].type"));
    assertTrue(ex.getMessage().contains("mainframe"));
  }

  @Test
  void blankNameIsRejected() throws IOException {
    Path file = tempDir.resolve("agents.json");
    Files.writeString(file, "{\"agents\": [{\"type\": \"host\", \"hostId\": 1}]}", StandardCharsets.UTF_8);

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> new JsonAgentRegistry(file).agents());

    assertTrue(ex.getMessage().startsWith("Invalid agents at"));
  }

  @Test
  void missingAgentsArrayMeansNoAgents() throws IOException {
    Path file = tempDir.resolve("agents.json");
    Files.writeString(file, "{}", StandardCharsets.UTF_8);

    assertTrue(new JsonAgentRegistry(file).agents().isEmpty());
  }
}
