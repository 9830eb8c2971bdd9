package ca.gc.cra.vantage.infrastructure.topology;

import static ca.gc.cra.vantage.infrastructure.json.JsonSupport.asObject;
import static ca.gc.cra.vantage.infrastructure.json.JsonSupport.optionalInt;
import static ca.gc.cra.vantage.infrastructure.json.JsonSupport.optionalList;
import static ca.gc.cra.vantage.infrastructure.json.JsonSupport.optionalString;

import ca.gc.cra.vantage.application.port.AgentRegistry;
import ca.gc.cra.vantage.domain.agent.AgentDescriptor;
import ca.gc.cra.vantage.domain.agent.AgentType;
import ca.gc.cra.vantage.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AgentRegistry} reading {@code {"agents":[...]}} from a JSON file.
 *
 * <p>Each entry needs a {@code name} and a {@code type}; {@code launchServer}, {@code hostId}, {@code vmId} and
 * {@code podNodeId} are optional and default to blank or {@code 0}.</p>
 *
 * @since 0.1.0
 */
public final class JsonAgentRegistry implements AgentRegistry {
  private static final Logger log = LoggerFactory.getLogger(JsonAgentRegistry.class);

  private final Path path;
  private final JsonSupport json = new JsonSupport();

  /**
   * @param path agents JSON file; must not be {@code null}
   */
  public JsonAgentRegistry(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public List<AgentDescriptor> agents() throws IOException {
    Map<String, Object> root;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      root = json.parseObject(reader);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Failed to parse agents at " + path + ": " + ex.getMessage(), ex);
    }
    try {
      List<AgentDescriptor> agents = toAgents(root);
      log.debug("Loaded {} agents from {}", agents.size(), path);
      return agents;
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Invalid agents at " + path + ": " + ex.getMessage(), ex);
    }
  }

  static List<AgentDescriptor> toAgents(Map<String, Object> root) {
    List<Object> entries = optionalList(root, "agents", "$");
    List<AgentDescriptor> agents = new ArrayList<>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      String at = "$.agents[" + i + "]";
      Map<String, Object> node = asObject(entries.get(i), at);
      AgentType type;
      try {
        type = AgentType.fromString(optionalString(node, "type", at));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(at + ".type: " + ex.getMessage(), ex);
      }
      agents.add(new AgentDescriptor(
          optionalString(node, "name", at),
          type,
          optionalString(node, "launchServer", at),
          optionalInt(node, "hostId", at, 0),
          optionalInt(node, "vmId", at, 0),
          optionalInt(node, "podNodeId", at, 0)));
    }
    return List.copyOf(agents);
  }
}
