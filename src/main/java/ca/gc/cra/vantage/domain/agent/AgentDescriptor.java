package ca.gc.cra.vantage.domain.agent;

import java.util.Objects;

/**
 * <strong>What:</strong> Identity of one capture agent as known to the controller.
 * <p><strong>Role:</strong> Input of {@code AgentSegmentResolver}; only the fields relevant to the agent's
 * {@link AgentType} are consulted.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param name agent name; must not be blank
 * @param type deployment type
 * @param launchServer launch server the agent runs on; empty when not applicable
 * @param hostId host id; {@code 0} when not applicable
 * @param vmId VM id; {@code 0} when not applicable
 * @param podNodeId pod-node id; {@code 0} when not applicable
 * @since 0.1.0
 */
public record AgentDescriptor(
    String name, AgentType type, String launchServer, int hostId, int vmId, int podNodeId) {

  public AgentDescriptor {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("agent name must not be blank");
    }
    Objects.requireNonNull(type, "type");
    launchServer = launchServer == null ? "" : launchServer.trim();
  }

  /**
   * Indicates whether the agent must be resolved after every other agent of the cycle.
   *
   * @return {@code true} for dedicated collectors, whose remote segments depend on all other claims
   */
  public boolean resolvesLast() {
    return type == AgentType.DEDICATED;
  }
}
