package ca.gc.cra.vantage.application.segment;

import ca.gc.cra.vantage.domain.agent.AgentDescriptor;
import ca.gc.cra.vantage.domain.agent.AgentSegments;
import ca.gc.cra.vantage.domain.segment.SegmentView;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps each capture agent to the segment query matching its deployment type.
 * <p><strong>Why:</strong> Agents on launch servers, hosts, VMs, and container hosts see different slices of the
 * topology; dedicated collectors pick up gateway interfaces and everything left unclaimed.</p>
 * <p><strong>Role:</strong> Per-agent configuration handler used by the refresh driver.</p>
 * <p><strong>Thread-safety:</strong> Stateless; the supplied {@link SegmentCycle} carries the cycle state.</p>
 *
 * @since 0.1.0
 */
public final class AgentSegmentResolver {
  private static final Logger log = LoggerFactory.getLogger(AgentSegmentResolver.class);

  /**
   * Returns the local segments for one agent, claiming the returned interfaces.
   *
   * @param cycle open cycle; must not be {@code null}
   * @param agent agent to resolve; must not be {@code null}
   * @return local segments; empty for dedicated collectors
   */
  public List<SegmentView> localSegments(SegmentCycle cycle, AgentDescriptor agent) {
    Objects.requireNonNull(cycle, "cycle");
    Objects.requireNonNull(agent, "agent");
    return switch (agent.type()) {
      case KVM, HYPER_V -> cycle.byLaunchServer(agent.launchServer());
      case ESXI -> cycle.byVmTypeCombined(agent.launchServer(), agent.hostId());
      case HOST -> cycle.byHostId(agent.hostId());
      case WORKLOAD_V -> cycle.byVmId(agent.vmId());
      case POD_HOST, POD_VM -> cycle.byPodNodeId(agent.podNodeId());
      case DEDICATED -> List.of();
    };
  }

  /**
   * Resolves every agent within {@code cycle} and finishes it.
   *
   * <p>Non-dedicated agents are resolved first so that every claim is recorded before the not-yet-claimed
   * segment is computed; dedicated collectors then receive the gateway segments followed by it. The result
   * keeps the order of {@code agents}.</p>
   *
   * @param cycle open cycle; finished by this call
   * @param agents agents to resolve; must not be {@code null}
   * @return per-agent segments plus the catch-all segment of the cycle
   */
  public Resolution resolveAll(SegmentCycle cycle, List<AgentDescriptor> agents) {
    Objects.requireNonNull(cycle, "cycle");
    Objects.requireNonNull(agents, "agents");
    Map<String, AgentSegments> resolved = new LinkedHashMap<>();
    for (AgentDescriptor agent : agents) {
      resolved.put(agent.name(), null);
    }
    for (AgentDescriptor agent : agents) {
      if (!agent.resolvesLast()) {
        resolved.put(agent.name(), new AgentSegments(agent.name(), localSegments(cycle, agent), List.of()));
      }
    }
    List<SegmentView> notYetClaimed = cycle.finish();
    for (AgentDescriptor agent : agents) {
      if (agent.resolvesLast()) {
        List<SegmentView> remote = new ArrayList<>(cycle.allGatewaySegments());
        remote.addAll(notYetClaimed);
        resolved.put(agent.name(), new AgentSegments(agent.name(), List.of(), remote));
      }
    }
    if (resolved.size() != agents.size()) {
      log.warn("Duplicate agent names collapsed: {} agents resolved into {} plans", agents.size(), resolved.size());
    }
    return new Resolution(new ArrayList<>(resolved.values()), notYetClaimed);
  }

  /**
   * Outcome of {@link #resolveAll(SegmentCycle, List)}.
   *
   * @param agents per-agent segments
   * @param notYetClaimed catch-all segments of the cycle
   */
  public record Resolution(List<AgentSegments> agents, List<SegmentView> notYetClaimed) {
    public Resolution {
      agents = List.copyOf(agents);
      notYetClaimed = List.copyOf(notYetClaimed);
    }
  }
}
