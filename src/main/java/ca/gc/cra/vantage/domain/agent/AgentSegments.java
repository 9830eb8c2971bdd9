package ca.gc.cra.vantage.domain.agent;

import ca.gc.cra.vantage.domain.segment.SegmentView;
import java.util.List;
import java.util.Objects;

/**
 * Segments pushed to a single agent for the current cycle.
 *
 * @param agentName agent the plan belongs to
 * @param localSegments interfaces the agent treats as local
 * @param remoteSegments interfaces the agent captures on behalf of others (dedicated collectors only)
 * @since 0.1.0
 */
public record AgentSegments(
    String agentName, List<SegmentView> localSegments, List<SegmentView> remoteSegments) {
  public AgentSegments {
    Objects.requireNonNull(agentName, "agentName");
    localSegments = List.copyOf(Objects.requireNonNull(localSegments, "localSegments"));
    remoteSegments = List.copyOf(Objects.requireNonNull(remoteSegments, "remoteSegments"));
  }
}
