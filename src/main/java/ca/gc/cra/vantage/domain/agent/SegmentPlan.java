package ca.gc.cra.vantage.domain.agent;

import ca.gc.cra.vantage.domain.segment.SegmentView;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Outcome of one refresh cycle: the segments of every agent plus the catch-all segment.
 * <p><strong>Role:</strong> Handed to a {@code SegmentPlanSink} for delivery.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param cycle monotonically increasing cycle number, starting at 1
 * @param generatedAtMillis epoch milliseconds when the cycle finished
 * @param agents per-agent segments in registry order
 * @param notYetClaimed interfaces no entity-scoped query returned during the cycle (at most one segment)
 * @since 0.1.0
 */
public record SegmentPlan(
    long cycle, long generatedAtMillis, List<AgentSegments> agents, List<SegmentView> notYetClaimed) {
  public SegmentPlan {
    agents = List.copyOf(Objects.requireNonNull(agents, "agents"));
    notYetClaimed = List.copyOf(Objects.requireNonNull(notYetClaimed, "notYetClaimed"));
  }
}
