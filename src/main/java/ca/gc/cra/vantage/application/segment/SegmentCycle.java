package ca.gc.cra.vantage.application.segment;

import ca.gc.cra.vantage.domain.segment.SegmentView;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Handle for one query pass over a {@link SegmentEngine}.
 * <p><strong>Why:</strong> The catch-all segment is only correct once every claiming query of the cycle has run.
 * The handle refuses queries after {@link #finish()}, allows {@code finish()} exactly once, and goes stale once a
 * newer cycle begins on the same engine.</p>
 * <p><strong>Thread-safety:</strong> Queries may be issued concurrently; {@link #finish()} must happen after
 * all of them complete.</p>
 *
 * @since 0.1.0
 */
public final class SegmentCycle {
  private final SegmentEngine engine;
  private final long generation;
  private volatile boolean finished;
  private volatile List<SegmentView> notYetClaimed = List.of();

  SegmentCycle(SegmentEngine engine, long generation) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.generation = generation;
  }

  public List<SegmentView> byLaunchServer(String launchServer) {
    ensureOpen();
    return engine.byLaunchServer(launchServer);
  }

  public List<SegmentView> byHostId(int hostId) {
    ensureOpen();
    return engine.byHostId(hostId);
  }

  public List<SegmentView> byVmId(int vmId) {
    ensureOpen();
    return engine.byVmId(vmId);
  }

  public List<SegmentView> byPodNodeId(int podNodeId) {
    ensureOpen();
    return engine.byPodNodeId(podNodeId);
  }

  public List<SegmentView> byVmTypeCombined(String launchServer, int hostId) {
    ensureOpen();
    return engine.byVmTypeCombined(launchServer, hostId);
  }

  /**
   * Returns the gateway segments; allowed before and after {@link #finish()} since they claim nothing.
   *
   * @return flattened gateway segments
   */
  public List<SegmentView> allGatewaySegments() {
    return engine.allGatewaySegments();
  }

  /**
   * Closes the query pass and computes the not-yet-claimed segment.
   *
   * @return at most one fixed-id segment of unclaimed interfaces
   * @throws IllegalStateException if the cycle was already finished or a newer cycle has begun
   */
  public synchronized List<SegmentView> finish() {
    if (finished) {
      throw new IllegalStateException("segment cycle already finished");
    }
    ensureCurrent();
    notYetClaimed = engine.notYetClaimedSegments();
    finished = true;
    return notYetClaimed;
  }

  /**
   * Returns the not-yet-claimed segment computed by {@link #finish()}.
   *
   * @return catch-all segments
   * @throws IllegalStateException if the cycle is still open
   */
  public List<SegmentView> notYetClaimedSegments() {
    if (!finished) {
      throw new IllegalStateException("segment cycle not finished; unclaimed interfaces are not final yet");
    }
    return notYetClaimed;
  }

  public boolean isFinished() {
    return finished;
  }

  private void ensureOpen() {
    if (finished) {
      throw new IllegalStateException("segment cycle already finished; begin a new cycle to query");
    }
    ensureCurrent();
  }

  private void ensureCurrent() {
    if (!engine.isCurrentCycle(generation)) {
      throw new IllegalStateException("segment cycle " + generation + " superseded by a newer cycle");
    }
  }
}
