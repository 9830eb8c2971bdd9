package ca.gc.cra.vantage.application.segment;

import ca.gc.cra.vantage.application.port.MetricsPort;
import ca.gc.cra.vantage.domain.segment.EntitySegments;
import ca.gc.cra.vantage.domain.segment.InterfaceIdSet;
import ca.gc.cra.vantage.domain.segment.SegmentView;
import ca.gc.cra.vantage.domain.topology.TopologySnapshot;
import ca.gc.cra.vantage.domain.topology.VInterface;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves, for any agent-facing entity, the interfaces that entity should treat as
 * local, and tracks which interfaces some entity has already claimed so a catch-all segment can be produced
 * for the rest.
 * <p><strong>Why:</strong> Capture agents only inspect traffic of interfaces assigned to them; every interface
 * not assigned to any agent during a cycle is handed to dedicated collectors instead.</p>
 * <p><strong>Role:</strong> Application service owned by the refresh driver and queried by per-agent
 * configuration handlers.</p>
 * <p><strong>Lifecycle per cycle:</strong>
 * <ol>
 *   <li>{@link #rebuild(TopologySnapshot)} publishes new indices.</li>
 *   <li>{@link #clearClaimed()} resets the claimed-interface set.</li>
 *   <li>Entity queries ({@link #byLaunchServer}, {@link #byHostId}, {@link #byVmId}, {@link #byPodNodeId},
 *   {@link #byVmTypeCombined}) return segments and claim every interface they return.</li>
 *   <li>{@link #notYetClaimedSegments()} collects every device interface nobody claimed.</li>
 * </ol>
 * {@link #beginCycle()} wraps steps 2 to 4 in a {@link SegmentCycle} that enforces the order.</p>
 * <p><strong>Thread-safety:</strong> Rebuilds swap an immutable {@link SegmentIndex} through a volatile field.
 * Claimed-set reads and writes run under one lock, so concurrent queries are safe; the caller still has to
 * finish all queries of a cycle before asking for the not-yet-claimed segment.</p>
 * <p><strong>Observability:</strong> Emits {@code segment.rebuild.*}, {@code segment.query.*},
 * {@code segment.claimed.size}, and {@code segment.unclaimed.size}.</p>
 *
 * @since 0.1.0
 */
public final class SegmentEngine {
  private static final Logger log = LoggerFactory.getLogger(SegmentEngine.class);

  private final MetricsPort metrics;
  private final TopologyClosureBuilder closureBuilder;
  private final ReentrantLock claimLock = new ReentrantLock();
  private final InterfaceIdSet claimed = new InterfaceIdSet();
  private final AtomicLong cycleGeneration = new AtomicLong();

  private volatile SegmentIndex index;
  // guarded by claimLock
  private List<SegmentView> notYetClaimed = List.of();
  private CycleState state = CycleState.EMPTY;
  private boolean staleClaims;

  /** Creates an engine that discards metrics. */
  public SegmentEngine() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates an engine reporting to {@code metrics}.
   *
   * @param metrics metrics sink; must not be {@code null}
   */
  public SegmentEngine(MetricsPort metrics) {
    this(metrics, new TopologyClosureBuilder());
  }

  SegmentEngine(MetricsPort metrics, TopologyClosureBuilder closureBuilder) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.closureBuilder = Objects.requireNonNull(closureBuilder, "closureBuilder");
  }

  /**
   * Rebuilds every index from {@code snapshot} and publishes them atomically.
   *
   * <p>The claimed-interface set is left untouched; call {@link #clearClaimed()} (or {@link #beginCycle()})
   * before the next query pass.</p>
   *
   * @param snapshot topology for the new cycle; must not be {@code null}
   */
  public void rebuild(TopologySnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    long start = System.nanoTime();
    SegmentIndex built = SegmentIndex.build(snapshot, closureBuilder);
    claimLock.lock();
    try {
      index = built;
      staleClaims = !claimed.isEmpty();
      state = CycleState.BUILT;
    } finally {
      claimLock.unlock();
    }
    metrics.increment("segment.rebuild.count");
    metrics.observe("segment.rebuild.latencyNanos", System.nanoTime() - start);
    log.info(
        "Segment index rebuilt: launchServers={} hosts={} gatewayHosts={} vms={} podNodes={}",
        built.launchServers().size(),
        built.hosts().size(),
        built.gatewayHosts().size(),
        built.vms().size(),
        built.podNodes().size());
  }

  /**
   * Returns one segment per network visible to the launch server, claiming every returned interface.
   *
   * @param launchServer launch server name
   * @return segments keyed by network id; empty when the server is unknown or nothing is built yet
   */
  public List<SegmentView> byLaunchServer(String launchServer) {
    SegmentIndex current = requireIndex("byLaunchServer");
    if (current == null || launchServer == null) {
      return List.of();
    }
    return resolve(current.launchServers(), launchServer);
  }

  /**
   * Returns one segment per network attached to the host, claiming every returned interface.
   *
   * @param hostId host identifier
   * @return segments keyed by network id; empty when the host is unknown or nothing is built yet
   */
  public List<SegmentView> byHostId(int hostId) {
    SegmentIndex current = requireIndex("byHostId");
    return current == null ? List.of() : resolve(current.hosts(), hostId);
  }

  /**
   * Returns one segment per network visible to the VM, including the pod nodes and pods it hosts, claiming
   * every returned interface.
   *
   * @param vmId VM identifier
   * @return segments keyed by network id; empty when the VM is unknown or nothing is built yet
   */
  public List<SegmentView> byVmId(int vmId) {
    SegmentIndex current = requireIndex("byVmId");
    return current == null ? List.of() : resolve(current.vms(), vmId);
  }

  /**
   * Returns one segment per network visible to the pod node, including its pods, claiming every returned
   * interface.
   *
   * @param podNodeId pod-node identifier
   * @return segments keyed by network id; empty when the pod node is unknown or nothing is built yet
   */
  public List<SegmentView> byPodNodeId(int podNodeId) {
    SegmentIndex current = requireIndex("byPodNodeId");
    return current == null ? List.of() : resolve(current.podNodes(), podNodeId);
  }

  /**
   * Merges the launch-server and host entries into a single segment with the fixed id, claiming every
   * returned interface. Used for agents running in VM mode.
   *
   * <p>Once an index is built the result always holds exactly one segment, possibly with no interfaces.</p>
   *
   * @param launchServer launch server name; {@code null} is treated as unknown
   * @param hostId host identifier
   * @return single flattened segment, or an empty list when nothing is built yet
   */
  public List<SegmentView> byVmTypeCombined(String launchServer, int hostId) {
    SegmentIndex current = requireIndex("byVmTypeCombined");
    if (current == null) {
      return List.of();
    }
    List<String> macs = new ArrayList<>();
    List<Integer> ids = new ArrayList<>();
    claimLock.lock();
    try {
      if (launchServer != null) {
        current.launchServers().appendTo(launchServer, macs, ids, claimed);
      }
      current.hosts().appendTo(hostId, macs, ids, claimed);
      markQueried();
    } finally {
      claimLock.unlock();
    }
    metrics.increment("segment.query.count");
    return List.of(SegmentView.flattened(macs, ids));
  }

  /**
   * Returns every gateway-host interface flattened into fixed-id segments. Gateway interfaces take no part in
   * claimed-interface accounting; this call never changes the claimed set.
   *
   * @return gateway segments built during the last rebuild; empty before the first build
   */
  public List<SegmentView> allGatewaySegments() {
    SegmentIndex current = index;
    return current == null ? List.of() : current.allGatewaySegments();
  }

  /**
   * Computes the catch-all segment over the device interfaces of the last rebuilt snapshot.
   *
   * @return one fixed-id segment holding every unclaimed interface, or an empty list when all are claimed
   * @see #notYetClaimedSegments(TopologySnapshot)
   */
  public List<SegmentView> notYetClaimedSegments() {
    SegmentIndex current = requireIndex("notYetClaimedSegments");
    if (current == null) {
      return List.of();
    }
    return notYetClaimedSegments(current.snapshot());
  }

  /**
   * Collects every device interface of {@code snapshot} whose id was not claimed during the cycle into one
   * segment with the fixed id, and caches the result. Interfaces without a MAC are never returned.
   *
   * <p>Call after the cycle's entity queries have completed. Calling it before any query is legal and yields
   * the whole interface universe.</p>
   *
   * @param snapshot snapshot whose device interfaces form the universe; must not be {@code null}
   * @return one segment, or an empty list when every interface is claimed
   */
  public List<SegmentView> notYetClaimedSegments(TopologySnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    List<String> macs = new ArrayList<>();
    List<Integer> ids = new ArrayList<>();
    int claimedCount;
    claimLock.lock();
    try {
      if (staleClaims) {
        log.warn("Computing unclaimed segments with claims carried over from a previous cycle;"
            + " clearClaimed() was not called after rebuild");
      }
      for (VInterface vif : snapshot.deviceVInterfaces()) {
        if (vif.hasMac() && !claimed.contains(vif.id())) {
          macs.add(vif.mac());
          ids.add(vif.id());
        }
      }
      claimedCount = claimed.size();
      notYetClaimed = macs.isEmpty() ? List.of() : List.of(SegmentView.flattened(macs, ids));
      if (state != CycleState.EMPTY) {
        state = CycleState.FINALIZED;
      }
    } finally {
      claimLock.unlock();
    }
    metrics.observe("segment.claimed.size", claimedCount);
    metrics.observe("segment.unclaimed.size", ids.size());
    log.info("agent vinterfaces claimed: {} unclaimed: {}", claimedCount, ids.size());
    return notYetClaimed;
  }

  /**
   * Returns the result of the last not-yet-claimed computation without recomputing it.
   *
   * @return cached catch-all segments; empty before the first computation
   */
  public List<SegmentView> cachedNotYetClaimedSegments() {
    claimLock.lock();
    try {
      return notYetClaimed;
    } finally {
      claimLock.unlock();
    }
  }

  /** Empties the claimed-interface set; call once before each cycle's query pass. */
  public void clearClaimed() {
    claimLock.lock();
    try {
      claimed.clear();
      staleClaims = false;
      if (state != CycleState.EMPTY) {
        state = CycleState.BUILT;
      }
    } finally {
      claimLock.unlock();
    }
  }

  /**
   * Clears the claimed set and returns a handle that enforces query-then-finish ordering for the cycle. Any
   * handle returned by an earlier call becomes stale and rejects further queries.
   *
   * @return new cycle handle bound to this engine
   */
  public SegmentCycle beginCycle() {
    if (index == null) {
      log.warn("Segment cycle started before the first rebuild; queries will return empty results");
    }
    long generation = cycleGeneration.incrementAndGet();
    clearClaimed();
    return new SegmentCycle(this, generation);
  }

  boolean isCurrentCycle(long generation) {
    return cycleGeneration.get() == generation;
  }

  /** @return current lifecycle state */
  public CycleState state() {
    claimLock.lock();
    try {
      return state;
    } finally {
      claimLock.unlock();
    }
  }

  /** @return {@code true} once the first rebuild has been published */
  public boolean isReady() {
    return index != null;
  }

  /**
   * Returns a copy of the interface ids claimed so far in the cycle.
   *
   * @return independent copy of the claimed set
   */
  public InterfaceIdSet claimedInterfaceIds() {
    claimLock.lock();
    try {
      return claimed.copy();
    } finally {
      claimLock.unlock();
    }
  }

  private <K> List<SegmentView> resolve(EntitySegments<K> entities, K key) {
    List<SegmentView> segments;
    claimLock.lock();
    try {
      segments = entities.resolve(key, claimed);
      markQueried();
    } finally {
      claimLock.unlock();
    }
    metrics.increment("segment.query.count");
    return segments;
  }

  private void markQueried() {
    if (state == CycleState.BUILT || state == CycleState.FINALIZED) {
      state = CycleState.QUERIED;
    }
  }

  private SegmentIndex requireIndex(String operation) {
    SegmentIndex current = index;
    if (current == null) {
      log.warn("{} called before the first segment rebuild; returning no segments", operation);
      metrics.increment("segment.query.beforeBuild");
    }
    return current;
  }
}
