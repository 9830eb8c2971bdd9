package ca.gc.cra.vantage.domain.topology;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Read-only topology associations for one refresh cycle.
 * <p><strong>Why:</strong> The segment engine derives every per-entity segment from these relations: launch
 * servers to VMs, hosts/gateway hosts/VMs/pod nodes/pods to interfaces, pods to pod nodes, pod nodes to their
 * owning VM, plus the flat device-interface list used for the catch-all segment.</p>
 * <p><strong>Role:</strong> Domain input produced by a {@code TopologySource} adapter; rebuilt wholesale on
 * each refresh and never mutated afterwards.</p>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}; safe for concurrent reads.</p>
 * <p><strong>Performance:</strong> Lookups are hash based; iteration follows insertion order so downstream
 * segment lists are deterministic.</p>
 *
 * @since 0.1.0
 */
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "Accessors return unmodifiable views built once in the constructor.")
public final class TopologySnapshot {
  private static final TopologySnapshot EMPTY = builder().build();

  private final Map<String, Set<Integer>> launchServerVmIds;
  private final Map<Integer, Set<VInterface>> hostVInterfaces;
  private final Map<Integer, Set<VInterface>> gatewayHostVInterfaces;
  private final Map<Integer, Set<VInterface>> vmVInterfaces;
  private final Map<Integer, Set<VInterface>> podNodeVInterfaces;
  private final Map<Integer, Set<Integer>> podNodePodIds;
  private final Map<Integer, Set<VInterface>> podVInterfaces;
  private final Map<Integer, Integer> podNodeVmIds;
  private final Map<Integer, PodNode> podNodes;
  private final List<VInterface> deviceVInterfaces;

  private TopologySnapshot(Builder builder) {
    this.launchServerVmIds = freeze(builder.launchServerVmIds);
    this.hostVInterfaces = freeze(builder.hostVInterfaces);
    this.gatewayHostVInterfaces = freeze(builder.gatewayHostVInterfaces);
    this.vmVInterfaces = freeze(builder.vmVInterfaces);
    this.podNodeVInterfaces = freeze(builder.podNodeVInterfaces);
    this.podNodePodIds = freeze(builder.podNodePodIds);
    this.podVInterfaces = freeze(builder.podVInterfaces);
    this.podNodeVmIds = Collections.unmodifiableMap(new LinkedHashMap<>(builder.podNodeVmIds));
    this.podNodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.podNodes));
    this.deviceVInterfaces = List.copyOf(builder.deviceVInterfaces);
  }

  /**
   * Returns a snapshot without any devices.
   *
   * @return shared empty snapshot
   */
  public static TopologySnapshot empty() {
    return EMPTY;
  }

  /**
   * Creates a builder for assembling a snapshot.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** @return launch server name to the ids of the VMs it runs */
  public Map<String, Set<Integer>> launchServerVmIds() {
    return launchServerVmIds;
  }

  /** @return host id to its directly attached interfaces */
  public Map<Integer, Set<VInterface>> hostVInterfaces() {
    return hostVInterfaces;
  }

  /** @return gateway host id to its directly attached interfaces */
  public Map<Integer, Set<VInterface>> gatewayHostVInterfaces() {
    return gatewayHostVInterfaces;
  }

  /** @return VM id to its directly attached interfaces */
  public Map<Integer, Set<VInterface>> vmVInterfaces() {
    return vmVInterfaces;
  }

  /** @return pod-node id to its directly attached interfaces */
  public Map<Integer, Set<VInterface>> podNodeVInterfaces() {
    return podNodeVInterfaces;
  }

  /** @return pod-node id to the ids of the pods it hosts */
  public Map<Integer, Set<Integer>> podNodePodIds() {
    return podNodePodIds;
  }

  /** @return pod id to its interfaces */
  public Map<Integer, Set<VInterface>> podVInterfaces() {
    return podVInterfaces;
  }

  /** @return pod-node id to the id of the VM it runs in */
  public Map<Integer, Integer> podNodeVmIds() {
    return podNodeVmIds;
  }

  /** @return pod-node id to pod-node record */
  public Map<Integer, PodNode> podNodes() {
    return podNodes;
  }

  /**
   * Returns every device interface known to the platform, in snapshot order.
   *
   * @return immutable flat list used to compute the not-yet-claimed segment
   */
  public List<VInterface> deviceVInterfaces() {
    return deviceVInterfaces;
  }

  private static <K, V> Map<K, Set<V>> freeze(Map<K, Set<V>> source) {
    Map<K, Set<V>> copy = new LinkedHashMap<>();
    for (Map.Entry<K, Set<V>> entry : source.entrySet()) {
      copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
    }
    return Collections.unmodifiableMap(copy);
  }

  /**
   * Mutable assembler for {@link TopologySnapshot}.
   * <p>Not thread-safe; build on a single thread and publish the resulting snapshot.</p>
   */
  public static final class Builder {
    private final Map<String, Set<Integer>> launchServerVmIds = new LinkedHashMap<>();
    private final Map<Integer, Set<VInterface>> hostVInterfaces = new LinkedHashMap<>();
    private final Map<Integer, Set<VInterface>> gatewayHostVInterfaces = new LinkedHashMap<>();
    private final Map<Integer, Set<VInterface>> vmVInterfaces = new LinkedHashMap<>();
    private final Map<Integer, Set<VInterface>> podNodeVInterfaces = new LinkedHashMap<>();
    private final Map<Integer, Set<Integer>> podNodePodIds = new LinkedHashMap<>();
    private final Map<Integer, Set<VInterface>> podVInterfaces = new LinkedHashMap<>();
    private final Map<Integer, Integer> podNodeVmIds = new LinkedHashMap<>();
    private final Map<Integer, PodNode> podNodes = new LinkedHashMap<>();
    private final List<VInterface> deviceVInterfaces = new ArrayList<>();

    private Builder() {}

    /**
     * Appends an interface to the flat device-interface list.
     *
     * @param vif interface; must not be {@code null}
     * @return this builder
     */
    public Builder deviceVInterface(VInterface vif) {
      deviceVInterfaces.add(Objects.requireNonNull(vif, "vif"));
      return this;
    }

    /**
     * Records that {@code launchServer} runs VM {@code vmId}.
     *
     * @param launchServer launch server name; must not be blank
     * @param vmId VM identifier
     * @return this builder
     * @throws IllegalArgumentException if {@code launchServer} is blank
     */
    public Builder launchServerVm(String launchServer, int vmId) {
      Objects.requireNonNull(launchServer, "launchServer");
      if (launchServer.isBlank()) {
        throw new IllegalArgumentException("launchServer must not be blank");
      }
      launchServerVmIds.computeIfAbsent(launchServer, key -> new LinkedHashSet<>()).add(vmId);
      return this;
    }

    public Builder hostVInterface(int hostId, VInterface vif) {
      return attach(hostVInterfaces, hostId, vif);
    }

    public Builder gatewayHostVInterface(int gatewayHostId, VInterface vif) {
      return attach(gatewayHostVInterfaces, gatewayHostId, vif);
    }

    public Builder vmVInterface(int vmId, VInterface vif) {
      return attach(vmVInterfaces, vmId, vif);
    }

    public Builder podNodeVInterface(int podNodeId, VInterface vif) {
      return attach(podNodeVInterfaces, podNodeId, vif);
    }

    public Builder podVInterface(int podId, VInterface vif) {
      return attach(podVInterfaces, podId, vif);
    }

    /**
     * Registers a pod node.
     *
     * @param podNode pod-node record; must not be {@code null}
     * @return this builder
     */
    public Builder podNode(PodNode podNode) {
      Objects.requireNonNull(podNode, "podNode");
      podNodes.put(podNode.id(), podNode);
      return this;
    }

    /**
     * Records that pod {@code podId} runs on pod node {@code podNodeId}.
     *
     * @param podNodeId pod-node identifier
     * @param podId pod identifier
     * @return this builder
     */
    public Builder podNodePod(int podNodeId, int podId) {
      podNodePodIds.computeIfAbsent(podNodeId, key -> new LinkedHashSet<>()).add(podId);
      return this;
    }

    /**
     * Records the VM a pod node runs in; a later call for the same pod node replaces the earlier one.
     *
     * @param podNodeId pod-node identifier
     * @param vmId owning VM identifier
     * @return this builder
     */
    public Builder podNodeVm(int podNodeId, int vmId) {
      podNodeVmIds.put(podNodeId, vmId);
      return this;
    }

    /**
     * Freezes the accumulated relations into an immutable snapshot.
     *
     * @return snapshot; the builder may be reused afterwards without affecting it
     */
    public TopologySnapshot build() {
      return new TopologySnapshot(this);
    }

    private Builder attach(Map<Integer, Set<VInterface>> target, int ownerId, VInterface vif) {
      Objects.requireNonNull(vif, "vif");
      target.computeIfAbsent(ownerId, key -> new LinkedHashSet<>()).add(vif);
      return this;
    }
  }
}
