package ca.gc.cra.vantage.application.segment;

import ca.gc.cra.vantage.domain.segment.EntitySegments;
import ca.gc.cra.vantage.domain.segment.NetworkMacs;
import ca.gc.cra.vantage.domain.segment.SegmentView;
import ca.gc.cra.vantage.domain.segment.VInterfaceSets;
import ca.gc.cra.vantage.domain.topology.TopologySnapshot;
import ca.gc.cra.vantage.domain.topology.VInterface;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> The five entity indices and flattened gateway segments derived from one snapshot.
 * <p><strong>Why:</strong> Grouping everything a rebuild produces into one object lets the engine publish it
 * with a single reference swap, so readers never see a mix of old and new indices.</p>
 * <p><strong>Role:</strong> Immutable after {@link #build(TopologySnapshot, TopologyClosureBuilder)} returns.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent reads once published.</p>
 *
 * @since 0.1.0
 */
public final class SegmentIndex {
  private final TopologySnapshot snapshot;
  private final EntitySegments<String> launchServers;
  private final EntitySegments<Integer> hosts;
  private final EntitySegments<Integer> gatewayHosts;
  private final EntitySegments<Integer> vms;
  private final EntitySegments<Integer> podNodes;
  private final List<SegmentView> allGatewaySegments;

  private SegmentIndex(
      TopologySnapshot snapshot,
      EntitySegments<String> launchServers,
      EntitySegments<Integer> hosts,
      EntitySegments<Integer> gatewayHosts,
      EntitySegments<Integer> vms,
      EntitySegments<Integer> podNodes) {
    this.snapshot = snapshot;
    this.launchServers = launchServers;
    this.hosts = hosts;
    this.gatewayHosts = gatewayHosts;
    this.vms = vms;
    this.podNodes = podNodes;
    this.allGatewaySegments = List.copyOf(gatewayHosts.flattenAll());
  }

  /**
   * Builds every index from {@code snapshot}.
   *
   * @param snapshot topology for the cycle; must not be {@code null}
   * @param closureBuilder computes the pod-node and VM closures; must not be {@code null}
   * @return fully populated index
   */
  public static SegmentIndex build(TopologySnapshot snapshot, TopologyClosureBuilder closureBuilder) {
    Objects.requireNonNull(snapshot, "snapshot");
    TopologyClosure closure = Objects.requireNonNull(closureBuilder, "closureBuilder").build(snapshot);
    VInterfaceSets vmClosure = closure.vmPodNodeAllVInterfaces();

    EntitySegments<String> launchServers = new EntitySegments<>();
    for (Map.Entry<String, Set<Integer>> entry : snapshot.launchServerVmIds().entrySet()) {
      NetworkMacs macs = new NetworkMacs();
      for (Integer vmId : entry.getValue()) {
        Set<VInterface> vmVifs = snapshot.vmVInterfaces().get(vmId);
        if (vmVifs != null) {
          macs.addAll(vmVifs);
        }
        macs.addAll(vmClosure.get(vmId));
      }
      launchServers.put(entry.getKey(), macs);
    }

    EntitySegments<Integer> hosts = direct(snapshot.hostVInterfaces());
    EntitySegments<Integer> gatewayHosts = direct(snapshot.gatewayHostVInterfaces());

    // A VM without interfaces of its own is still indexed when it hosts a pod node.
    Set<Integer> vmIds = new LinkedHashSet<>(snapshot.vmVInterfaces().keySet());
    vmIds.addAll(vmClosure.ownerIds());
    EntitySegments<Integer> vms = new EntitySegments<>();
    for (Integer vmId : vmIds) {
      NetworkMacs macs = new NetworkMacs();
      Set<VInterface> own = snapshot.vmVInterfaces().get(vmId);
      if (own != null) {
        macs.addAll(own);
      }
      macs.addAll(vmClosure.get(vmId));
      vms.put(vmId, macs);
    }

    EntitySegments<Integer> podNodes = new EntitySegments<>();
    VInterfaceSets podNodeClosure = closure.podNodeAllVInterfaces();
    for (Integer podNodeId : podNodeClosure.ownerIds()) {
      NetworkMacs macs = new NetworkMacs();
      macs.addAll(podNodeClosure.get(podNodeId));
      podNodes.put(podNodeId, macs);
    }

    return new SegmentIndex(snapshot, launchServers, hosts, gatewayHosts, vms, podNodes);
  }

  private static EntitySegments<Integer> direct(Map<Integer, Set<VInterface>> source) {
    EntitySegments<Integer> index = new EntitySegments<>();
    for (Map.Entry<Integer, Set<VInterface>> entry : source.entrySet()) {
      NetworkMacs macs = new NetworkMacs();
      macs.addAll(entry.getValue());
      index.put(entry.getKey(), macs);
    }
    return index;
  }

  /** @return snapshot the index was built from */
  public TopologySnapshot snapshot() {
    return snapshot;
  }

  /** @return launch-server index (VM interfaces plus pod-node closure of every hosted VM) */
  EntitySegments<String> launchServers() {
    return launchServers;
  }

  /** @return host index (direct interfaces only) */
  EntitySegments<Integer> hosts() {
    return hosts;
  }

  /** @return gateway-host index (direct interfaces only) */
  EntitySegments<Integer> gatewayHosts() {
    return gatewayHosts;
  }

  /** @return VM index (own interfaces plus pod-node closure) */
  EntitySegments<Integer> vms() {
    return vms;
  }

  /** @return pod-node index (own interfaces plus hosted pods) */
  EntitySegments<Integer> podNodes() {
    return podNodes;
  }

  /**
   * Returns gateway interfaces flattened to one segment per (gateway host, network), each with the fixed id.
   *
   * @return immutable gateway segments
   */
  public List<SegmentView> allGatewaySegments() {
    return allGatewaySegments;
  }
}
