package ca.gc.cra.vantage.application.segment;

import ca.gc.cra.vantage.domain.segment.VInterfaceSets;
import ca.gc.cra.vantage.domain.topology.TopologySnapshot;
import ca.gc.cra.vantage.domain.topology.VInterface;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Propagates pod and pod-node interfaces up to the pod node and VM that host them.
 * <p><strong>Why:</strong> A VM's network presence includes every pod node running in it and every pod on those
 * pod nodes; agents scoped to the VM (or its launch server) must see those interfaces too.</p>
 * <p><strong>Role:</strong> First step of every segment index rebuild.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Linear in pod nodes, pods, and interfaces.</p>
 *
 * @since 0.1.0
 */
public final class TopologyClosureBuilder {
  private static final Logger log = LoggerFactory.getLogger(TopologyClosureBuilder.class);

  /**
   * Computes the pod-node and VM closures of {@code snapshot}.
   *
   * <p>Pod nodes without an owning VM contribute only at pod-node scope. A pod node's VM id counts as a VM even
   * when the snapshot lists no interfaces of its own for that VM.</p>
   *
   * @param snapshot topology to close over; must not be {@code null}
   * @return closure sets keyed by pod-node id and VM id
   */
  public TopologyClosure build(TopologySnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    VInterfaceSets podNodeAll = new VInterfaceSets();
    for (Integer podNodeId : snapshot.podNodes().keySet()) {
      Set<VInterface> own = snapshot.podNodeVInterfaces().get(podNodeId);
      if (own != null) {
        podNodeAll.union(podNodeId, own);
      }
      Set<Integer> podIds = snapshot.podNodePodIds().get(podNodeId);
      if (podIds == null) {
        continue;
      }
      for (Integer podId : podIds) {
        Set<VInterface> podVifs = snapshot.podVInterfaces().get(podId);
        if (podVifs != null) {
          podNodeAll.union(podNodeId, podVifs);
        }
      }
    }

    VInterfaceSets vmPodNodeAll = new VInterfaceSets();
    for (Map.Entry<Integer, Integer> entry : snapshot.podNodeVmIds().entrySet()) {
      int podNodeId = entry.getKey();
      if (!podNodeAll.contains(podNodeId)) {
        log.debug("Pod node {} in VM {} has no interfaces; skipping VM closure", podNodeId, entry.getValue());
        continue;
      }
      vmPodNodeAll.union(entry.getValue(), podNodeAll.get(podNodeId));
    }
    return new TopologyClosure(podNodeAll, vmPodNodeAll);
  }
}
