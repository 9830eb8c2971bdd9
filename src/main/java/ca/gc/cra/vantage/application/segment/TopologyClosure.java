package ca.gc.cra.vantage.application.segment;

import ca.gc.cra.vantage.domain.segment.VInterfaceSets;
import java.util.Objects;

/**
 * Interfaces reachable through the container hierarchy.
 *
 * @param podNodeAllVInterfaces pod-node id to its own interfaces plus those of every pod it hosts
 * @param vmPodNodeAllVInterfaces VM id to the union of {@code podNodeAllVInterfaces} of the pod nodes it runs
 * @since 0.1.0
 */
public record TopologyClosure(
    VInterfaceSets podNodeAllVInterfaces, VInterfaceSets vmPodNodeAllVInterfaces) {
  public TopologyClosure {
    Objects.requireNonNull(podNodeAllVInterfaces, "podNodeAllVInterfaces");
    Objects.requireNonNull(vmPodNodeAllVInterfaces, "vmPodNodeAllVInterfaces");
  }
}
