package ca.gc.cra.vantage.domain.topology;

import java.util.Objects;

/**
 * Container host record. The owning VM relation lives in {@link TopologySnapshot}, not here.
 *
 * @param id pod-node identifier
 * @param name display name; may be empty
 * @since 0.1.0
 */
public record PodNode(int id, String name) {
  public PodNode {
    name = Objects.requireNonNullElse(name, "");
  }
}
