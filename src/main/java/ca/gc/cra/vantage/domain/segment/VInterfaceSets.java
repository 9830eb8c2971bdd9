package ca.gc.cra.vantage.domain.segment;

import ca.gc.cra.vantage.domain.topology.VInterface;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Owner id (pod node or VM) to the set of interfaces reachable from it.
 * <p><strong>Why:</strong> Intermediate of the pod to pod-node to VM closure; several sources contribute to the
 * same owner, so merging must be a union, never a replacement.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; built and read on the rebuild thread.</p>
 *
 * @since 0.1.0
 */
public final class VInterfaceSets {
  private final Map<Integer, Set<VInterface>> byOwner = new LinkedHashMap<>();

  /**
   * Unions {@code vifs} into the set held for {@code ownerId}. The first contribution is copied so later changes
   * to the caller's set are not observed.
   *
   * @param ownerId pod-node or VM identifier
   * @param vifs interfaces to merge; must not be {@code null}
   */
  public void union(int ownerId, Set<VInterface> vifs) {
    Objects.requireNonNull(vifs, "vifs");
    byOwner.computeIfAbsent(ownerId, key -> new LinkedHashSet<>()).addAll(vifs);
  }

  /**
   * Returns the interfaces reachable from {@code ownerId}.
   *
   * @param ownerId pod-node or VM identifier
   * @return read-only set in insertion order; empty when the owner is unknown
   */
  public Set<VInterface> get(int ownerId) {
    Set<VInterface> vifs = byOwner.get(ownerId);
    return vifs == null ? Set.of() : Collections.unmodifiableSet(vifs);
  }

  public boolean contains(int ownerId) {
    return byOwner.containsKey(ownerId);
  }

  /** @return owner ids in insertion order */
  public Set<Integer> ownerIds() {
    return Collections.unmodifiableSet(byOwner.keySet());
  }

  public int size() {
    return byOwner.size();
  }
}
