package ca.gc.cra.vantage.domain.segment;

import ca.gc.cra.vantage.domain.topology.VInterface;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Interfaces visible to one entity, grouped by network id.
 * <p><strong>Why:</strong> Entity-scoped segments are emitted one per network; this is the grouping they are
 * read from.</p>
 * <p><strong>Thread-safety:</strong> Mutable while being filled; treat as read-only once handed to an
 * {@link EntitySegments} index.</p>
 *
 * <p>Interfaces without a MAC are skipped. Adding the same interface twice appends it twice; callers that
 * need set semantics union their inputs first.</p>
 *
 * @since 0.1.0
 */
public final class NetworkMacs {
  private final Map<Integer, List<MacId>> byNetwork = new LinkedHashMap<>();

  /**
   * Appends {@code vif} under its network id unless its MAC is empty.
   *
   * @param vif interface to index; must not be {@code null}
   */
  public void add(VInterface vif) {
    Objects.requireNonNull(vif, "vif");
    if (!vif.hasMac()) {
      return;
    }
    byNetwork.computeIfAbsent(vif.networkId(), key -> new ArrayList<>()).add(MacId.of(vif));
  }

  /**
   * Appends every interface of {@code vifs}.
   *
   * @param vifs interfaces to index; must not be {@code null}
   */
  public void addAll(Iterable<VInterface> vifs) {
    for (VInterface vif : Objects.requireNonNull(vifs, "vifs")) {
      add(vif);
    }
  }

  /**
   * Returns the entries recorded for a network.
   *
   * @param networkId network identifier
   * @return read-only entries in insertion order; empty when the network is unknown
   */
  public List<MacId> get(int networkId) {
    List<MacId> entries = byNetwork.get(networkId);
    return entries == null ? List.of() : Collections.unmodifiableList(entries);
  }

  /** @return network ids in insertion order */
  public Set<Integer> networkIds() {
    return Collections.unmodifiableSet(byNetwork.keySet());
  }

  /** @return {@code true} when no interface has been indexed */
  public boolean isEmpty() {
    return byNetwork.isEmpty();
  }

  /**
   * Counts indexed entries across all networks, duplicates included.
   *
   * @return total entry count
   */
  public int entryCount() {
    int total = 0;
    for (List<MacId> entries : byNetwork.values()) {
      total += entries.size();
    }
    return total;
  }
}
