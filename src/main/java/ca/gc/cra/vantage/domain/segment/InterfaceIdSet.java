package ca.gc.cra.vantage.domain.segment;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Set of interface ids with explicit union and copy operations.
 *
 * <p>Backs the claimed-interface accounting of a refresh cycle. Not thread-safe; the owning engine serializes
 * access.</p>
 *
 * @since 0.1.0
 */
public final class InterfaceIdSet {
  private final Set<Integer> ids;

  /** Creates an empty set. */
  public InterfaceIdSet() {
    this.ids = new HashSet<>();
  }

  private InterfaceIdSet(Set<Integer> ids) {
    this.ids = new HashSet<>(ids);
  }

  /**
   * Adds an interface id.
   *
   * @param id interface identifier
   * @return {@code true} when the id was not present before
   */
  public boolean add(int id) {
    return ids.add(id);
  }

  /**
   * Adds every id of {@code other}; ids already present stay untouched.
   *
   * @param other set to merge; must not be {@code null}
   */
  public void union(InterfaceIdSet other) {
    ids.addAll(other.ids);
  }

  public boolean contains(int id) {
    return ids.contains(id);
  }

  public int size() {
    return ids.size();
  }

  public boolean isEmpty() {
    return ids.isEmpty();
  }

  /** Removes every id. */
  public void clear() {
    ids.clear();
  }

  /**
   * Returns an independent copy.
   *
   * @return copy that does not observe later changes to this set
   */
  public InterfaceIdSet copy() {
    return new InterfaceIdSet(ids);
  }

  /** @return read-only view of the ids */
  public Set<Integer> asSet() {
    return Collections.unmodifiableSet(ids);
  }
}
