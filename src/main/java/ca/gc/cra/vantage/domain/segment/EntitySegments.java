package ca.gc.cra.vantage.domain.segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Index from an entity key (launch-server name, host, gateway-host, VM, or pod-node id) to
 * the interfaces visible to that entity.
 * <p><strong>Why:</strong> Each agent type looks up its segments along one entity dimension; one instance exists
 * per dimension.</p>
 * <p><strong>Role:</strong> Domain index populated during rebuild and read by segment queries.</p>
 * <p><strong>Thread-safety:</strong> Not synchronized. Populate on one thread, then publish; reads are safe
 * afterwards. Resolution mutates the caller-supplied {@link InterfaceIdSet}, which the caller must guard.</p>
 *
 * @param <K> entity key type
 * @since 0.1.0
 */
public final class EntitySegments<K> {
  private final Map<K, NetworkMacs> byEntity = new LinkedHashMap<>();

  /**
   * Stores the grouping for {@code key}, replacing any previous one.
   *
   * @param key entity key; must not be {@code null}
   * @param macs interfaces visible to the entity; must not be {@code null}
   */
  public void put(K key, NetworkMacs macs) {
    byEntity.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(macs, "macs"));
  }

  /**
   * Builds one segment per network visible to {@code key}, keyed by network id, and records every returned
   * interface in {@code claimed}.
   *
   * @param key entity key
   * @param claimed claimed-interface accumulator updated as a side effect; must not be {@code null}
   * @return segments in network insertion order; empty when the key is unknown
   */
  public List<SegmentView> resolve(K key, InterfaceIdSet claimed) {
    Objects.requireNonNull(claimed, "claimed");
    NetworkMacs macs = byEntity.get(key);
    if (macs == null) {
      return List.of();
    }
    List<SegmentView> segments = new ArrayList<>(macs.networkIds().size());
    for (Integer networkId : macs.networkIds()) {
      List<MacId> entries = macs.get(networkId);
      List<String> macList = new ArrayList<>(entries.size());
      List<Integer> ids = new ArrayList<>(entries.size());
      for (MacId entry : entries) {
        macList.add(entry.mac());
        ids.add(entry.id());
        claimed.add(entry.id());
      }
      segments.add(new SegmentView(networkId, macList, ids));
    }
    return segments;
  }

  /**
   * Appends every entry visible to {@code key}, across all networks, to the supplied lists.
   *
   * @param key entity key
   * @param macs receives MAC addresses
   * @param ids receives interface ids aligned with {@code macs}
   * @param claimed accumulator updated with every appended id, or {@code null} to leave claims untouched
   * @return number of appended entries; zero when the key is unknown
   */
  public int appendTo(K key, List<String> macs, List<Integer> ids, InterfaceIdSet claimed) {
    NetworkMacs networkMacs = byEntity.get(key);
    if (networkMacs == null) {
      return 0;
    }
    return append(networkMacs, macs, ids, claimed);
  }

  /**
   * Flattens every (entity, network) grouping into its own segment carrying {@link SegmentView#FLATTENED_ID}.
   * Claims are not recorded.
   *
   * @return flattened segments in index order
   */
  public List<SegmentView> flattenAll() {
    List<SegmentView> segments = new ArrayList<>();
    for (NetworkMacs networkMacs : byEntity.values()) {
      for (Integer networkId : networkMacs.networkIds()) {
        List<MacId> entries = networkMacs.get(networkId);
        List<String> macs = new ArrayList<>(entries.size());
        List<Integer> ids = new ArrayList<>(entries.size());
        for (MacId entry : entries) {
          macs.add(entry.mac());
          ids.add(entry.id());
        }
        segments.add(SegmentView.flattened(macs, ids));
      }
    }
    return segments;
  }

  /**
   * Returns the grouping stored for {@code key}.
   *
   * @param key entity key
   * @return grouping, or {@code null} when the key is unknown
   */
  public NetworkMacs get(K key) {
    return byEntity.get(key);
  }

  public boolean contains(K key) {
    return byEntity.containsKey(key);
  }

  /** @return entity keys in insertion order */
  public Set<K> keys() {
    return Collections.unmodifiableSet(byEntity.keySet());
  }

  public int size() {
    return byEntity.size();
  }

  private static int append(
      NetworkMacs networkMacs, List<String> macs, List<Integer> ids, InterfaceIdSet claimed) {
    int appended = 0;
    for (Integer networkId : networkMacs.networkIds()) {
      for (MacId entry : networkMacs.get(networkId)) {
        macs.add(entry.mac());
        ids.add(entry.id());
        if (claimed != null) {
          claimed.add(entry.id());
        }
        appended++;
      }
    }
    return appended;
  }
}
