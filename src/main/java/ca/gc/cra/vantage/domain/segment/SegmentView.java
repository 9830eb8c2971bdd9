package ca.gc.cra.vantage.domain.segment;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> One segment pushed to a capture agent: an id plus parallel MAC and interface-id lists.
 * <p><strong>Why:</strong> Mirrors the agent-facing segment message ({@code id}, {@code mac}, {@code interface_id}).</p>
 * <p><strong>Role:</strong> Output value of every segment engine query.</p>
 * <p><strong>Thread-safety:</strong> Immutable; lists are defensively copied.</p>
 *
 * <p>Entity-scoped queries key segments by network id. Combined, gateway, and catch-all segments use the
 * fixed id {@link #FLATTENED_ID} no matter how many networks they merge.</p>
 *
 * @param id network id, or {@link #FLATTENED_ID} for flattened segments
 * @param macs MAC addresses, positionally aligned with {@code interfaceIds}
 * @param interfaceIds interface identifiers
 * @since 0.1.0
 */
public record SegmentView(int id, List<String> macs, List<Integer> interfaceIds) {
  /** Placeholder id carried by segments that merge several networks. */
  public static final int FLATTENED_ID = 1;

  /**
   * Validates and copies the segment contents.
   *
   * @throws NullPointerException if either list is {@code null}
   * @throws IllegalArgumentException if the lists differ in length
   */
  public SegmentView {
    macs = List.copyOf(Objects.requireNonNull(macs, "macs"));
    interfaceIds = List.copyOf(Objects.requireNonNull(interfaceIds, "interfaceIds"));
    if (macs.size() != interfaceIds.size()) {
      throw new IllegalArgumentException(
          "macs and interfaceIds must align (" + macs.size() + " != " + interfaceIds.size() + ")");
    }
  }

  /**
   * Creates a segment carrying the fixed {@link #FLATTENED_ID}.
   *
   * @param macs MAC addresses
   * @param interfaceIds interface identifiers
   * @return flattened segment
   */
  public static SegmentView flattened(List<String> macs, List<Integer> interfaceIds) {
    return new SegmentView(FLATTENED_ID, macs, interfaceIds);
  }

  /**
   * Returns the number of interfaces in the segment.
   *
   * @return interface count
   */
  public int size() {
    return interfaceIds.size();
  }
}
