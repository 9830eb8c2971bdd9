package ca.gc.cra.vantage.domain.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vantage.domain.topology.VInterface;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EntitySegmentsTest {
  private static EntitySegments<Integer> twoNetworks() {
    NetworkMacs macs = new NetworkMacs();
    macs.addAll(List.of(
        new VInterface(1, "a1", 10),
        new VInterface(2, "a2", 20),
        new VInterface(3, "a3", 10)));
    EntitySegments<Integer> segments = new EntitySegments<>();
    segments.put(5, macs);
    return segments;
  }

  @Test
  void resolveReturnsOneSegmentPerNetworkAndClaims() {
    InterfaceIdSet claimed = new InterfaceIdSet();

    List<SegmentView> views = twoNetworks().resolve(5, claimed);

    assertEquals(List.of(
        new SegmentView(10, List.of("a1", "a3"), List.of(1, 3)),
        new SegmentView(20, List.of("a2"), List.of(2))), views);
    assertEquals(3, claimed.size());
  }

  @Test
  void resolveUnknownKeyIsEmptyAndClaimsNothing() {
    InterfaceIdSet claimed = new InterfaceIdSet();

    assertTrue(twoNetworks().resolve(99, claimed).isEmpty());
    assertTrue(claimed.isEmpty());
  }

  @Test
  void appendToFlattensAcrossNetworks() {
    List<String> macs = new ArrayList<>();
    List<Integer> ids = new ArrayList<>();
    InterfaceIdSet claimed = new InterfaceIdSet();

    int appended = twoNetworks().appendTo(5, macs, ids, claimed);

    assertEquals(3, appended);
    assertEquals(List.of("a1", "a3", "a2"), macs);
    assertEquals(List.of(1, 3, 2), ids);
    assertTrue(claimed.contains(2));
  }

  @Test
  void appendToWithoutClaimSetLeavesNothingClaimed() {
    List<String> macs = new ArrayList<>();
    List<Integer> ids = new ArrayList<>();

    assertEquals(3, twoNetworks().appendTo(5, macs, ids, null));
    assertEquals(0, twoNetworks().appendTo(6, macs, ids, null));
  }

  @Test
  void flattenAllUsesFixedId() {
    List<SegmentView> views = twoNetworks().flattenAll();

    assertEquals(2, views.size());
    for (SegmentView view : views) {
      assertEquals(SegmentView.FLATTENED_ID, view.id());
    }
  }

  @Test
  void segmentViewRejectsMisalignedLists() {
    assertThrows(IllegalArgumentException.class, () -> new SegmentView(1, List.of("a"), List.of()));
    SegmentView view = SegmentView.flattened(List.of("a"), List.of(1));
    assertEquals(1, view.size());
    assertFalse(twoNetworks().contains(6));
  }
}
