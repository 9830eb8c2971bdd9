package ca.gc.cra.vantage.application.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vantage.domain.segment.SegmentView;
import java.util.List;
import org.junit.jupiter.api.Test;

class SegmentCycleTest {

  @Test
  void finishComputesUnclaimedOnce() {
    SegmentEngine engine = new SegmentEngine();
    engine.rebuild(Topologies.scenario());
    SegmentCycle cycle = engine.beginCycle();

    cycle.byVmId(Topologies.VM_V1);
    List<SegmentView> unclaimed = cycle.finish();

    assertTrue(cycle.isFinished());
    assertEquals(List.of(new SegmentView(1, List.of("a1"), List.of(1))), unclaimed);
    assertEquals(unclaimed, cycle.notYetClaimedSegments());
    assertThrows(IllegalStateException.class, cycle::finish);
  }

  @Test
  void queriesAfterFinishAreRejected() {
    SegmentEngine engine = new SegmentEngine();
    engine.rebuild(Topologies.scenario());
    SegmentCycle cycle = engine.beginCycle();
    cycle.finish();

    assertThrows(IllegalStateException.class, () -> cycle.byHostId(Topologies.HOST_H1));
    assertThrows(IllegalStateException.class, () -> cycle.byVmTypeCombined(Topologies.LAUNCH_SERVER, 1));
    assertTrue(cycle.allGatewaySegments().isEmpty());
  }

  @Test
  void unclaimedIsUnavailableWhileOpen() {
    SegmentEngine engine = new SegmentEngine();
    engine.rebuild(Topologies.scenario());
    SegmentCycle cycle = engine.beginCycle();

    assertFalse(cycle.isFinished());
    assertThrows(IllegalStateException.class, cycle::notYetClaimedSegments);
  }

  @Test
  void beginCycleDropsPreviousClaims() {
    SegmentEngine engine = new SegmentEngine();
    engine.rebuild(Topologies.scenario());
    SegmentCycle first = engine.beginCycle();
    first.byHostId(Topologies.HOST_H1);
    first.byVmId(Topologies.VM_V1);
    assertTrue(first.finish().isEmpty());

    SegmentCycle second = engine.beginCycle();

    assertEquals(List.of(1, 2, 3, 4), second.finish().get(0).interfaceIds());
  }

  @Test
  void supersededCycleRejectsQueriesAndFinish() {
    SegmentEngine engine = new SegmentEngine();
    engine.rebuild(Topologies.scenario());
    SegmentCycle stale = engine.beginCycle();
    SegmentCycle current = engine.beginCycle();

    assertThrows(IllegalStateException.class, () -> stale.byVmId(Topologies.VM_V1));
    assertThrows(IllegalStateException.class, stale::finish);
    assertFalse(stale.isFinished());
    assertTrue(engine.claimedInterfaceIds().asSet().isEmpty());

    current.byHostId(Topologies.HOST_H1);
    assertEquals(List.of(2, 3, 4), current.finish().get(0).interfaceIds());
  }
}
