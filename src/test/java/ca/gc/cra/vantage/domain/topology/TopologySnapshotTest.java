package ca.gc.cra.vantage.domain.topology;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TopologySnapshotTest {
  @Test
  void builderKeepsInsertionOrderAndDeduplicatesPerOwner() {
    VInterface a = new VInterface(1, "a1", 10);
    VInterface b = new VInterface(2, "a2", 10);

    TopologySnapshot snapshot = TopologySnapshot.builder()
        .deviceVInterface(b)
        .deviceVInterface(a)
        .hostVInterface(7, b)
        .hostVInterface(7, a)
        .hostVInterface(7, b)
        .launchServerVm("10.0.0.1", 3)
        .launchServerVm("10.0.0.1", 3)
        .build();

    assertEquals(List.of(b, a), snapshot.deviceVInterfaces());
    assertEquals(List.of(b, a), List.copyOf(snapshot.hostVInterfaces().get(7)));
    assertEquals(Set.of(3), snapshot.launchServerVmIds().get("10.0.0.1"));
  }

  @Test
  void snapshotIsIsolatedFromLaterBuilderChanges() {
    TopologySnapshot.Builder builder = TopologySnapshot.builder().vmVInterface(1, new VInterface(1, "a1", 10));
    TopologySnapshot first = builder.build();
    builder.vmVInterface(1, new VInterface(2, "a2", 10));

    assertEquals(1, first.vmVInterfaces().get(1).size());
    assertThrows(UnsupportedOperationException.class,
        () -> first.vmVInterfaces().get(1).add(new VInterface(3, "a3", 10)));
  }

  @Test
  void blankLaunchServerRejected() {
    assertThrows(IllegalArgumentException.class, () -> TopologySnapshot.builder().launchServerVm(" ", 1));
  }

  @Test
  void emptySnapshotHasNoDevices() {
    TopologySnapshot empty = TopologySnapshot.empty();
    assertTrue(empty.deviceVInterfaces().isEmpty());
    assertTrue(empty.podNodes().isEmpty());
  }

  @Test
  void interfaceRejectsNegativeIdAndNullMac() {
    assertThrows(IllegalArgumentException.class, () -> new VInterface(-1, "a", 1));
    assertThrows(NullPointerException.class, () -> new VInterface(1, null, 1));
    assertTrue(new VInterface(1, "a", 1).hasMac());
    assertEquals("", new PodNode(1, null).name());
  }
}
