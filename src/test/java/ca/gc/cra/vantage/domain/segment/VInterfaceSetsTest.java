package ca.gc.cra.vantage.domain.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vantage.domain.topology.VInterface;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class VInterfaceSetsTest {
  @Test
  void unionAccumulatesWithoutOverwriting() {
    VInterface a = new VInterface(1, "a1", 10);
    VInterface b = new VInterface(2, "a2", 10);
    VInterfaceSets sets = new VInterfaceSets();

    sets.union(7, Set.of(a));
    sets.union(7, Set.of(b, a));

    assertEquals(Set.of(a, b), sets.get(7));
    assertEquals(List.of(7), List.copyOf(sets.ownerIds()));
  }

  @Test
  void unknownOwnerIsEmpty() {
    VInterfaceSets sets = new VInterfaceSets();

    assertTrue(sets.get(3).isEmpty());
    assertFalse(sets.contains(3));
    assertEquals(0, sets.size());
  }

  @Test
  void interfaceIdSetCopyIsIndependent() {
    InterfaceIdSet ids = new InterfaceIdSet();
    ids.add(1);
    InterfaceIdSet copy = ids.copy();
    ids.add(2);

    assertEquals(Set.of(1), copy.asSet());
    copy.union(ids);
    assertEquals(Set.of(1, 2), copy.asSet());
  }
}
