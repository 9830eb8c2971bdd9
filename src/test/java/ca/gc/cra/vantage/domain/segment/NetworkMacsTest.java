package ca.gc.cra.vantage.domain.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vantage.domain.topology.VInterface;
import java.util.List;
import org.junit.jupiter.api.Test;

class NetworkMacsTest {
  @Test
  void groupsByNetworkInFirstSeenOrder() {
    NetworkMacs macs = new NetworkMacs();
    macs.add(new VInterface(3, "a3", 20));
    macs.add(new VInterface(1, "a1", 10));
    macs.add(new VInterface(4, "a4", 20));

    assertEquals(List.of(20, 10), List.copyOf(macs.networkIds()));
    assertEquals(List.of(new MacId("a3", 3), new MacId("a4", 4)), macs.get(20));
    assertEquals(3, macs.entryCount());
  }

  @Test
  void skipsInterfacesWithoutMac() {
    NetworkMacs macs = new NetworkMacs();
    macs.add(new VInterface(1, "", 10));

    assertTrue(macs.isEmpty());
    assertTrue(macs.get(10).isEmpty());
  }

  @Test
  void appendsDuplicates() {
    NetworkMacs macs = new NetworkMacs();
    VInterface vif = new VInterface(1, "a1", 10);
    macs.addAll(List.of(vif, vif));

    assertEquals(2, macs.get(10).size());
  }
}
