package ca.gc.cra.vantage.domain.segment;

import ca.gc.cra.vantage.domain.topology.VInterface;
import java.util.Objects;

/**
 * MAC address and interface id pair stored inside {@link NetworkMacs}.
 *
 * @param mac MAC address text
 * @param id interface identifier
 * @since 0.1.0
 */
public record MacId(String mac, int id) {
  public MacId {
    Objects.requireNonNull(mac, "mac");
  }

  static MacId of(VInterface vif) {
    return new MacId(vif.mac(), vif.id());
  }
}
