package ca.gc.cra.vantage.domain.topology;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable virtual network interface attached to a device.
 * <p><strong>Why:</strong> Atomic unit of segment computation; every segment lists interface MACs and ids.</p>
 * <p><strong>Role:</strong> Domain value object shared by reference between the snapshot and every index.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @param id numeric interface identifier; non-negative
 * @param mac MAC address text; empty when the interface has no known MAC
 * @param networkId identifier of the network the interface belongs to
 * @since 0.1.0
 */
public record VInterface(int id, String mac, int networkId) {

  /**
   * Validates the interface fields.
   *
   * @throws NullPointerException if {@code mac} is {@code null}
   * @throws IllegalArgumentException if {@code id} is negative
   */
  public VInterface {
    Objects.requireNonNull(mac, "mac");
    if (id < 0) {
      throw new IllegalArgumentException("id must be non-negative (was " + id + ")");
    }
  }

  /**
   * Indicates whether the interface carries a MAC address.
   *
   * @return {@code true} when the MAC is non-empty; interfaces without one are never indexed
   */
  public boolean hasMac() {
    return !mac.isEmpty();
  }
}
