package ca.gc.cra.vantage.application.port;

import ca.gc.cra.vantage.domain.topology.TopologySnapshot;
import java.io.IOException;

/**
 * Port supplying the raw topology snapshot for a refresh cycle.
 *
 * <p>Each call returns a freshly assembled, immutable snapshot. Implementations may block on I/O.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TopologySource {
  /**
   * Loads the current topology.
   *
   * @return immutable snapshot; never {@code null}
   * @throws IOException if the backing store cannot be read
   */
  TopologySnapshot load() throws IOException;
}
