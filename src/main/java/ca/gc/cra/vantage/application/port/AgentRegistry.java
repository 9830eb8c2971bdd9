package ca.gc.cra.vantage.application.port;

import ca.gc.cra.vantage.domain.agent.AgentDescriptor;
import java.io.IOException;
import java.util.List;

/**
 * Port listing the capture agents that receive segment configuration.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AgentRegistry {
  /**
   * Returns the currently registered agents.
   *
   * @return agents in registry order; never {@code null}
   * @throws IOException if the registry cannot be read
   */
  List<AgentDescriptor> agents() throws IOException;
}
