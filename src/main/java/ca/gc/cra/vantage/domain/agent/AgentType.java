package ca.gc.cra.vantage.domain.agent;

import java.util.Locale;

/**
 * <strong>What:</strong> Deployment flavours of a capture agent.
 * <p><strong>Why:</strong> The agent type decides which entity dimension its local segments come from.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum AgentType {
  /** Runs on a KVM launch server; sees every VM the server launches. */
  KVM,
  /** Runs on a Hyper-V launch server; resolved like {@link #KVM}. */
  HYPER_V,
  /** Runs in VM mode on an ESXi host; sees the launch server and host interfaces as one segment. */
  ESXI,
  /** Runs on a physical or gateway-less host. */
  HOST,
  /** Runs inside a workload VM, including the pod nodes and pods that VM hosts. */
  WORKLOAD_V,
  /** Runs on a bare-metal container host. */
  POD_HOST,
  /** Runs on a container host that is itself a VM. */
  POD_VM,
  /** Dedicated collector; receives gateway and unclaimed interfaces as remote segments. */
  DEDICATED;

  /**
   * Parses a textual agent type, accepting dashes and any case.
   *
   * @param value textual representation such as {@code "kvm"} or {@code "workload-v"}
   * @return parsed type
   * @throws IllegalArgumentException if the value is blank or unknown
   */
  public static AgentType fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("agent type must not be blank");
    }
    String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return AgentType.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown agent type: " + value, ex);
    }
  }
}
