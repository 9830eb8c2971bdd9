/**
 * Topology primitives produced by the reconciliation engine: virtual interfaces, pod nodes, and the
 * per-refresh snapshot tying hosts, VMs, pod nodes, and pods to their interfaces.
 * <p><strong>Role:</strong> Read-only input of the segment engine.</p>
 * <p><strong>Concurrency:</strong> Snapshots are immutable once built; builders are not thread-safe.</p>
 */
package ca.gc.cra.vantage.domain.topology;
