/**
 * Core domain model for the vantage segment control plane: topology snapshots in, agent segments out.
 * <p><strong>Role:</strong> Domain layer aggregates describing interfaces, devices, and capture agents without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Domain sizes feed {@code segment.*} metrics emitted by the application layer.</p>
 */
package ca.gc.cra.vantage.domain;
