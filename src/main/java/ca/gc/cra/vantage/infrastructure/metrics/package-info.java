/**
 * Metrics adapters bridging {@link ca.gc.cra.vantage.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; adapters are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code segment.rebuild.*}, {@code segment.query.*},
 * {@code segment.claimed.*}, {@code segment.unclaimed.*}, and {@code segment.refresh.*} families.</p>
 * <p><strong>Security:</strong> Only counts and sizes are exported; MAC addresses never leave the process.</p>
 */
package ca.gc.cra.vantage.infrastructure.metrics;
