/**
 * Ports between the segment application layer and its adapters.
 * <p><strong>Role:</strong> Input ports ({@link ca.gc.cra.vantage.application.port.TopologySource},
 * {@link ca.gc.cra.vantage.application.port.AgentRegistry}) and output ports
 * ({@link ca.gc.cra.vantage.application.port.SegmentPlanSink},
 * {@link ca.gc.cra.vantage.application.port.MetricsPort}).</p>
 * <p><strong>Concurrency:</strong> Implementations document their own guarantees; the refresh use case calls
 * them from a single thread.</p>
 */
package ca.gc.cra.vantage.application.port;
