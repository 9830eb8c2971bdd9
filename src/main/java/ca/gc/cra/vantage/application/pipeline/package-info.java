/**
 * Use cases driving the segment engine through its refresh cycles.
 * <p><strong>Role:</strong> Wires topology, agent registry, and plan sink ports around a
 * {@link ca.gc.cra.vantage.application.segment.SegmentEngine}.</p>
 * <p><strong>Concurrency:</strong> Cycles are serialized on one scheduler thread.</p>
 * <p><strong>Metrics:</strong> {@code segment.refresh.cycle}, {@code segment.refresh.failure},
 * {@code segment.refresh.latencyNanos}.</p>
 */
package ca.gc.cra.vantage.application.pipeline;
