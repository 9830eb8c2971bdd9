/**
 * Segment building blocks: per-network MAC groupings, per-entity indices, interface closures, and the
 * claimed-interface set used for catch-all accounting.
 * <p><strong>Role:</strong> Domain structures assembled by {@code ca.gc.cra.vantage.application.segment}.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.vantage.domain.segment.SegmentView} and
 * {@link ca.gc.cra.vantage.domain.segment.MacId} are immutable. The index and set types are mutable while being
 * built and must be confined to one thread or guarded by their owner.</p>
 * <p><strong>Metrics:</strong> Claimed/unclaimed cardinalities surface as {@code segment.claimed.size} and
 * {@code segment.unclaimed.size}.</p>
 */
package ca.gc.cra.vantage.domain.segment;
