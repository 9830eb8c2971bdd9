/**
 * Network segment resolution: closure over the pod, pod-node, and VM relationships, the per-entity indices
 * built from a topology snapshot, and the engine answering per-agent segment queries with claimed-interface
 * accounting.
 * <p><strong>Lifecycle:</strong> rebuild, clear claims, entity queries, then the not-yet-claimed segment.
 * {@link ca.gc.cra.vantage.application.segment.SegmentCycle} makes that order explicit.</p>
 * <p><strong>Concurrency:</strong> Rebuilds publish an immutable
 * {@link ca.gc.cra.vantage.application.segment.SegmentIndex} atomically; claimed-set updates are serialized by
 * the engine.</p>
 */
package ca.gc.cra.vantage.application.segment;
