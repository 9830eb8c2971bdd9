/**
 * Application layer orchestrating topology refresh, segment resolution, and plan delivery.
 * <p><strong>Role:</strong> Hosts the segment engine and the use cases that drive it through ports.</p>
 * <p><strong>Concurrency:</strong> The refresh use case serializes cycles on one scheduler thread; the engine
 * guards its claimed-interface set for callers that query from other threads.</p>
 * <p><strong>Metrics:</strong> Emits {@code segment.*} counters and histograms through
 * {@link ca.gc.cra.vantage.application.port.MetricsPort}.</p>
 */
package ca.gc.cra.vantage.application;
