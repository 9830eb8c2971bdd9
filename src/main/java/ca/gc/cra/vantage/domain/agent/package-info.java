/**
 * Capture-agent descriptors and the per-agent segment plan produced for configuration push.
 * <p><strong>Concurrency:</strong> Immutable records and enums; safe to share.</p>
 */
package ca.gc.cra.vantage.domain.agent;
