package ca.gc.cra.vantage.application.port;

import ca.gc.cra.vantage.domain.agent.SegmentPlan;

/**
 * <strong>What:</strong> Output port receiving the plan computed for each refresh cycle.
 * <p><strong>Role:</strong> Implemented by file/stdout writers; a transport adapter would push the per-agent
 * segments to the agents themselves.</p>
 * <p><strong>Thread-safety:</strong> Called from the refresh thread only; implementations need not be
 * thread-safe unless shared.</p>
 *
 * @since 0.1.0
 */
public interface SegmentPlanSink extends AutoCloseable {
  /**
   * Delivers a plan.
   *
   * @param plan plan to deliver; never {@code null}
   * @throws Exception when delivery fails; the refresh driver logs and counts the failure
   */
  void publish(SegmentPlan plan) throws Exception;

  /**
   * Releases resources held by the sink.
   *
   * @throws Exception when closing fails
   */
  @Override
  default void close() throws Exception {}
}
