package ca.gc.cra.vantage.application.pipeline;

import ca.gc.cra.vantage.application.port.AgentRegistry;
import ca.gc.cra.vantage.application.port.ClockPort;
import ca.gc.cra.vantage.application.port.MetricsPort;
import ca.gc.cra.vantage.application.port.SegmentPlanSink;
import ca.gc.cra.vantage.application.port.TopologySource;
import ca.gc.cra.vantage.application.segment.AgentSegmentResolver;
import ca.gc.cra.vantage.application.segment.SegmentCycle;
import ca.gc.cra.vantage.application.segment.SegmentEngine;
import ca.gc.cra.vantage.domain.agent.AgentDescriptor;
import ca.gc.cra.vantage.domain.agent.SegmentPlan;
import ca.gc.cra.vantage.domain.topology.TopologySnapshot;
import ca.gc.cra.vantage.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Refresh driver that turns the current topology and agent registry into a segment plan.
 * <p><strong>Why:</strong> The segment engine is only correct when its cycle runs in order: rebuild, clear
 * claims, resolve every agent, then compute unclaimed interfaces. This use case owns that sequence.</p>
 * <p><strong>Role:</strong> Application use case invoked once by the {@code resolve} CLI or periodically by the
 * {@code watch} CLI.</p>
 * <p><strong>Thread-safety:</strong> {@link #runCycle()} is not reentrant; {@link #runPeriodically(Duration, long)}
 * serializes cycles on a single scheduler thread. {@link #stop()} may be called from any thread.</p>
 * <p><strong>Observability:</strong> Counts cycles and failures; records cycle latency.</p>
 *
 * @since 0.1.0
 */
public final class SegmentRefreshUseCase {
  private static final Logger log = LoggerFactory.getLogger(SegmentRefreshUseCase.class);
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private final TopologySource topologySource;
  private final AgentRegistry agentRegistry;
  private final SegmentPlanSink sink;
  private final SegmentEngine engine;
  private final AgentSegmentResolver resolver;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final AtomicLong cycles = new AtomicLong();
  private volatile CountDownLatch stopSignal;

  /**
   * Creates the refresh driver.
   *
   * @param topologySource supplies a fresh snapshot per cycle
   * @param agentRegistry lists agents to resolve per cycle
   * @param sink receives the plan of each cycle
   * @param engine segment engine rebuilt every cycle
   * @param metrics metrics sink
   * @param clock clock stamping each plan
   */
  public SegmentRefreshUseCase(
      TopologySource topologySource,
      AgentRegistry agentRegistry,
      SegmentPlanSink sink,
      SegmentEngine engine,
      MetricsPort metrics,
      ClockPort clock) {
    this(topologySource, agentRegistry, sink, engine, new AgentSegmentResolver(), metrics, clock);
  }

  SegmentRefreshUseCase(
      TopologySource topologySource,
      AgentRegistry agentRegistry,
      SegmentPlanSink sink,
      SegmentEngine engine,
      AgentSegmentResolver resolver,
      MetricsPort metrics,
      ClockPort clock) {
    this.topologySource = Objects.requireNonNull(topologySource, "topologySource");
    this.agentRegistry = Objects.requireNonNull(agentRegistry, "agentRegistry");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs one full cycle and publishes its plan.
   *
   * @return published plan
   * @throws Exception if loading inputs or publishing fails; the engine keeps its previous index when the
   *     snapshot cannot be loaded
   */
  public SegmentPlan runCycle() throws Exception {
    long start = System.nanoTime();
    TopologySnapshot snapshot = topologySource.load();
    List<AgentDescriptor> agents = agentRegistry.agents();

    engine.rebuild(snapshot);
    SegmentCycle cycle = engine.beginCycle();
    AgentSegmentResolver.Resolution resolution = resolver.resolveAll(cycle, agents);

    SegmentPlan plan = new SegmentPlan(
        cycles.incrementAndGet(), clock.nowMillis(), resolution.agents(), resolution.notYetClaimed());
    sink.publish(plan);

    metrics.increment("segment.refresh.cycle");
    metrics.observe("segment.refresh.latencyNanos", System.nanoTime() - start);
    log.info("Segment cycle {} published for {} agents", plan.cycle(), plan.agents().size());
    return plan;
  }

  /**
   * Runs cycles with a fixed delay until {@code maxCycles} attempts completed, {@link #stop()} is called, or the
   * calling thread is interrupted. A failed cycle is logged and counted; the schedule continues. An
   * {@link Error} thrown by a cycle ends the schedule and is rethrown to the caller.
   *
   * @param interval delay between the end of one cycle and the start of the next; must be positive
   * @param maxCycles number of cycle attempts before returning; {@code 0} runs until stopped
   * @return number of cycles that published a plan
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public long runPeriodically(Duration interval, long maxCycles) throws InterruptedException {
    Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (maxCycles < 0) {
      throw new IllegalArgumentException("maxCycles must be >= 0");
    }
    CountDownLatch done = new CountDownLatch(1);
    stopSignal = done;
    AtomicLong attempts = new AtomicLong();
    AtomicLong published = new AtomicLong();
    AtomicReference<Error> fatal = new AtomicReference<>();
    ScheduledExecutorService scheduler = ExecutorFactories.newRefreshScheduler(
        "vantage-refresh", (thread, ex) -> log.error("Refresh thread {} failed", thread.getName(), ex));
    try {
      scheduler.scheduleWithFixedDelay(
          () -> {
            try {
              runCycle();
              published.incrementAndGet();
            } catch (InterruptedException ex) {
              Thread.currentThread().interrupt();
              log.warn("Segment refresh interrupted");
              done.countDown();
              return;
            } catch (Exception ex) {
              metrics.increment("segment.refresh.failure");
              log.error("Segment refresh cycle failed; keeping previous segment index", ex);
            } catch (Error err) {
              metrics.increment("segment.refresh.failure");
              log.error("Segment refresh aborted by fatal error", err);
              fatal.set(err);
              done.countDown();
              return;
            }
            if (maxCycles > 0 && attempts.incrementAndGet() >= maxCycles) {
              done.countDown();
            }
          },
          0,
          interval.toMillis(),
          TimeUnit.MILLISECONDS);
      done.await();
    } finally {
      stopSignal = null;
      scheduler.shutdownNow();
      if (!scheduler.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Refresh scheduler did not terminate within {}s", SHUTDOWN_WAIT_SECONDS);
      }
    }
    Error err = fatal.get();
    if (err != null) {
      throw err;
    }
    return published.get();
  }

  /** Requests that a running {@link #runPeriodically(Duration, long)} return after the current cycle. */
  public void stop() {
    CountDownLatch signal = stopSignal;
    if (signal != null) {
      signal.countDown();
    }
  }

  /** @return number of cycles published so far */
  public long cyclesPublished() {
    return cycles.get();
  }
}
