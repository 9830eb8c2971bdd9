package ca.gc.cra.vantage.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vantage.application.port.MetricsPort;
import ca.gc.cra.vantage.application.port.SegmentPlanSink;
import ca.gc.cra.vantage.application.segment.SegmentEngine;
import ca.gc.cra.vantage.domain.agent.AgentDescriptor;
import ca.gc.cra.vantage.domain.agent.AgentType;
import ca.gc.cra.vantage.domain.agent.SegmentPlan;
import ca.gc.cra.vantage.domain.segment.SegmentView;
import ca.gc.cra.vantage.domain.topology.TopologySnapshot;
import ca.gc.cra.vantage.domain.topology.VInterface;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class SegmentRefreshUseCaseTest {
  private static final VInterface HOST_VIF = new VInterface(1, "aa:01", 10);
  private static final VInterface SPARE_VIF = new VInterface(2, "aa:02", 10);

  private static final TopologySnapshot SNAPSHOT = TopologySnapshot.builder()
      .deviceVInterface(HOST_VIF)
      .deviceVInterface(SPARE_VIF)
      .hostVInterface(7, HOST_VIF)
      .build();

  private static final List<AgentDescriptor> AGENTS = List.of(
      new AgentDescriptor("host-7", AgentType.HOST, "", 7, 0, 0),
      new AgentDescriptor("collector", AgentType.DEDICATED, "", 0, 0, 0));

  @Test
  void runCyclePublishesResolvedPlan() throws Exception {
    RecordingSink sink = new RecordingSink();
    RecordingMetrics metrics = new RecordingMetrics();
    SegmentRefreshUseCase useCase = new SegmentRefreshUseCase(
        () -> SNAPSHOT, () -> AGENTS, sink, new SegmentEngine(metrics), metrics, () -> 1234L);

    SegmentPlan plan = useCase.runCycle();

    assertEquals(1L, plan.cycle());
    assertEquals(1234L, plan.generatedAtMillis());
    assertEquals(List.of(plan), sink.plans);
    assertEquals(List.of(new SegmentView(10, List.of("aa:01"), List.of(1))), plan.agents().get(0).localSegments());
    assertEquals(List.of(SegmentView.flattened(List.of("aa:02"), List.of(2))), plan.notYetClaimed());
    assertEquals(plan.notYetClaimed(), plan.agents().get(1).remoteSegments());
    assertEquals(1L, metrics.counters.get("segment.refresh.cycle"));
    assertTrue(metrics.observations.containsKey("segment.refresh.latencyNanos"));
    assertEquals(1L, useCase.cyclesPublished());
  }

  @Test
  void loadFailurePropagatesAndKeepsPreviousIndex() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    SegmentEngine engine = new SegmentEngine();
    SegmentRefreshUseCase useCase = new SegmentRefreshUseCase(
        () -> {
          if (calls.incrementAndGet() > 1) {
            throw new IOException("topology unavailable");
          }
          return SNAPSHOT;
        },
        () -> AGENTS,
        new RecordingSink(),
        engine,
        MetricsPort.NO_OP,
        () -> 0L);

    useCase.runCycle();
    IOException ex = assertThrows(IOException.class, useCase::runCycle);

    assertEquals("topology unavailable", ex.getMessage());
    assertTrue(engine.isReady());
    assertEquals(1L, useCase.cyclesPublished());
  }

  @Test
  void periodicRunCountsFailuresAndContinues() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    RecordingSink sink = new RecordingSink();
    RecordingMetrics metrics = new RecordingMetrics();
    SegmentRefreshUseCase useCase = new SegmentRefreshUseCase(
        () -> {
          if (calls.incrementAndGet() == 2) {
            throw new IOException("transient");
          }
          return SNAPSHOT;
        },
        () -> AGENTS,
        sink,
        new SegmentEngine(),
        metrics,
        () -> 0L);

    long published = useCase.runPeriodically(Duration.ofMillis(10), 3);

    assertEquals(2L, published);
    assertEquals(2, sink.plans.size());
    assertEquals(1L, metrics.counters.get("segment.refresh.failure"));
    assertEquals(List.of(1L, 2L), sink.plans.stream().map(SegmentPlan::cycle).toList());
  }

  @Test
  void fatalErrorEndsPeriodicRunInsteadOfHanging() {
    RecordingSink sink = new RecordingSink();
    RecordingMetrics metrics = new RecordingMetrics();
    SegmentRefreshUseCase useCase = new SegmentRefreshUseCase(
        () -> {
          throw new StackOverflowError("deep topology");
        },
        () -> AGENTS,
        sink,
        new SegmentEngine(),
        metrics,
        () -> 0L);

    StackOverflowError err = assertTimeoutPreemptively(Duration.ofSeconds(5),
        () -> assertThrows(StackOverflowError.class, () -> useCase.runPeriodically(Duration.ofMillis(10), 2)));

    assertEquals("deep topology", err.getMessage());
    assertTrue(sink.plans.isEmpty());
    assertEquals(1L, metrics.counters.get("segment.refresh.failure"));
  }

  @Test
  void stopEndsUnboundedRun() throws Exception {
    AtomicReference<SegmentRefreshUseCase> holder = new AtomicReference<>();
    RecordingSink sink = new RecordingSink() {
      @Override
      public void publish(SegmentPlan plan) {
        super.publish(plan);
        holder.get().stop();
      }
    };
    SegmentRefreshUseCase useCase = new SegmentRefreshUseCase(
        () -> SNAPSHOT, () -> AGENTS, sink, new SegmentEngine(), MetricsPort.NO_OP, () -> 0L);
    holder.set(useCase);

    long published = useCase.runPeriodically(Duration.ofMillis(10), 0);

    assertEquals(1L, published);
  }

  @Test
  void rejectsInvalidSchedule() {
    SegmentRefreshUseCase useCase = new SegmentRefreshUseCase(
        () -> SNAPSHOT, () -> AGENTS, new RecordingSink(), new SegmentEngine(), MetricsPort.NO_OP, () -> 0L);

    assertThrows(IllegalArgumentException.class, () -> useCase.runPeriodically(Duration.ZERO, 1));
    assertThrows(IllegalArgumentException.class, () -> useCase.runPeriodically(Duration.ofSeconds(1), -1));
  }

  private static class RecordingSink implements SegmentPlanSink {
    final List<SegmentPlan> plans = new CopyOnWriteArrayList<>();

    @Override
    public void publish(SegmentPlan plan) {
      plans.add(plan);
    }
  }

  private static final class RecordingMetrics implements MetricsPort {
    final Map<String, Long> counters = new HashMap<>();
    final Map<String, Long> observations = new HashMap<>();

    @Override
    public synchronized void increment(String key) {
      counters.merge(key, 1L, Long::sum);
    }

    @Override
    public synchronized void observe(String key, long value) {
      observations.put(key, value);
    }
  }
}
