package com.nori.tc.throughput.suite;

import com.nori.tc.throughput.config.TcThroughputProperties;
import com.nori.tc.throughput.measurement.TrafficMeasurementPhase;
import com.nori.tc.throughput.orchestration.OrchestrationSequencer;
import com.nori.tc.throughput.scenario.SampleRateTable;
import com.nori.tc.throughput.scenario.ScenarioCatalog;
import com.nori.tc.throughput.scenario.ScenarioCategory;
import com.nori.tc.throughput.support.FakeConfigurator;
import com.nori.tc.throughput.support.FakeTrafficTool;
import com.nori.tc.throughput.support.RecordingReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.support.GenericApplicationContext;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioSuiteLifecycleTests {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ScenarioCatalog catalog = new ScenarioCatalog(
            new SampleRateTable(Map.of(5, 7_680_000, 10, 11_520_000, 20, 23_040_000, 50, 61_440_000)), 0.1);
    private final OrchestrationSequencer sequencer = new OrchestrationSequencer(
            new FakeConfigurator(),
            new TrafficMeasurementPhase(FakeTrafficTool.measuring(1), executor, Duration.ofSeconds(1)),
            new RecordingReporter(),
            executor,
            Duration.ofSeconds(1),
            Duration.ofSeconds(1));
    private final RecordingCoordinator coordinator = new RecordingCoordinator();

    private ScenarioSuiteLifecycle lifecycle;

    @AfterEach
    void tearDown() {
        if (lifecycle != null) {
            lifecycle.stop();
        }
        executor.shutdownNow();
    }

    private static TcThroughputProperties.Suite suite(String idPattern) {
        TcThroughputProperties.Suite props = new TcThroughputProperties.Suite();
        props.setEnabled(true);
        props.setCategories(List.of(ScenarioCategory.SMOKE));
        props.setIdPattern(idPattern);
        props.setExitOnCompletion(false);
        return props;
    }

    @Test
    void invalid_id_pattern_fails_start_up() {
        ScenarioSuiteRunner runner = new ScenarioSuiteRunner(catalog, sequencer, n -> {
            throw new AssertionError("suite must not run");
        });
        lifecycle = new ScenarioSuiteLifecycle(suite("band:[3"), runner, coordinator);

        IllegalStateException ex = assertThrows(IllegalStateException.class, lifecycle::start);
        assertTrue(ex.getMessage().contains("band:[3"));
        assertFalse(lifecycle.isRunning());
        assertEquals(1, coordinator.completed.getCount());
        assertEquals(1, coordinator.failed.getCount());
    }

    @Test
    void runner_exception_still_reaches_coordinator_with_failing_exit() throws InterruptedException {
        ScenarioSuiteRunner runner = new ScenarioSuiteRunner(catalog, sequencer, n -> null) {
            @Override
            public SuiteSummary run(Set<ScenarioCategory> categories, String idPattern) {
                throw new IllegalStateException("catalog unavailable");
            }
        };
        lifecycle = new ScenarioSuiteLifecycle(suite(null), runner, coordinator);

        lifecycle.start();

        assertTrue(coordinator.failed.await(3, TimeUnit.SECONDS), "coordinator was not notified");
        assertEquals("catalog unavailable", coordinator.failure.get().getMessage());
        assertEquals(1, coordinator.completed.getCount());
    }

    @Test
    void completed_suite_hands_summary_to_coordinator() throws InterruptedException {
        ScenarioSuiteRunner runner = new ScenarioSuiteRunner(catalog, sequencer, n -> null) {
            @Override
            public SuiteSummary run(Set<ScenarioCategory> categories, String idPattern) {
                return new SuiteSummary(List.of());
            }
        };
        lifecycle = new ScenarioSuiteLifecycle(suite("smoke"), runner, coordinator);

        lifecycle.start();

        assertTrue(coordinator.completed.await(3, TimeUnit.SECONDS));
        assertEquals(SuiteSummary.EXIT_OK, coordinator.summary.get().exitCode());
        assertEquals(1, coordinator.failed.getCount());
    }

    /** 프로세스를 종료하지 않고 호출만 기록한다 */
    private static final class RecordingCoordinator extends SuiteCompletionCoordinator {

        final CountDownLatch completed = new CountDownLatch(1);
        final CountDownLatch failed = new CountDownLatch(1);
        final AtomicReference<SuiteSummary> summary = new AtomicReference<>();
        final AtomicReference<Throwable> failure = new AtomicReference<>();

        RecordingCoordinator() {
            super(new GenericApplicationContext());
        }

        @Override
        public void suiteCompleted(SuiteSummary s, boolean exitOnCompletion) {
            summary.set(s);
            completed.countDown();
        }

        @Override
        public void suiteFailed(Throwable cause, boolean exitOnCompletion) {
            failure.set(cause);
            failed.countDown();
        }
    }
}
