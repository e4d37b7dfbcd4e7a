package com.nori.tc.throughput.orchestration;

import com.nori.tc.throughput.measurement.MeasurementTimeoutException;
import com.nori.tc.throughput.measurement.TrafficMeasurementPhase;
import com.nori.tc.throughput.outcome.Outcome;
import com.nori.tc.throughput.outcome.Phase;
import com.nori.tc.throughput.outcome.Verdict;
import com.nori.tc.throughput.scenario.ArtifactPolicy;
import com.nori.tc.throughput.scenario.ScenarioParameters;
import com.nori.tc.throughput.scenario.TrafficDirection;
import com.nori.tc.throughput.scenario.TrafficProtocol;
import com.nori.tc.throughput.support.FakeConfigurator;
import com.nori.tc.throughput.support.FakeNetworkElement;
import com.nori.tc.throughput.support.FakeTrafficTool;
import com.nori.tc.throughput.support.FakeUserEndpoint;
import com.nori.tc.throughput.support.RecordingReporter;
import com.nori.tc.throughput.testbed.AttachException;
import com.nori.tc.throughput.testbed.ConfigurationException;
import com.nori.tc.throughput.testbed.Configurator;
import com.nori.tc.throughput.testbed.EndpointSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.nori.tc.throughput.support.TestScenarios.params;
import static com.nori.tc.throughput.support.TestScenarios.ues;
import static org.junit.jupiter.api.Assertions.*;

class OrchestrationSequencerTests {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    private final FakeNetworkElement gnb = new FakeNetworkElement("gnb");
    private final FakeNetworkElement core = new FakeNetworkElement("core");

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private OrchestrationSequencer sequencer(Configurator configurator, FakeTrafficTool tool, RecordingReporter reporter) {
        return new OrchestrationSequencer(
                configurator,
                new TrafficMeasurementPhase(tool, executor, Duration.ofMillis(500)),
                reporter,
                executor,
                Duration.ofMillis(300),
                Duration.ofSeconds(2));
    }

    private static ScenarioParameters passing() {
        return params(TrafficProtocol.UDP, TrafficDirection.DOWNLINK, 1_000_000, 0.1).build();
    }

    @Test
    void passing_run_detaches_every_endpoint_once_and_stops_network() {
        List<FakeUserEndpoint> ues = ues(4);
        Outcome outcome = sequencer(new FakeConfigurator(), FakeTrafficTool.measuring(1_000_000), new RecordingReporter())
                .run(passing(), new EndpointSet(ues, gnb, core));

        assertEquals(Verdict.PASS, outcome.verdict());
        assertTrue(outcome.warnings().isEmpty());
        for (FakeUserEndpoint ue : ues) {
            assertEquals(1, ue.getAttachCalls(), ue.getId());
            assertEquals(1, ue.getDetachCalls(), ue.getId());
        }
        assertEquals(1, gnb.getStopCalls());
        assertEquals(1, core.getStopCalls());
    }

    @Test
    void configuration_rejection_errors_without_attach_or_detach() {
        List<FakeUserEndpoint> ues = ues(2);
        Outcome outcome = sequencer(FakeConfigurator.rejecting("band 99 unsupported"),
                FakeTrafficTool.measuring(1_000_000), new RecordingReporter())
                .run(passing(), new EndpointSet(ues, gnb, core));

        assertEquals(Verdict.ERROR, outcome.verdict());
        Outcome.Errored errored = (Outcome.Errored) outcome;
        assertEquals(Phase.CONFIGURE, errored.phase());
        assertInstanceOf(ConfigurationException.class, errored.cause());
        for (FakeUserEndpoint ue : ues) {
            assertEquals(0, ue.getAttachCalls());
            assertEquals(0, ue.getDetachCalls());
        }
        assertEquals(1, gnb.getStopCalls());
        assertEquals(1, core.getStopCalls());
    }

    @Test
    void attach_timeout_on_third_of_four_detaches_only_the_first_two() {
        List<FakeUserEndpoint> ues = ues(4);
        ues.get(2).hanging();
        FakeTrafficTool tool = FakeTrafficTool.measuring(1_000_000);

        Outcome outcome = sequencer(new FakeConfigurator(), tool, new RecordingReporter())
                .run(passing(), new EndpointSet(ues, gnb, core));

        assertEquals(Verdict.ERROR, outcome.verdict());
        Outcome.Errored errored = (Outcome.Errored) outcome;
        assertEquals(Phase.ATTACH, errored.phase());
        AttachException cause = assertInstanceOf(AttachException.class, errored.cause());
        assertTrue(cause.isTimedOut());
        assertEquals("ue3", cause.getEndpointId());

        assertEquals(1, ues.get(0).getDetachCalls());
        assertEquals(1, ues.get(1).getDetachCalls());
        assertEquals(0, ues.get(2).getDetachCalls());
        assertEquals(0, ues.get(3).getDetachCalls());
        assertEquals(0, ues.get(3).getAttachCalls());

        assertEquals(1, gnb.getStopCalls());
        assertEquals(1, core.getStopCalls());
        assertTrue(tool.getRequests().isEmpty());

        assertThrows(AttachException.class, outcome::raiseIfNotPassed);
    }

    @Test
    void attach_failure_on_first_endpoint_detaches_nothing() {
        List<FakeUserEndpoint> ues = ues(3);
        ues.get(0).failingAttach();

        Outcome outcome = sequencer(new FakeConfigurator(), FakeTrafficTool.measuring(1_000_000), new RecordingReporter())
                .run(passing(), new EndpointSet(ues, gnb, core));

        assertEquals(Phase.ATTACH, ((Outcome.Errored) outcome).phase());
        assertFalse(((AttachException) ((Outcome.Errored) outcome).cause()).isTimedOut());
        ues.forEach(ue -> assertEquals(0, ue.getDetachCalls()));
        assertEquals(0, ues.get(1).getAttachCalls());
    }

    @Test
    void measurement_timeout_errors_and_still_tears_down() {
        List<FakeUserEndpoint> ues = ues(2);

        Outcome outcome = sequencer(new FakeConfigurator(), FakeTrafficTool.hanging(), new RecordingReporter())
                .run(passing(), new EndpointSet(ues, gnb, core));

        Outcome.Errored errored = (Outcome.Errored) outcome;
        assertEquals(Phase.MEASURE, errored.phase());
        assertInstanceOf(MeasurementTimeoutException.class, errored.cause());
        ues.forEach(ue -> assertEquals(1, ue.getDetachCalls()));
        assertEquals(1, gnb.getStopCalls());
        assertEquals(1, core.getStopCalls());
    }

    @Test
    void unexpected_runtime_error_during_measurement_is_reported_as_measure_error() {
        List<FakeUserEndpoint> ues = ues(1);
        FakeTrafficTool tool = new FakeTrafficTool(req -> {
            throw new IllegalStateException("iperf binary missing");
        });

        Outcome outcome = sequencer(new FakeConfigurator(), tool, new RecordingReporter())
                .run(passing(), new EndpointSet(ues, gnb, core));

        assertEquals(Phase.MEASURE, ((Outcome.Errored) outcome).phase());
        assertEquals(1, ues.get(0).getDetachCalls());
    }

    @Test
    void bitrate_failure_tears_down_and_keeps_fail_verdict() {
        List<FakeUserEndpoint> ues = ues(4);
        ScenarioParameters p = params(TrafficProtocol.TCP, TrafficDirection.UPLINK, 15_000_000, 0.1).build();

        Outcome outcome = sequencer(new FakeConfigurator(), FakeTrafficTool.measuring(12_000_000), new RecordingReporter())
                .run(p, new EndpointSet(ues, gnb, core));

        assertEquals(Verdict.FAIL, outcome.verdict());
        ues.forEach(ue -> assertEquals(1, ue.getDetachCalls()));
    }

    @Test
    void teardown_errors_become_warnings_without_changing_verdict() {
        List<FakeUserEndpoint> ues = ues(3);
        ues.get(1).failingDetach();
        FakeNetworkElement failingGnb = new FakeNetworkElement("gnb").failingOnStop();

        Outcome outcome = sequencer(new FakeConfigurator(), FakeTrafficTool.measuring(1_000_000), new RecordingReporter())
                .run(passing(), new EndpointSet(ues, failingGnb, core));

        assertEquals(Verdict.PASS, outcome.verdict());
        assertEquals(2, outcome.warnings().size());
        assertTrue(outcome.warnings().get(0).startsWith("ue2"));
        assertTrue(outcome.warnings().get(1).startsWith("gnb"));
        assertEquals(1, core.getStopCalls());
        ues.forEach(ue -> assertEquals(1, ue.getDetachCalls()));
    }

    @Test
    void teardown_warnings_do_not_mask_an_earlier_error() {
        List<FakeUserEndpoint> ues = ues(2);
        ues.get(0).failingDetach();
        ues.get(1).failingAttach();

        Outcome outcome = sequencer(new FakeConfigurator(), FakeTrafficTool.measuring(1_000_000), new RecordingReporter())
                .run(passing(), new EndpointSet(ues, gnb, core));

        assertEquals(Verdict.ERROR, outcome.verdict());
        assertInstanceOf(AttachException.class, ((Outcome.Errored) outcome).cause());
        assertEquals(1, outcome.warnings().size());
    }

    @Test
    void artifacts_always_downloaded_when_requested() {
        RecordingReporter reporter = new RecordingReporter();
        ScenarioParameters p = passing().toBuilder().artifactPolicy(new ArtifactPolicy(true, false)).build();

        sequencer(new FakeConfigurator(), FakeTrafficTool.measuring(1_000_000), reporter)
                .run(p, new EndpointSet(ues(1), gnb, core));

        assertEquals(1, reporter.getCollected().size());
        assertEquals(Verdict.PASS, reporter.getCollected().get(0).verdict());
    }

    @Test
    void search_logs_collects_only_when_not_passed() {
        ScenarioParameters p = params(TrafficProtocol.TCP, TrafficDirection.DOWNLINK, 10_000_000, 0.1)
                .artifactPolicy(new ArtifactPolicy(false, true))
                .build();

        RecordingReporter onPass = new RecordingReporter();
        sequencer(new FakeConfigurator(), FakeTrafficTool.measuring(10_000_000), onPass)
                .run(p, new EndpointSet(ues(1), new FakeNetworkElement("gnb"), new FakeNetworkElement("core")));
        assertTrue(onPass.getCollected().isEmpty());

        RecordingReporter onFail = new RecordingReporter();
        sequencer(new FakeConfigurator(), FakeTrafficTool.measuring(1_000_000), onFail)
                .run(p, new EndpointSet(ues(1), new FakeNetworkElement("gnb"), new FakeNetworkElement("core")));
        assertEquals(1, onFail.getCollected().size());
        assertEquals(Verdict.FAIL, onFail.getCollected().get(0).verdict());
    }

    @Test
    void reporter_failure_is_a_warning() {
        ScenarioParameters p = passing().toBuilder().artifactPolicy(new ArtifactPolicy(true, false)).build();

        Outcome outcome = sequencer(new FakeConfigurator(), FakeTrafficTool.measuring(1_000_000), new RecordingReporter().failing())
                .run(p, new EndpointSet(ues(1), gnb, core));

        assertEquals(Verdict.PASS, outcome.verdict());
        assertEquals(1, outcome.warnings().size());
        assertTrue(outcome.warnings().get(0).contains("artifact collection failed"));
    }

    @Test
    void interrupted_run_waits_for_detaches_before_returning() throws InterruptedException {
        List<FakeUserEndpoint> ues = ues(2);
        ues.forEach(ue -> ue.slowDetach(Duration.ofMillis(400)));
        OrchestrationSequencer seq = sequencer(new FakeConfigurator(), FakeTrafficTool.hanging(), new RecordingReporter());

        AtomicReference<Outcome> result = new AtomicReference<>();
        AtomicInteger detachedAtReturn = new AtomicInteger(-1);
        Thread runner = new Thread(() -> {
            result.set(seq.run(passing(), new EndpointSet(ues, gnb, core)));
            detachedAtReturn.set(ues.stream().mapToInt(FakeUserEndpoint::getCompletedDetaches).sum());
        }, "sequencer-under-test");
        runner.start();

        Thread.sleep(150);
        runner.interrupt();
        runner.join(5_000);

        assertFalse(runner.isAlive());
        assertEquals(Verdict.ERROR, result.get().verdict());
        assertEquals(2, detachedAtReturn.get());
        assertTrue(result.get().warnings().isEmpty(), result.get().warnings().toString());
        assertEquals(1, gnb.getStopCalls());
        assertEquals(1, core.getStopCalls());
    }

    @Test
    void sequencer_keeps_no_state_between_runs() {
        OrchestrationSequencer seq = sequencer(new FakeConfigurator(), FakeTrafficTool.measuring(1_000_000), null);

        List<FakeUserEndpoint> first = ues(2);
        first.get(0).failingAttach();
        assertEquals(Verdict.ERROR, seq.run(passing(), new EndpointSet(first, new FakeNetworkElement("gnb"), new FakeNetworkElement("core"))).verdict());

        List<FakeUserEndpoint> second = ues(2);
        assertEquals(Verdict.PASS, seq.run(passing(), new EndpointSet(second, new FakeNetworkElement("gnb"), new FakeNetworkElement("core"))).verdict());
        second.forEach(ue -> assertEquals(1, ue.getDetachCalls()));
    }
}
