package com.nori.tc.throughput.measurement;

import com.nori.tc.throughput.outcome.Outcome;
import com.nori.tc.throughput.outcome.ThroughputAssertionError;
import com.nori.tc.throughput.outcome.Verdict;
import com.nori.tc.throughput.scenario.ScenarioParameters;
import com.nori.tc.throughput.scenario.TrafficDirection;
import com.nori.tc.throughput.scenario.TrafficProtocol;
import com.nori.tc.throughput.support.FakeTrafficTool;
import com.nori.tc.throughput.testbed.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.nori.tc.throughput.support.TestScenarios.attached;
import static com.nori.tc.throughput.support.TestScenarios.params;
import static org.junit.jupiter.api.Assertions.*;

class TrafficMeasurementPhaseTests {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private TrafficMeasurementPhase phase(FakeTrafficTool tool, Duration grace) {
        return new TrafficMeasurementPhase(tool, executor, grace);
    }

    @Test
    void zero_tolerance_passes_regardless_of_measured_bitrate() {
        ScenarioParameters p = params(TrafficProtocol.UDP, TrafficDirection.DOWNLINK, 1_000_000, 0.0).build();

        Outcome outcome = phase(FakeTrafficTool.measuring(200_000), Duration.ofSeconds(5)).measure(p, attached(4));

        assertEquals(Verdict.PASS, outcome.verdict());
        Outcome.Passed passed = (Outcome.Passed) outcome;
        assertEquals(1, passed.measurements().size());
        // 측정값은 검증하지 않아도 남는다
        assertEquals(200_000, passed.measurements().get(0).throughputs().get(0).measuredBitrateBps());
    }

    @Test
    void tcp_uplink_below_tolerance_fails_with_shortfall() {
        ScenarioParameters p = params(TrafficProtocol.TCP, TrafficDirection.UPLINK, 15_000_000, 0.1).build();

        Outcome outcome = phase(FakeTrafficTool.measuring(12_000_000), Duration.ofSeconds(5)).measure(p, attached(1));

        assertEquals(Verdict.FAIL, outcome.verdict());
        Outcome.Failed failed = (Outcome.Failed) outcome;
        assertEquals(1, failed.violations().size());
        BitrateShortfall v = failed.violations().get(0);
        assertEquals(TrafficDirection.UPLINK, v.direction());
        assertEquals("ue1", v.endpointId());
        assertEquals(15_000_000, v.targetBitrateBps());
        assertEquals(12_000_000, v.measuredBitrateBps());
        assertEquals(0.2, v.shortfall(), 1e-9);
        assertTrue(failed.transportFailures().isEmpty());

        assertThrows(ThroughputAssertionError.class, outcome::raiseIfNotPassed);
    }

    @Test
    void shortfall_exactly_at_tolerance_passes() {
        ScenarioParameters p = params(TrafficProtocol.TCP, TrafficDirection.DOWNLINK, 10_000_000, 0.1).build();

        Outcome outcome = phase(FakeTrafficTool.measuring(9_000_000), Duration.ofSeconds(5)).measure(p, attached(2));

        assertEquals(Verdict.PASS, outcome.verdict());
    }

    @Test
    void only_the_endpoint_below_tolerance_is_reported() {
        ScenarioParameters p = params(TrafficProtocol.UDP, TrafficDirection.DOWNLINK, 10_000_000, 0.1).build();
        FakeTrafficTool tool = new FakeTrafficTool(req -> MeasurementResult.ok(req.direction(), List.of(
                new EndpointThroughput("ue1", 10_000_000),
                new EndpointThroughput("ue2", 5_000_000)), req.duration()));

        Outcome.Failed failed = (Outcome.Failed) phase(tool, Duration.ofSeconds(5)).measure(p, attached(2));

        assertEquals(1, failed.violations().size());
        assertEquals("ue2", failed.violations().get(0).endpointId());
    }

    @Test
    void bidirectional_runs_uplink_and_downlink_concurrently() {
        ScenarioParameters p = params(TrafficProtocol.UDP, TrafficDirection.BIDIRECTIONAL, 1_000_000, 0.1).build();
        FakeTrafficTool tool = FakeTrafficTool.requiringConcurrency(2, 1_000_000);

        Outcome outcome = phase(tool, Duration.ofSeconds(10)).measure(p, attached(4));

        assertEquals(Verdict.PASS, outcome.verdict());
        assertEquals(2, tool.getRequests().size());
        assertTrue(tool.getRequests().stream().anyMatch(r -> r.direction() == TrafficDirection.UPLINK));
        assertTrue(tool.getRequests().stream().anyMatch(r -> r.direction() == TrafficDirection.DOWNLINK));
    }

    @Test
    void session_exceeding_duration_plus_grace_is_an_error_not_a_failure() {
        ScenarioParameters p = params(TrafficProtocol.TCP, TrafficDirection.DOWNLINK, 1_000_000, 0.1).build();

        assertThrows(MeasurementTimeoutException.class,
                () -> phase(FakeTrafficTool.hanging(), Duration.ofMillis(200)).measure(p, attached(1)));
    }

    @Test
    void transport_exception_becomes_failed_with_diagnostic() {
        ScenarioParameters p = params(TrafficProtocol.TCP, TrafficDirection.UPLINK, 1_000_000, 0.1).build();
        FakeTrafficTool tool = new FakeTrafficTool(req -> {
            throw new TransportException(req.direction(), "ue1", "connection refused");
        });

        Outcome outcome = phase(tool, Duration.ofSeconds(5)).measure(p, attached(1));

        assertEquals(Verdict.FAIL, outcome.verdict());
        Outcome.Failed failed = (Outcome.Failed) outcome;
        assertEquals(1, failed.transportFailures().size());
        assertEquals("ue1", failed.transportFailures().get(0).endpointId());
        assertTrue(outcome.describe().contains("connection refused"));
    }

    @Test
    void transport_not_ok_fails_even_with_zero_tolerance() {
        ScenarioParameters p = params(TrafficProtocol.UDP, TrafficDirection.DOWNLINK, 1_000_000, 0.0).build();
        FakeTrafficTool tool = new FakeTrafficTool(req -> MeasurementResult.transportFailed(req.direction(),
                List.of(new EndpointThroughput("ue1", 1_000_000)), req.duration(), "sink reset"));

        Outcome outcome = phase(tool, Duration.ofSeconds(5)).measure(p, attached(1));

        assertEquals(Verdict.FAIL, outcome.verdict());
    }

    @Test
    void endpoint_missing_from_result_is_a_transport_failure() {
        ScenarioParameters p = params(TrafficProtocol.UDP, TrafficDirection.DOWNLINK, 1_000_000, 0.0).build();
        FakeTrafficTool tool = new FakeTrafficTool(req -> MeasurementResult.ok(req.direction(),
                List.of(new EndpointThroughput("ue1", 1_000_000)), req.duration()));

        Outcome.Failed failed = (Outcome.Failed) phase(tool, Duration.ofSeconds(5)).measure(p, attached(2));

        assertEquals("ue2", failed.transportFailures().get(0).endpointId());
        assertTrue(failed.violations().isEmpty());
    }
}
