package com.nori.tc.throughput.suite;

import com.nori.tc.throughput.outcome.Outcome;
import com.nori.tc.throughput.outcome.Phase;
import com.nori.tc.throughput.outcome.Verdict;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SuiteSummaryTests {

    private static ScenarioResult result(String id, Outcome outcome) {
        return new ScenarioResult(id, outcome, Duration.ofMillis(10));
    }

    @Test
    void all_passed_exits_zero() {
        SuiteSummary summary = new SuiteSummary(List.of(
                result("a", new Outcome.Passed(List.of())),
                result("b", new Outcome.Passed(List.of(), List.of("ue1: detach timed out")))));

        assertEquals(2, summary.count(Verdict.PASS));
        assertEquals(0, summary.exitCode());
    }

    @Test
    void any_error_exits_one() {
        SuiteSummary summary = new SuiteSummary(List.of(
                result("a", new Outcome.Passed(List.of())),
                result("b", new Outcome.Errored(Phase.ATTACH, new IllegalStateException("x")))));

        assertEquals(1, summary.count(Verdict.ERROR));
        assertEquals(1, summary.exitCode());
    }
}
