package com.nori.tc.throughput.suite;

import com.nori.tc.throughput.outcome.Outcome;

import java.time.Duration;
import java.util.Objects;

/**
 * suite에서 시나리오 1개를 실행한 결과.
 */
public record ScenarioResult(String scenarioId, Outcome outcome, Duration elapsed) {

    public ScenarioResult {
        Objects.requireNonNull(scenarioId, "scenarioId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }
}
