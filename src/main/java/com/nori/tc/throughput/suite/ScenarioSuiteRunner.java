package com.nori.tc.throughput.suite;

import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.orchestration.OrchestrationSequencer;
import com.nori.tc.throughput.outcome.Outcome;
import com.nori.tc.throughput.outcome.Phase;
import com.nori.tc.throughput.outcome.Verdict;
import com.nori.tc.throughput.scenario.ScenarioCatalog;
import com.nori.tc.throughput.scenario.ScenarioCategory;
import com.nori.tc.throughput.scenario.ScenarioDefinition;
import com.nori.tc.throughput.testbed.EndpointSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * ScenarioSuiteRunner
 *
 * 역할:
 * - 카탈로그에서 선택된 시나리오를 순서대로 1개씩 실행하고 결과를 모은다.
 * - 시나리오마다 test bed에서 ueCount대의 EndpointSet을 새로 받는다.
 *
 * 실패 처리:
 * - 한 시나리오의 결과(FAIL/ERROR)는 다음 시나리오 실행을 막지 않는다.
 * - EndpointSet 생성 자체가 실패하면 그 시나리오를 Errored(CONFIGURE)로 기록한다.
 * - 실행 스레드가 interrupt되면 남은 시나리오는 건너뛴다.
 */
public class ScenarioSuiteRunner {

    private static final Logger log = LoggerFactory.getLogger(ScenarioSuiteRunner.class);

    private final ScenarioCatalog catalog;
    private final OrchestrationSequencer sequencer;
    private final IntFunction<EndpointSet> testBed;

    /**
     * @param testBed ueCount → 이번 실행용 EndpointSet
     */
    public ScenarioSuiteRunner(ScenarioCatalog catalog,
                               OrchestrationSequencer sequencer,
                               IntFunction<EndpointSet> testBed) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer must not be null");
        this.testBed = Objects.requireNonNull(testBed, "testBed must not be null");
    }

    public SuiteSummary run(Set<ScenarioCategory> categories, String idPattern) {
        List<ScenarioDefinition> selected = catalog.select(categories, idPattern);

        log.info(StructuredLog.event("suite_started",
                "categories", categories,
                "idPattern", idPattern,
                "selected", selected.size()));

        List<ScenarioResult> results = new ArrayList<>(selected.size());
        int index = 0;
        for (ScenarioDefinition def : selected) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn(StructuredLog.event("suite_interrupted",
                        "completed", results.size(),
                        "selected", selected.size()));
                break;
            }
            index++;
            results.add(runOne(def, index, selected.size()));
        }

        SuiteSummary summary = new SuiteSummary(results);
        log.info(StructuredLog.event("suite_finished",
                "total", results.size(),
                "passed", summary.count(Verdict.PASS),
                "failed", summary.count(Verdict.FAIL),
                "errored", summary.count(Verdict.ERROR),
                "exitCode", summary.exitCode()));
        return summary;
    }

    private ScenarioResult runOne(ScenarioDefinition def, int index, int total) {
        long startNanos = System.nanoTime();
        Outcome outcome;
        try {
            EndpointSet endpoints = testBed.apply(def.ueCount());
            outcome = sequencer.run(def.id(), def.parameters(), endpoints);
        } catch (RuntimeException ex) {
            log.error(StructuredLog.event("suite_scenario_setup_failed",
                    "scenarioId", def.id(),
                    "detail", ex.getMessage()), ex);
            outcome = new Outcome.Errored(Phase.CONFIGURE, ex);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        log.info(StructuredLog.event("suite_progress",
                "scenarioId", def.id(),
                "index", index,
                "total", total,
                "verdict", outcome.verdict(),
                "elapsed", elapsed));
        return new ScenarioResult(def.id(), outcome, elapsed);
    }
}
