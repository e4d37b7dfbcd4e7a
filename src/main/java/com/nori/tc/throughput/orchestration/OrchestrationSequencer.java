package com.nori.tc.throughput.orchestration;

import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.measurement.TrafficMeasurementPhase;
import com.nori.tc.throughput.outcome.Outcome;
import com.nori.tc.throughput.outcome.Phase;
import com.nori.tc.throughput.scenario.ArtifactPolicy;
import com.nori.tc.throughput.scenario.ScenarioParameters;
import com.nori.tc.throughput.testbed.AttachInfo;
import com.nori.tc.throughput.testbed.Configurator;
import com.nori.tc.throughput.testbed.EndpointSet;
import com.nori.tc.throughput.testbed.NetworkElement;
import com.nori.tc.throughput.testbed.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * OrchestrationSequencer
 *
 * 역할:
 * - throughput 시나리오 1회의 수명주기를 순서대로 실행한다.
 *   1) CONFIGURE: configurator.apply(parameters). 거부 시 ERROR, 재시도 없음.
 *   2) ATTACH   : UE를 순서대로 attach. 첫 실패에서 중단 → ERROR.
 *   3) MEASURE  : TrafficMeasurementPhase에 위임. 그 판정이 잠정 결과가 된다.
 *   4) TEARDOWN : 1~3의 결과와 무관하게 정확히 1회.
 *                 attach된 UE detach → base station / core network stop → 아티팩트 수집 요청.
 *
 * teardown 보장:
 * - attach 결과는 AttachedEndpoints(try-with-resources)가 소유하므로 detach는 구조적으로 보장된다.
 * - stop/아티팩트 수집은 바깥 finally에서 수행한다.
 * - teardown 오류는 경고(warnings)로만 남고 판정을 바꾸거나 앞 단계 오류를 가리지 않는다.
 *
 * 상태:
 * - 실행 간 공유 상태 없음. 협력자는 생성자로, EndpointSet은 run 인자로 받는다.
 */
public final class OrchestrationSequencer {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationSequencer.class);

    private static final String ADHOC_SCENARIO_ID = "adhoc";

    private final Configurator configurator;
    private final TrafficMeasurementPhase measurementPhase;
    private final Reporter reporter;
    private final ExecutorService executor;
    private final Duration attachTimeout;
    private final Duration detachTimeout;

    public OrchestrationSequencer(Configurator configurator,
                                  TrafficMeasurementPhase measurementPhase,
                                  Reporter reporter,
                                  ExecutorService executor,
                                  Duration attachTimeout,
                                  Duration detachTimeout) {
        this.configurator = Objects.requireNonNull(configurator, "configurator must not be null");
        this.measurementPhase = Objects.requireNonNull(measurementPhase, "measurementPhase must not be null");
        this.reporter = (reporter == null) ? Reporter.NOOP : reporter;
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.attachTimeout = Objects.requireNonNull(attachTimeout, "attachTimeout must not be null");
        this.detachTimeout = Objects.requireNonNull(detachTimeout, "detachTimeout must not be null");
    }

    public Outcome run(ScenarioParameters parameters, EndpointSet endpoints) {
        return run(ADHOC_SCENARIO_ID, parameters, endpoints);
    }

    public Outcome run(String scenarioId, ScenarioParameters parameters, EndpointSet endpoints) {
        Objects.requireNonNull(scenarioId, "scenarioId must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        Objects.requireNonNull(endpoints, "endpoints must not be null");

        log.info(StructuredLog.event("scenario_started",
                "scenarioId", scenarioId,
                "parameters", parameters,
                "ueCount", endpoints.size()));

        AttachedEndpoints attached = new AttachedEndpoints(endpoints, executor, attachTimeout, detachTimeout);
        Outcome outcome = null;
        try {
            try (attached) {
                outcome = runPhases(scenarioId, parameters, attached);
            }
        } finally {
            outcome = finishTeardown(scenarioId, parameters, endpoints, attached, outcome);
        }

        log.info(StructuredLog.event("scenario_finished",
                "scenarioId", scenarioId,
                "verdict", outcome.verdict(),
                "detail", outcome.describe(),
                "warnings", outcome.warnings().size()));
        return outcome;
    }

    // ─── 1~3 단계 ─────────────────────────────────────────────────────────────

    private Outcome runPhases(String scenarioId, ScenarioParameters parameters, AttachedEndpoints attached) {
        Phase phase = Phase.CONFIGURE;
        try {
            log.info(StructuredLog.event("phase_started", "scenarioId", scenarioId, "phase", phase));
            configurator.apply(parameters);

            phase = Phase.ATTACH;
            log.info(StructuredLog.event("phase_started", "scenarioId", scenarioId, "phase", phase));
            List<AttachInfo> infos = attached.attachAll();

            phase = Phase.MEASURE;
            log.info(StructuredLog.event("phase_started", "scenarioId", scenarioId, "phase", phase));
            return measurementPhase.measure(parameters, infos);
        } catch (RuntimeException ex) {
            log.error(StructuredLog.event("phase_failed",
                    "scenarioId", scenarioId,
                    "phase", phase,
                    "attachedCount", attached.getAttachedCount(),
                    "error", ex.getClass().getSimpleName(),
                    "detail", ex.getMessage()), ex);
            return new Outcome.Errored(phase, ex);
        }
    }

    // ─── 4단계: teardown ─────────────────────────────────────────────────────

    /**
     * detach(AttachedEndpoints.close) 이후의 나머지 teardown.
     *
     * @param provisional 1~3 단계 결과. Error 계열 Throwable로 빠져나온 경우에만 null.
     * @return 경고가 합쳐진 최종 결과 (provisional이 null이면 null)
     */
    private Outcome finishTeardown(String scenarioId,
                                   ScenarioParameters parameters,
                                   EndpointSet endpoints,
                                   AttachedEndpoints attached,
                                   Outcome provisional) {
        List<String> warnings = new ArrayList<>(attached.getTeardownWarnings());
        stopElement(scenarioId, endpoints.getBaseStation(), warnings);
        stopElement(scenarioId, endpoints.getCoreNetwork(), warnings);

        if (provisional == null) {
            log.error(StructuredLog.event("teardown_without_outcome",
                    "scenarioId", scenarioId,
                    "warnings", warnings));
            return null;
        }

        Outcome outcome = provisional.withWarnings(warnings);

        ArtifactPolicy policy = parameters.getArtifactPolicy();
        if (policy.shouldCollect(outcome.isPassed())) {
            try {
                reporter.collectArtifacts(policy, outcome);
            } catch (RuntimeException ex) {
                String w = "artifact collection failed: " + ex;
                log.warn(StructuredLog.event("teardown_warning", "scenarioId", scenarioId, "detail", w), ex);
                outcome = outcome.withWarnings(List.of(w));
            }
        }

        log.info(StructuredLog.event("teardown_completed",
                "scenarioId", scenarioId,
                "detached", attached.getAttachedCount(),
                "artifactsCollected", policy.shouldCollect(outcome.isPassed()),
                "warnings", outcome.warnings().size()));
        return outcome;
    }

    private static void stopElement(String scenarioId, NetworkElement element, List<String> warnings) {
        try {
            element.stop();
        } catch (RuntimeException ex) {
            String w = element.getId() + ": stop failed: " + ex;
            warnings.add(w);
            log.warn(StructuredLog.event("teardown_warning", "scenarioId", scenarioId, "detail", w), ex);
        }
    }
}
