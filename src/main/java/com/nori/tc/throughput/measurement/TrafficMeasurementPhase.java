package com.nori.tc.throughput.measurement;

import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.outcome.Outcome;
import com.nori.tc.throughput.outcome.TransportFailure;
import com.nori.tc.throughput.scenario.ScenarioParameters;
import com.nori.tc.throughput.scenario.TrafficDirection;
import com.nori.tc.throughput.testbed.AttachInfo;
import com.nori.tc.throughput.testbed.TrafficTool;
import com.nori.tc.throughput.testbed.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * TrafficMeasurementPhase
 *
 * 역할:
 * - 측정 방향별로 트래픽 세션을 띄우고, 결과를 PASS/FAIL 판정으로 축약한다.
 *
 * 실행:
 * - DOWNLINK/UPLINK: 세션 1개
 * - BIDIRECTIONAL  : UPLINK/DOWNLINK 세션 2개를 같은 구간에 동시 실행, 둘 다 끝날 때까지 대기
 * - 전체 제한 시간 = durationSeconds + grace. 초과 시 남은 세션을 취소(interrupt)하고
 *   MeasurementTimeoutException을 던진다(인프라 에러, FAIL 아님).
 *
 * 판정:
 * - 전송 실패(TransportException 또는 transportOk=false)가 하나라도 있으면 FAIL
 * - tolerance > 0이면 UE별/방향별 shortfall = (target - measured) / target 을 계산하여
 *   shortfall > tolerance 인 항목이 있으면 FAIL (shortfall == tolerance는 통과)
 * - tolerance == 0이면 bitrate 검증을 건너뛴다. 측정값은 로그/결과에 남긴다.
 */
public final class TrafficMeasurementPhase {

    private static final Logger log = LoggerFactory.getLogger(TrafficMeasurementPhase.class);

    private final TrafficTool trafficTool;
    private final ExecutorService executor;
    private final Duration grace;

    /**
     * @param trafficTool 트래픽 생성/측정 도구
     * @param executor    세션 실행용 (BIDIRECTIONAL 동시 실행을 위해 최소 2 스레드 필요)
     * @param grace       duration에 더해지는 여유 시간
     */
    public TrafficMeasurementPhase(TrafficTool trafficTool, ExecutorService executor, Duration grace) {
        this.trafficTool = Objects.requireNonNull(trafficTool, "trafficTool must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.grace = Objects.requireNonNull(grace, "grace must not be null");
        if (grace.isNegative()) {
            throw new IllegalArgumentException("grace must be >= 0, but was: " + grace);
        }
    }

    public Outcome measure(ScenarioParameters parameters, List<AttachInfo> attached) {
        Objects.requireNonNull(parameters, "parameters must not be null");
        Objects.requireNonNull(attached, "attached must not be null");
        if (attached.isEmpty()) {
            throw new IllegalArgumentException("no attached endpoints to measure");
        }

        Duration limit = parameters.getDuration().plus(grace);

        log.info(StructuredLog.event("measurement_started",
                "direction", parameters.getDirection(),
                "protocol", parameters.getProtocol(),
                "targetBps", parameters.getTargetBitrateBps(),
                "duration", parameters.getDuration(),
                "limit", limit,
                "ueCount", attached.size(),
                "tolerance", parameters.getBitrateToleranceFraction()));

        List<MeasurementResult> results = new ArrayList<>();
        List<TransportFailure> transportFailures = new ArrayList<>();
        collectSessions(parameters, attached, limit, results, transportFailures);

        return judge(parameters, attached, results, transportFailures);
    }

    // ─── 세션 실행 ────────────────────────────────────────────────────────────

    private void collectSessions(ScenarioParameters parameters,
                                 List<AttachInfo> attached,
                                 Duration limit,
                                 List<MeasurementResult> results,
                                 List<TransportFailure> transportFailures) {
        long deadlineNanos = System.nanoTime() + limit.toNanos();

        Map<TrafficDirection, Future<MeasurementResult>> sessions = new LinkedHashMap<>();
        try {
            for (TrafficDirection dir : parameters.getDirection().exercised()) {
                TrafficRequest request = new TrafficRequest(
                        dir,
                        parameters.getProtocol(),
                        parameters.getTargetBitrateBps(),
                        parameters.getDuration(),
                        attached);
                sessions.put(dir, executor.submit(() -> trafficTool.run(request)));
            }

            for (Map.Entry<TrafficDirection, Future<MeasurementResult>> e : sessions.entrySet()) {
                long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
                try {
                    results.add(e.getValue().get(remaining, TimeUnit.NANOSECONDS));
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause();
                    if (cause instanceof TransportException te) {
                        log.warn(StructuredLog.event("measurement_transport_error",
                                "direction", te.getDirection(),
                                "ueId", te.getEndpointId(),
                                "detail", te.getMessage()));
                        transportFailures.add(new TransportFailure(te.getDirection(), te.getEndpointId(), te.getMessage()));
                    } else if (cause instanceof RuntimeException re) {
                        throw re;
                    } else {
                        throw new IllegalStateException("traffic session failed: " + e.getKey(), cause);
                    }
                } catch (TimeoutException ex) {
                    log.error(StructuredLog.event("measurement_timeout",
                            "direction", e.getKey(),
                            "limit", limit));
                    throw new MeasurementTimeoutException(limit);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for traffic sessions", ex);
        } finally {
            // 정상 완료된 세션에는 영향 없음. 타임아웃/예외 경로에서 남은 세션을 끊는다.
            for (Future<MeasurementResult> f : sessions.values()) {
                if (!f.isDone()) {
                    f.cancel(true);
                }
            }
        }
    }

    // ─── 판정 ─────────────────────────────────────────────────────────────────

    private Outcome judge(ScenarioParameters parameters,
                          List<AttachInfo> attached,
                          List<MeasurementResult> results,
                          List<TransportFailure> transportFailures) {
        boolean checkBitrate = parameters.isBitrateCheckEnabled();
        double tolerance = parameters.getBitrateToleranceFraction();
        long target = parameters.getTargetBitrateBps();

        List<BitrateShortfall> violations = new ArrayList<>();

        for (MeasurementResult result : results) {
            if (!result.transportOk()) {
                transportFailures.add(new TransportFailure(result.direction(), null, result.transportDetail()));
            }

            Set<String> reported = new HashSet<>();
            for (EndpointThroughput tp : result.throughputs()) {
                reported.add(tp.endpointId());
                BitrateShortfall sf = BitrateShortfall.of(result.direction(), tp.endpointId(), target, tp.measuredBitrateBps());
                boolean ok = !checkBitrate || sf.withinTolerance(tolerance);

                log.info(StructuredLog.event("measurement_direction_result",
                        "direction", result.direction(),
                        "ueId", tp.endpointId(),
                        "targetBps", target,
                        "measuredBps", tp.measuredBitrateBps(),
                        "shortfall", sf.shortfall(),
                        "checked", checkBitrate,
                        "ok", ok,
                        "elapsed", result.elapsed()));

                if (!ok) {
                    violations.add(sf);
                }
            }

            // 결과에서 빠진 UE는 전송 수준 실패로 본다(측정 자체가 없음).
            for (AttachInfo info : attached) {
                if (!reported.contains(info.endpointId())) {
                    transportFailures.add(new TransportFailure(result.direction(), info.endpointId(),
                            "no measurement reported"));
                }
            }
        }

        Outcome outcome = (violations.isEmpty() && transportFailures.isEmpty())
                ? new Outcome.Passed(results)
                : new Outcome.Failed(violations, transportFailures, results);

        log.info(StructuredLog.event("measurement_verdict",
                "verdict", outcome.verdict(),
                "bitrateChecked", checkBitrate,
                "violations", violations.size(),
                "transportFailures", transportFailures.size()));

        return outcome;
    }
}
