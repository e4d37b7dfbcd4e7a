package com.nori.tc.throughput.measurement;

import com.nori.tc.throughput.scenario.TrafficDirection;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 단방향 세션 1회의 측정 결과.
 *
 * - transportOk=false면 throughputs 값과 무관하게 FAIL 판정 대상이다.
 * - 검증 단계에서 한 번 소비되고, 결과(Outcome)에 진단용으로만 남는다.
 *
 * @param transportDetail transportOk=false일 때 원인 설명, 정상이면 null
 */
public record MeasurementResult(TrafficDirection direction,
                                List<EndpointThroughput> throughputs,
                                Duration elapsed,
                                boolean transportOk,
                                String transportDetail) {

    public MeasurementResult {
        Objects.requireNonNull(direction, "direction must not be null");
        throughputs = List.copyOf(Objects.requireNonNull(throughputs, "throughputs must not be null"));
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static MeasurementResult ok(TrafficDirection direction, List<EndpointThroughput> throughputs, Duration elapsed) {
        return new MeasurementResult(direction, throughputs, elapsed, true, null);
    }

    public static MeasurementResult transportFailed(TrafficDirection direction,
                                                    List<EndpointThroughput> throughputs,
                                                    Duration elapsed,
                                                    String detail) {
        return new MeasurementResult(direction, throughputs, elapsed, false, detail);
    }
}
