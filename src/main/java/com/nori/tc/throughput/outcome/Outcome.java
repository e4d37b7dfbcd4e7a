package com.nori.tc.throughput.outcome;

import com.nori.tc.throughput.measurement.BitrateShortfall;
import com.nori.tc.throughput.measurement.MeasurementResult;
import com.nori.tc.throughput.logging.StructuredLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome
 *
 * 시나리오 1회 실행의 결과 값.
 *
 * - Passed : 측정 통과. tolerance=0이어도 측정값은 관측용으로 남긴다.
 * - Failed : 측정 실패. bitrate 위반 목록 또는 전송 실패 목록이 최소 하나 존재한다.
 * - Errored: 인프라 에러. 실패한 단계와 원인 예외를 보존한다.
 *
 * warnings:
 * - teardown 중 발생한 정리 실패 등. 판정(verdict)에는 영향을 주지 않는다.
 */
public sealed interface Outcome permits Outcome.Passed, Outcome.Failed, Outcome.Errored {

    Verdict verdict();

    List<String> warnings();

    /**
     * 경고를 덧붙인 새 Outcome을 돌려준다. 판정은 그대로 유지된다.
     */
    Outcome withWarnings(List<String> extra);

    String describe();

    default boolean isPassed() {
        return verdict() == Verdict.PASS;
    }

    /**
     * 테스트 러너 경계에서 결과를 표면화한다.
     * - PASS  : 아무것도 하지 않는다.
     * - FAIL  : ThroughputAssertionError (러너 기준 "실패")
     * - ERROR : 원인 예외를 그대로 다시 던진다 (러너 기준 "에러")
     */
    default void raiseIfNotPassed() {
        if (this instanceof Failed failed) {
            throw new ThroughputAssertionError(failed);
        }
        if (this instanceof Errored errored) {
            Throwable cause = errored.cause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(errored.describe(), cause);
        }
    }

    // ─── 구현 ─────────────────────────────────────────────────────────────────

    record Passed(List<MeasurementResult> measurements, List<String> warnings) implements Outcome {

        public Passed {
            measurements = List.copyOf(Objects.requireNonNull(measurements, "measurements must not be null"));
            warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
        }

        public Passed(List<MeasurementResult> measurements) {
            this(measurements, List.of());
        }

        @Override
        public Verdict verdict() {
            return Verdict.PASS;
        }

        @Override
        public Outcome withWarnings(List<String> extra) {
            return new Passed(measurements, concat(warnings, extra));
        }

        @Override
        public String describe() {
            return StructuredLog.kv("verdict", verdict(), "directions", measurements.size(), "warnings", warnings.size());
        }
    }

    record Failed(List<BitrateShortfall> violations,
                  List<TransportFailure> transportFailures,
                  List<MeasurementResult> measurements,
                  List<String> warnings) implements Outcome {

        public Failed {
            violations = List.copyOf(Objects.requireNonNull(violations, "violations must not be null"));
            transportFailures = List.copyOf(Objects.requireNonNull(transportFailures, "transportFailures must not be null"));
            measurements = List.copyOf(Objects.requireNonNull(measurements, "measurements must not be null"));
            warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
            if (violations.isEmpty() && transportFailures.isEmpty()) {
                throw new IllegalArgumentException("failed outcome requires at least one violation or transport failure");
            }
        }

        public Failed(List<BitrateShortfall> violations, List<TransportFailure> transportFailures, List<MeasurementResult> measurements) {
            this(violations, transportFailures, measurements, List.of());
        }

        @Override
        public Verdict verdict() {
            return Verdict.FAIL;
        }

        @Override
        public Outcome withWarnings(List<String> extra) {
            return new Failed(violations, transportFailures, measurements, concat(warnings, extra));
        }

        @Override
        public String describe() {
            StringBuilder sb = new StringBuilder("throughput check failed");
            for (TransportFailure tf : transportFailures) {
                sb.append("; transport ").append(tf.direction())
                        .append(tf.endpointId() == null ? "" : " ue=" + tf.endpointId())
                        .append(": ").append(tf.detail());
            }
            for (BitrateShortfall v : violations) {
                sb.append("; ").append(StructuredLog.kv(
                        "direction", v.direction(),
                        "ue", v.endpointId(),
                        "targetBps", v.targetBitrateBps(),
                        "measuredBps", v.measuredBitrateBps(),
                        "shortfall", v.shortfall()));
            }
            return sb.toString();
        }
    }

    record Errored(Phase phase, Throwable cause, List<String> warnings) implements Outcome {

        public Errored {
            Objects.requireNonNull(phase, "phase must not be null");
            Objects.requireNonNull(cause, "cause must not be null");
            warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
        }

        public Errored(Phase phase, Throwable cause) {
            this(phase, cause, List.of());
        }

        @Override
        public Verdict verdict() {
            return Verdict.ERROR;
        }

        @Override
        public Outcome withWarnings(List<String> extra) {
            return new Errored(phase, cause, concat(warnings, extra));
        }

        @Override
        public String describe() {
            return phase + " error: " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
        }
    }

    private static List<String> concat(List<String> a, List<String> b) {
        if (b == null || b.isEmpty()) {
            return a;
        }
        List<String> out = new ArrayList<>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }
}
