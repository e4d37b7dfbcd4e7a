package com.nori.tc.throughput.scenario;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * time alignment calibration 힌트.
 *
 * - 정수 값 또는 "auto"
 * - configurator에 그대로 전달되며 코어는 해석하지 않는다.
 */
public final class TimeAlignmentCalibration {

    public static final TimeAlignmentCalibration AUTO = new TimeAlignmentCalibration(null);

    private final Integer value;

    private TimeAlignmentCalibration(Integer value) {
        this.value = value;
    }

    public static TimeAlignmentCalibration of(int value) {
        return new TimeAlignmentCalibration(value);
    }

    /**
     * "auto" (대소문자 무시) 또는 정수 문자열을 파싱한다.
     */
    public static TimeAlignmentCalibration parse(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("time alignment calibration is blank");
        }
        String v = s.trim();
        if (v.equalsIgnoreCase("auto")) {
            return AUTO;
        }
        try {
            return of(Integer.parseInt(v));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("time alignment calibration must be an integer or 'auto', but was: " + s, e);
        }
    }

    public boolean isAuto() {
        return value == null;
    }

    public OptionalInt value() {
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeAlignmentCalibration other)) return false;
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "auto" : String.valueOf(value);
    }
}
