package com.nori.tc.throughput.scenario;

/**
 * 측정 시간 등급(초).
 *
 * - TINY : 생존 확인용
 * - SHORT: 기능 스모크/시뮬레이션 회귀
 * - LONG : 실 RF soak
 */
public enum DurationTier {
    TINY(5),
    SHORT(20),
    LONG(5 * 60);

    private final int seconds;

    DurationTier(int seconds) {
        this.seconds = seconds;
    }

    public int seconds() {
        return seconds;
    }
}
