package com.nori.tc.throughput.scenario;

/**
 * 시나리오 분류. CI 파이프라인은 이 값으로 실행 대상을 고른다.
 */
public enum ScenarioCategory {
    /** 상용 단말 1대, 짧은 측정 */
    ANDROID,
    /** 시뮬레이션 무선(ZMQ) 기능 스모크, bitrate 검증 없음 */
    SMOKE,
    /** 시뮬레이션 무선(ZMQ) 회귀 */
    ZMQ,
    /** 실 RF 장시간 soak */
    RF
}
