package com.nori.tc.throughput.outcome;

/**
 * 오케스트레이션 단계. 실행 순서 그대로 선언한다.
 */
public enum Phase {
    CONFIGURE,
    ATTACH,
    MEASURE,
    TEARDOWN
}
