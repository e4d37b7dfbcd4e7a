package com.nori.tc.throughput.testbed;

/**
 * base station / core network 공통 핸들.
 * 코어는 생성/파괴하지 않고 teardown 시 stop만 요청한다.
 */
public interface NetworkElement {

    String getId();

    /**
     * best-effort 정지. 실패는 teardown 경고로만 기록된다.
     */
    void stop();
}
