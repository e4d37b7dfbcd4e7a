package com.nori.tc.throughput.testbed;

/**
 * 코어망(EPC/5GC) 핸들. 트래픽 세션의 core 측 종단이기도 하다.
 */
public interface CoreNetwork extends NetworkElement {
}
