package com.nori.tc.throughput.testbed;

/**
 * 무선 접속망(gNB) 핸들.
 */
public interface BaseStation extends NetworkElement {
}
