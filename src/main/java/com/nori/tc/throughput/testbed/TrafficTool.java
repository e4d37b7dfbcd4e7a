package com.nori.tc.throughput.testbed;

import com.nori.tc.throughput.measurement.MeasurementResult;
import com.nori.tc.throughput.measurement.TrafficRequest;

/**
 * 트래픽 생성/측정 도구 (iperf 등).
 *
 * 계약:
 * - request.direction()은 항상 단방향(UPLINK/DOWNLINK)이다.
 * - 요청된 duration 동안 블로킹하며, interrupt되면 세션을 정리하고 반환/예외를 던진다.
 * - 세션 자체를 성립시키지 못하면 TransportException.
 */
public interface TrafficTool {

    MeasurementResult run(TrafficRequest request);
}
