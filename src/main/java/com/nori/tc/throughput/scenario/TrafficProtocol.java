package com.nori.tc.throughput.scenario;

/**
 * 트래픽 생성기 전송 프로토콜.
 */
public enum TrafficProtocol {
    UDP,
    TCP
}
