package com.nori.tc.throughput.testbed;

import com.nori.tc.throughput.scenario.TrafficDirection;

import java.util.Objects;

/**
 * 트래픽 도구 수준의 전송 실패(연결 불가, 세션 비정상 종료 등).
 * 측정 실패(FAIL)로 취급하며 인프라 에러가 아니다.
 */
public class TransportException extends TestBedException {

    private final TrafficDirection direction;
    private final String endpointId;

    public TransportException(TrafficDirection direction, String endpointId, String message) {
        this(direction, endpointId, message, null);
    }

    public TransportException(TrafficDirection direction, String endpointId, String message, Throwable cause) {
        super(message, cause);
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.endpointId = endpointId;
    }

    public TrafficDirection getDirection() {
        return direction;
    }

    /** 특정 UE로 좁힐 수 없으면 null */
    public String getEndpointId() {
        return endpointId;
    }
}
