package com.nori.tc.throughput.outcome;

import com.nori.tc.throughput.scenario.TrafficDirection;

import java.util.Objects;

/**
 * 전송 수준 실패 진단 정보.
 *
 * @param endpointId 특정 UE로 좁힐 수 없으면 null
 */
public record TransportFailure(TrafficDirection direction, String endpointId, String detail) {

    public TransportFailure {
        Objects.requireNonNull(direction, "direction must not be null");
        detail = (detail == null || detail.isBlank()) ? "transport error" : detail;
    }
}
