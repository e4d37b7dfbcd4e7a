package com.nori.tc.throughput.measurement;

import com.nori.tc.throughput.scenario.TrafficDirection;
import com.nori.tc.throughput.scenario.TrafficProtocol;
import com.nori.tc.throughput.testbed.AttachInfo;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 트래픽 도구에 넘기는 단방향 세션 요청.
 *
 * @param direction        UPLINK 또는 DOWNLINK (BIDIRECTIONAL 금지)
 * @param targetBitrateBps UE 1대당 목표 bitrate
 * @param endpoints        attach된 UE 목록(attach 순서)
 */
public record TrafficRequest(TrafficDirection direction,
                             TrafficProtocol protocol,
                             long targetBitrateBps,
                             Duration duration,
                             List<AttachInfo> endpoints) {

    public TrafficRequest {
        Objects.requireNonNull(direction, "direction must not be null");
        if (direction == TrafficDirection.BIDIRECTIONAL) {
            throw new IllegalArgumentException("traffic request must be unidirectional");
        }
        Objects.requireNonNull(protocol, "protocol must not be null");
        if (targetBitrateBps <= 0) {
            throw new IllegalArgumentException("targetBitrateBps must be > 0, but was: " + targetBitrateBps);
        }
        Objects.requireNonNull(duration, "duration must not be null");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration must be > 0, but was: " + duration);
        }
        endpoints = List.copyOf(Objects.requireNonNull(endpoints, "endpoints must not be null"));
        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("endpoints must not be empty");
        }
    }
}
