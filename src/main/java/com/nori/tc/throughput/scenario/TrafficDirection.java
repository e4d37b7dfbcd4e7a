package com.nori.tc.throughput.scenario;

import java.util.List;

/**
 * 트래픽 방향
 *
 * - DOWNLINK: core network → UE
 * - UPLINK  : UE → core network
 * - BIDIRECTIONAL: 두 방향을 같은 구간 동안 동시에 측정한다.
 */
public enum TrafficDirection {
    DOWNLINK,
    UPLINK,
    BIDIRECTIONAL;

    /**
     * 실제로 측정(세션 생성)해야 하는 단방향 목록.
     * BIDIRECTIONAL은 UPLINK/DOWNLINK 두 세션으로 풀어서 실행한다.
     */
    public List<TrafficDirection> exercised() {
        return switch (this) {
            case DOWNLINK -> List.of(DOWNLINK);
            case UPLINK -> List.of(UPLINK);
            case BIDIRECTIONAL -> List.of(UPLINK, DOWNLINK);
        };
    }
}
