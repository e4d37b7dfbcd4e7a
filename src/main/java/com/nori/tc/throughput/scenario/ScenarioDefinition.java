package com.nori.tc.throughput.scenario;

import java.util.Objects;

/**
 * 시나리오 테이블의 한 행.
 *
 * @param id         사람이 읽을 수 있는 고유 id (예: zmq/band:3-scs:15-bandwidth:20-bitrate:15000000-artifacts:false-tcp-uplink)
 * @param category   CI 선택용 분류
 * @param ueCount    test bed에서 준비해야 하는 UE 수
 * @param parameters 실행 파라미터
 */
public record ScenarioDefinition(String id, ScenarioCategory category, int ueCount, ScenarioParameters parameters) {

    public ScenarioDefinition {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id is blank");
        }
        Objects.requireNonNull(category, "category must not be null");
        if (ueCount <= 0) {
            throw new IllegalArgumentException("ueCount must be > 0, but was: " + ueCount);
        }
        Objects.requireNonNull(parameters, "parameters must not be null");
    }

    @Override
    public String toString() {
        return id;
    }
}
