package com.nori.tc.throughput.testbed;

import java.util.Objects;

/**
 * attach 결과 메타데이터. 측정 단계에서 트래픽 대상 지정에 사용한다.
 *
 * @param endpointId  UE id
 * @param ipv4Address core network가 할당한 주소
 */
public record AttachInfo(String endpointId, String ipv4Address) {

    public AttachInfo {
        Objects.requireNonNull(endpointId, "endpointId must not be null");
        Objects.requireNonNull(ipv4Address, "ipv4Address must not be null");
        if (ipv4Address.isBlank()) {
            throw new IllegalArgumentException("ipv4Address is blank");
        }
    }
}
