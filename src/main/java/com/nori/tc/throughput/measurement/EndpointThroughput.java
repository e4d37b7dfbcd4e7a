package com.nori.tc.throughput.measurement;

import java.util.Objects;

/**
 * UE 1대의 한 방향 측정값.
 *
 * @param endpointId          UE id
 * @param measuredBitrateBps  달성 bitrate (bit/s)
 */
public record EndpointThroughput(String endpointId, long measuredBitrateBps) {

    public EndpointThroughput {
        Objects.requireNonNull(endpointId, "endpointId must not be null");
        if (measuredBitrateBps < 0) {
            throw new IllegalArgumentException("measuredBitrateBps must be >= 0, but was: " + measuredBitrateBps);
        }
    }
}
