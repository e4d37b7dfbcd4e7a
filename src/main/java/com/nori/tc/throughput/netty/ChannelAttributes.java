package com.nori.tc.throughput.netty;

import com.nori.tc.throughput.scenario.TrafficDirection;
import io.netty.util.AttributeKey;

/**
 * Netty Channel Attribute Keys
 *
 * - UE_ID: 세션이 측정 중인 UE id (로그/진단용)
 * - DIRECTION: 세션 방향
 * - ROLE: "sender" / "sink"
 */
public final class ChannelAttributes {

    private ChannelAttributes() {
        // utility class
    }

    public static final AttributeKey<String> UE_ID = AttributeKey.valueOf("tc.throughput.ueId");
    public static final AttributeKey<TrafficDirection> DIRECTION = AttributeKey.valueOf("tc.throughput.direction");
    public static final AttributeKey<String> ROLE = AttributeKey.valueOf("tc.throughput.role");
}
