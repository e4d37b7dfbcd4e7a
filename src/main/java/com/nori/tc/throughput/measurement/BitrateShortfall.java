package com.nori.tc.throughput.measurement;

import com.nori.tc.throughput.scenario.TrafficDirection;

import java.util.Objects;

/**
 * 목표 대비 부족분.
 *
 * shortfall = (target - measured) / target
 * - 목표를 넘으면 음수가 될 수 있다.
 * - tolerance와의 비교는 닫힌 상한: shortfall == tolerance는 통과.
 */
public record BitrateShortfall(TrafficDirection direction,
                               String endpointId,
                               long targetBitrateBps,
                               long measuredBitrateBps,
                               double shortfall) {

    public BitrateShortfall {
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(endpointId, "endpointId must not be null");
    }

    public static BitrateShortfall of(TrafficDirection direction, String endpointId, long targetBps, long measuredBps) {
        if (targetBps <= 0) {
            throw new IllegalArgumentException("targetBps must be > 0, but was: " + targetBps);
        }
        double shortfall = (double) (targetBps - measuredBps) / (double) targetBps;
        return new BitrateShortfall(direction, endpointId, targetBps, measuredBps, shortfall);
    }

    public boolean withinTolerance(double toleranceFraction) {
        return shortfall <= toleranceFraction;
    }
}
