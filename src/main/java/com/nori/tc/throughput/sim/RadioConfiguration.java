package com.nori.tc.throughput.sim;

import com.nori.tc.throughput.scenario.TimeAlignmentCalibration;

import java.util.Objects;

/**
 * configurator가 base station에 반영한 최종 radio 설정.
 * 같은 시나리오 파라미터에서는 항상 equals인 값이 나온다.
 *
 * @param sampleRateHz 파라미터에 없으면 대역폭 기준 최소 sample rate로 채워진다
 */
public record RadioConfiguration(int band,
                                 int subcarrierSpacingKHz,
                                 int bandwidthMHz,
                                 int sampleRateHz,
                                 int timingAdvance,
                                 TimeAlignmentCalibration timeAlignmentCalibration,
                                 boolean pcap) {

    public RadioConfiguration {
        Objects.requireNonNull(timeAlignmentCalibration, "timeAlignmentCalibration must not be null");
    }
}
