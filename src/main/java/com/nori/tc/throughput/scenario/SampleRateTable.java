package com.nori.tc.throughput.scenario;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 채널 대역폭(MHz) → 최소 sample rate(Hz) 조회 테이블.
 *
 * - 값 자체는 tc.throughput.sample-rates.* 설정에서 주입된다.
 * - 테이블에 없는 대역폭을 조회하면 시나리오 구성 오류로 본다.
 */
public final class SampleRateTable {

    private final Map<Integer, Integer> minimumByBandwidthMHz;

    public SampleRateTable(Map<Integer, Integer> minimumByBandwidthMHz) {
        Map<Integer, Integer> tmp = new TreeMap<>();
        if (minimumByBandwidthMHz != null) {
            for (Map.Entry<Integer, Integer> e : minimumByBandwidthMHz.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                if (e.getValue() <= 0) {
                    throw new IllegalStateException("tc.throughput.sample-rates." + e.getKey() + " must be > 0");
                }
                tmp.put(e.getKey(), e.getValue());
            }
        }
        this.minimumByBandwidthMHz = Collections.unmodifiableMap(tmp);
    }

    public int minimumForBandwidth(int bandwidthMHz) {
        Integer rate = minimumByBandwidthMHz.get(bandwidthMHz);
        if (rate == null) {
            throw new IllegalStateException("no minimum sample rate configured for bandwidth " + bandwidthMHz
                    + "MHz (tc.throughput.sample-rates." + bandwidthMHz + ")");
        }
        return rate;
    }

    public Map<Integer, Integer> asMap() {
        return minimumByBandwidthMHz;
    }
}
