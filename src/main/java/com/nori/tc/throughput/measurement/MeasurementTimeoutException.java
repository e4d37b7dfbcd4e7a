package com.nori.tc.throughput.measurement;

import com.nori.tc.throughput.testbed.TestBedException;

import java.time.Duration;

/**
 * 측정 단계가 duration + grace 안에 끝나지 않았다.
 * bitrate 미달(FAIL)과 구분되는 인프라 에러다.
 */
public class MeasurementTimeoutException extends TestBedException {

    private final Duration limit;

    public MeasurementTimeoutException(Duration limit) {
        super("traffic measurement did not complete within " + limit.toMillis() + "ms");
        this.limit = limit;
    }

    public Duration getLimit() {
        return limit;
    }
}
