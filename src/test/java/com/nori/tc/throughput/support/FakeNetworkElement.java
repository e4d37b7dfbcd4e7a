package com.nori.tc.throughput.support;

import com.nori.tc.throughput.testbed.BaseStation;
import com.nori.tc.throughput.testbed.CoreNetwork;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * gNB / 코어 겸용 fake. stop 호출 횟수만 센다.
 */
public class FakeNetworkElement implements BaseStation, CoreNetwork {

    private final String id;
    private final AtomicInteger stopCalls = new AtomicInteger();
    private volatile boolean failOnStop = false;

    public FakeNetworkElement(String id) {
        this.id = id;
    }

    public FakeNetworkElement failingOnStop() {
        this.failOnStop = true;
        return this;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void stop() {
        stopCalls.incrementAndGet();
        if (failOnStop) {
            throw new IllegalStateException(id + " refused to stop");
        }
    }

    public int getStopCalls() {
        return stopCalls.get();
    }
}
