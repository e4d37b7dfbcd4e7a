package com.nori.tc.throughput.sim;

import com.nori.tc.throughput.testbed.EndpointSet;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 시나리오 1회분 EndpointSet을 만든다.
 * gNB/코어는 실행마다 새로 만들고, configurator는 공유한다.
 *
 * id 규칙: ue1..ueN, gnb, core
 */
public class SimulatedTestBedFactory {

    private final SimulatedConfigurator configurator;
    private final String addressPrefix;
    private final Duration attachDelay;

    public SimulatedTestBedFactory(SimulatedConfigurator configurator, String addressPrefix, Duration attachDelay) {
        this.configurator = Objects.requireNonNull(configurator, "configurator must not be null");
        this.addressPrefix = Objects.requireNonNull(addressPrefix, "addressPrefix must not be null");
        this.attachDelay = Objects.requireNonNull(attachDelay, "attachDelay must not be null");
    }

    public EndpointSet create(int ueCount) {
        if (ueCount <= 0) {
            throw new IllegalArgumentException("ueCount must be > 0, but was: " + ueCount);
        }
        List<SimulatedUserEndpoint> ues = new ArrayList<>(ueCount);
        for (int i = 1; i <= ueCount; i++) {
            ues.add(new SimulatedUserEndpoint("ue" + i, attachDelay));
        }
        return new EndpointSet(ues,
                new SimulatedBaseStation("gnb", configurator),
                new SimulatedCoreNetwork("core", addressPrefix));
    }
}
