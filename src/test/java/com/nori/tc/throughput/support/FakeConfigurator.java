package com.nori.tc.throughput.support;

import com.nori.tc.throughput.scenario.ScenarioParameters;
import com.nori.tc.throughput.testbed.ConfigurationException;
import com.nori.tc.throughput.testbed.Configurator;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class FakeConfigurator implements Configurator {

    private final List<ScenarioParameters> applied = new CopyOnWriteArrayList<>();
    private volatile String rejectWith;

    public static FakeConfigurator rejecting(String message) {
        FakeConfigurator c = new FakeConfigurator();
        c.rejectWith = message;
        return c;
    }

    @Override
    public void apply(ScenarioParameters parameters) {
        applied.add(parameters);
        if (rejectWith != null) {
            throw new ConfigurationException(rejectWith);
        }
    }

    public List<ScenarioParameters> getApplied() {
        return applied;
    }
}
