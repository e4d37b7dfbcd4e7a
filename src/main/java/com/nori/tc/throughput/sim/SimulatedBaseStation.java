package com.nori.tc.throughput.sim;

import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.testbed.AttachException;
import com.nori.tc.throughput.testbed.BaseStation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 시뮬레이션 gNB.
 *
 * - 첫 UE admit 시점에 기동한다. configurator가 아직 설정을 확정하지 않았으면 admit을 거부한다.
 * - stop() 이후에는 admit을 거부한다.
 */
public class SimulatedBaseStation implements BaseStation {

    private static final Logger log = LoggerFactory.getLogger(SimulatedBaseStation.class);

    private final String id;
    private final SimulatedConfigurator configurator;

    private final Set<String> admitted = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public SimulatedBaseStation(String id, SimulatedConfigurator configurator) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.configurator = Objects.requireNonNull(configurator, "configurator must not be null");
    }

    @Override
    public String getId() {
        return id;
    }

    void admit(String ueId) {
        if (stopped.get()) {
            throw new AttachException(ueId, id + " is stopped");
        }
        RadioConfiguration radio = configurator.getCurrent()
                .orElseThrow(() -> new AttachException(ueId, id + " has no radio configuration"));

        if (started.compareAndSet(false, true)) {
            log.info(StructuredLog.event("base_station_started",
                    "id", id,
                    "band", radio.band(),
                    "bandwidthMHz", radio.bandwidthMHz(),
                    "sampleRateHz", radio.sampleRateHz()));
        }
        admitted.add(ueId);
    }

    void release(String ueId) {
        admitted.remove(ueId);
    }

    public int getAdmittedCount() {
        return admitted.size();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) return;
        log.info(StructuredLog.event("base_station_stopped",
                "id", id,
                "started", started.get(),
                "admittedCount", admitted.size()));
    }
}
