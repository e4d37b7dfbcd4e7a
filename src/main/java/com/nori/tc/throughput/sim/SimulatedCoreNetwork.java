package com.nori.tc.throughput.sim;

import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.testbed.AttachException;
import com.nori.tc.throughput.testbed.CoreNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 시뮬레이션 5GC.
 *
 * 주소 할당:
 * - prefix + host (host 2..254). 해제된 주소는 재사용하지 않는다(1회 실행 동안).
 */
public class SimulatedCoreNetwork implements CoreNetwork {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCoreNetwork.class);

    private static final int FIRST_HOST = 2;
    private static final int LAST_HOST = 254;

    private final String id;
    private final String addressPrefix;

    private final Map<String, String> addressByUe = new LinkedHashMap<>();
    private int nextHost = FIRST_HOST;
    private boolean started = false;
    private boolean stopped = false;

    /**
     * @param addressPrefix 예: "10.45.1."
     */
    public SimulatedCoreNetwork(String id, String addressPrefix) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(addressPrefix, "addressPrefix must not be null");
        if (!addressPrefix.endsWith(".")) {
            throw new IllegalArgumentException("addressPrefix must end with '.', but was: " + addressPrefix);
        }
        this.addressPrefix = addressPrefix;
    }

    @Override
    public String getId() {
        return id;
    }

    synchronized String register(String ueId) {
        if (stopped) {
            throw new AttachException(ueId, id + " is stopped");
        }
        if (addressByUe.containsKey(ueId)) {
            throw new AttachException(ueId, ueId + " is already registered at " + id);
        }
        if (nextHost > LAST_HOST) {
            throw new AttachException(ueId, id + " address pool exhausted (" + addressPrefix + "*)");
        }
        if (!started) {
            started = true;
            log.info(StructuredLog.event("core_network_started", "id", id, "addressPrefix", addressPrefix));
        }

        String address = addressPrefix + nextHost++;
        addressByUe.put(ueId, address);
        return address;
    }

    /**
     * @return 해제된 주소. 등록되지 않은 UE면 null
     */
    synchronized String release(String ueId) {
        return addressByUe.remove(ueId);
    }

    public synchronized Map<String, String> getAddresses() {
        return Map.copyOf(addressByUe);
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    @Override
    public synchronized void stop() {
        if (stopped) return;
        stopped = true;
        log.info(StructuredLog.event("core_network_stopped",
                "id", id,
                "started", started,
                "registeredCount", addressByUe.size()));
    }
}
