package com.nori.tc.throughput.sim;

import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.testbed.AttachException;
import com.nori.tc.throughput.testbed.AttachInfo;
import com.nori.tc.throughput.testbed.BaseStation;
import com.nori.tc.throughput.testbed.CoreNetwork;
import com.nori.tc.throughput.testbed.DetachException;
import com.nori.tc.throughput.testbed.UserEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * 시뮬레이션 UE.
 *
 * - attach: attachDelay만큼 대기(무선 접속 절차 흉내) → gNB admit → 코어에서 주소 할당.
 *   대기 중이거나 admit 직전에 interrupt되면 AttachException. 이때 gNB/코어 상태는 바뀌지 않는다.
 * - detach: 주소 반납 + gNB에서 해제. attach되지 않은 상태면 DetachException.
 */
public class SimulatedUserEndpoint implements UserEndpoint {

    private static final Logger log = LoggerFactory.getLogger(SimulatedUserEndpoint.class);

    private final String id;
    private final Duration attachDelay;

    private volatile SimulatedBaseStation servingBaseStation;
    private volatile SimulatedCoreNetwork servingCore;

    public SimulatedUserEndpoint(String id, Duration attachDelay) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.attachDelay = Objects.requireNonNull(attachDelay, "attachDelay must not be null");
        if (attachDelay.isNegative()) {
            throw new IllegalArgumentException("attachDelay must be >= 0, but was: " + attachDelay);
        }
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AttachInfo attach(BaseStation baseStation, CoreNetwork coreNetwork) {
        if (!(baseStation instanceof SimulatedBaseStation gnb)) {
            throw new AttachException(id, "unsupported base station: " + baseStation);
        }
        if (!(coreNetwork instanceof SimulatedCoreNetwork core)) {
            throw new AttachException(id, "unsupported core network: " + coreNetwork);
        }

        try {
            if (!attachDelay.isZero()) {
                Thread.sleep(attachDelay.toMillis());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AttachException(id, "attach of " + id + " interrupted", false, ex);
        }
        // 대기 직후 취소된 시도는 gNB/코어에 흔적을 남기지 않는다.
        if (Thread.currentThread().isInterrupted()) {
            throw new AttachException(id, "attach of " + id + " cancelled before admission");
        }

        gnb.admit(id);
        String address;
        try {
            address = core.register(id);
        } catch (RuntimeException ex) {
            gnb.release(id);
            throw ex;
        }

        this.servingBaseStation = gnb;
        this.servingCore = core;

        log.info(StructuredLog.event("ue_attached",
                "ueId", id,
                "baseStation", gnb.getId(),
                "coreNetwork", core.getId(),
                "address", address));
        return new AttachInfo(id, address);
    }

    @Override
    public void detach() {
        SimulatedCoreNetwork core = this.servingCore;
        SimulatedBaseStation gnb = this.servingBaseStation;
        if (core == null || gnb == null) {
            throw new DetachException(id + " is not attached");
        }

        String address = core.release(id);
        gnb.release(id);
        this.servingCore = null;
        this.servingBaseStation = null;

        log.info(StructuredLog.event("ue_detached", "ueId", id, "address", address));
    }

    public boolean isAttached() {
        return servingCore != null;
    }
}
