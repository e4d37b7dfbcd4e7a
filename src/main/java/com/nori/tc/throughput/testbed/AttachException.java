package com.nori.tc.throughput.testbed;

import java.util.Objects;

/**
 * UE attach 실패 또는 허용 시간 초과.
 */
public class AttachException extends TestBedException {

    private final String endpointId;
    private final boolean timedOut;

    public AttachException(String endpointId, String message) {
        this(endpointId, message, false, null);
    }

    public AttachException(String endpointId, String message, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.endpointId = Objects.requireNonNull(endpointId, "endpointId must not be null");
        this.timedOut = timedOut;
    }

    public String getEndpointId() {
        return endpointId;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
