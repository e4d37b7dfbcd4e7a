package com.nori.tc.throughput.netty;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 세션 1개의 첫 번째 전송 오류만 보존한다.
 * 이후 오류는 대개 첫 오류의 연쇄이므로 버린다.
 */
public final class SessionErrors {

    private final AtomicReference<String> first = new AtomicReference<>();

    public void record(String role, Throwable cause) {
        record(role, String.valueOf(cause));
    }

    public void record(String role, String detail) {
        first.compareAndSet(null, role + ": " + detail);
    }

    public boolean hasError() {
        return first.get() != null;
    }

    /** 오류가 없으면 null */
    public String first() {
        return first.get();
    }
}
