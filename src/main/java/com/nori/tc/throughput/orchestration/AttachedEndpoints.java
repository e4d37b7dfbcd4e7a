package com.nori.tc.throughput.orchestration;

import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.testbed.AttachException;
import com.nori.tc.throughput.testbed.AttachInfo;
import com.nori.tc.throughput.testbed.EndpointSet;
import com.nori.tc.throughput.testbed.UserEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * AttachedEndpoints
 *
 * attach 결과를 소유하는 scoped guard. release 동작이 detach이다.
 *
 * 규칙:
 * - attachAll(): EndpointSet 순서대로 1대씩 attach한다(all-or-nothing barrier).
 *   k번째가 실패/타임아웃되면 즉시 AttachException을 던지고 k+1..N은 시도하지 않는다.
 * - 타임아웃된 시도는 Future.cancel(true)로 끊는다. 그 UE는 attach 목록에 들어가지 않는다.
 * - close(): 성공적으로 attach된 UE만 정확히 1회씩 detach한다. 동시에 실행하고 전부 기다린다.
 *   호출 스레드가 interrupt된 상태여도 detachTimeout까지 기다리고, 끝난 뒤 interrupt 상태를 되돌린다.
 *   detach 실패는 경고로 모으고 예외를 던지지 않는다.
 * - close()는 여러 번 불려도 detach를 반복하지 않는다.
 */
public final class AttachedEndpoints implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AttachedEndpoints.class);

    private final EndpointSet endpoints;
    private final ExecutorService executor;
    private final Duration attachTimeout;
    private final Duration detachTimeout;

    /** attach 성공 순서 그대로 유지 */
    private final Map<UserEndpoint, AttachInfo> attached = new LinkedHashMap<>();
    private final List<String> teardownWarnings = new ArrayList<>();

    private boolean closed = false;

    public AttachedEndpoints(EndpointSet endpoints,
                             ExecutorService executor,
                             Duration attachTimeout,
                             Duration detachTimeout) {
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.attachTimeout = Objects.requireNonNull(attachTimeout, "attachTimeout must not be null");
        this.detachTimeout = Objects.requireNonNull(detachTimeout, "detachTimeout must not be null");
    }

    // ─── attach ──────────────────────────────────────────────────────────────

    public List<AttachInfo> attachAll() {
        if (closed) {
            throw new IllegalStateException("endpoints already released");
        }
        for (UserEndpoint ue : endpoints.getUserEndpoints()) {
            AttachInfo info = attachOne(ue);
            attached.put(ue, info);

            log.info(StructuredLog.event("attach_completed",
                    "ueId", ue.getId(),
                    "address", info.ipv4Address(),
                    "attachedCount", attached.size(),
                    "total", endpoints.size()));
        }
        return getAttachInfos();
    }

    private AttachInfo attachOne(UserEndpoint ue) {
        log.info(StructuredLog.event("attach_started",
                "ueId", ue.getId(),
                "baseStation", endpoints.getBaseStation().getId(),
                "coreNetwork", endpoints.getCoreNetwork().getId(),
                "timeout", attachTimeout));

        Future<AttachInfo> attempt = executor.submit(
                () -> ue.attach(endpoints.getBaseStation(), endpoints.getCoreNetwork()));
        try {
            AttachInfo info = attempt.get(attachTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (info == null) {
                throw new AttachException(ue.getId(), "attach returned no attach info for " + ue.getId());
            }
            return info;
        } catch (TimeoutException ex) {
            attempt.cancel(true);
            log.warn(StructuredLog.event("attach_timeout",
                    "ueId", ue.getId(),
                    "timeout", attachTimeout,
                    "attachedCount", attached.size()));
            throw new AttachException(ue.getId(),
                    "attach of " + ue.getId() + " timed out after " + attachTimeout.toMillis() + "ms", true, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof AttachException ae) {
                throw ae;
            }
            throw new AttachException(ue.getId(), "attach of " + ue.getId() + " failed: " + cause, false, cause);
        } catch (InterruptedException ex) {
            attempt.cancel(true);
            Thread.currentThread().interrupt();
            throw new AttachException(ue.getId(), "interrupted while attaching " + ue.getId(), false, ex);
        }
    }

    public List<AttachInfo> getAttachInfos() {
        return List.copyOf(attached.values());
    }

    public int getAttachedCount() {
        return attached.size();
    }

    // ─── release(detach) ─────────────────────────────────────────────────────

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        if (attached.isEmpty()) {
            log.info(StructuredLog.event("detach_skipped", "reason", "nothing_attached"));
            return;
        }

        Map<UserEndpoint, Future<?>> pending = new LinkedHashMap<>();
        for (UserEndpoint ue : attached.keySet()) {
            pending.put(ue, executor.submit(ue::detach));
        }

        // 취소(interrupt) 경로에서도 detach 완료는 끝까지 기다린다. interrupt 상태는 대기 후 복원한다.
        boolean interrupted = Thread.interrupted();
        long deadlineNanos = System.nanoTime() + detachTimeout.toNanos();
        int detached = 0;
        try {
            for (Map.Entry<UserEndpoint, Future<?>> e : pending.entrySet()) {
                String ueId = e.getKey().getId();
                while (true) {
                    long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
                    try {
                        e.getValue().get(remaining, TimeUnit.NANOSECONDS);
                        detached++;
                    } catch (ExecutionException ex) {
                        warn(ueId, "detach failed: " + ex.getCause(), ex.getCause());
                    } catch (TimeoutException ex) {
                        e.getValue().cancel(true);
                        warn(ueId, "detach timed out after " + detachTimeout.toMillis() + "ms", null);
                    } catch (InterruptedException ex) {
                        interrupted = true;
                        continue;
                    }
                    break;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        log.info(StructuredLog.event("detach_completed",
                "attachedCount", attached.size(),
                "detachedCount", detached,
                "warnings", teardownWarnings.size()));
    }

    public List<String> getTeardownWarnings() {
        return Collections.unmodifiableList(teardownWarnings);
    }

    private void warn(String ueId, String message, Throwable cause) {
        teardownWarnings.add(ueId + ": " + message);
        log.warn(StructuredLog.event("detach_failed", "ueId", ueId, "detail", message), cause);
    }
}
