package com.nori.tc.throughput.netty;

import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.measurement.EndpointThroughput;
import com.nori.tc.throughput.measurement.MeasurementResult;
import com.nori.tc.throughput.measurement.TrafficRequest;
import com.nori.tc.throughput.testbed.AttachInfo;
import com.nori.tc.throughput.testbed.TrafficTool;
import com.nori.tc.throughput.testbed.TransportException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyTrafficTool
 *
 * 역할:
 * - loopback(127.0.0.1) 위에서 UE별 트래픽 세션을 열고, 목표 bitrate로 duration 동안 송신한 뒤
 *   sink가 받은 바이트로 UE별 bitrate를 계산한다.
 * - 실제 RF/코어망 대신 호스트 네트워크 스택을 data plane으로 쓰는 시뮬레이션 test bed의 트래픽 도구.
 *
 * 측정:
 * - 세션 전부 open → 동시에 송신 시작 → duration 대기 → 송신 중지 → drain 대기
 * - bitrate = receivedBytes * 8 / elapsed (elapsed = 송신 구간. drain 중 도착한 바이트도 receivedBytes에 포함)
 *
 * 오류:
 * - 세션 open 실패: TransportException (측정 FAIL)
 * - 세션 중 채널 오류: transportOk=false 결과
 * - interrupt(측정 타임아웃에 의한 취소): 세션을 닫고 interrupt 상태를 복원한 뒤 TransportException
 *
 * 수명주기:
 * - Spring SmartLifecycle로 EventLoopGroup을 관리한다. 테스트에서는 start()/stop()을 직접 호출한다.
 */
@SuppressWarnings("deprecation")
public class NettyTrafficTool implements TrafficTool, SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(NettyTrafficTool.class);

    static final int MAX_DATAGRAM_BYTES = 1200;

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final String host;
    private final int ioThreads;
    private final Duration drain;

    private volatile EventLoopGroup group;
    private volatile boolean running = false;

    /**
     * @param host      sink bind 주소 (보통 127.0.0.1)
     * @param ioThreads EventLoop 스레드 수. 0이면 Netty 기본값
     * @param drain     송신 중지 후 in-flight 바이트를 기다리는 시간
     */
    public NettyTrafficTool(String host, int ioThreads, Duration drain) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        if (ioThreads < 0) {
            throw new IllegalArgumentException("ioThreads must be >= 0, but was: " + ioThreads);
        }
        this.ioThreads = ioThreads;
        this.drain = Objects.requireNonNull(drain, "drain must not be null");
    }

    // ─── SmartLifecycle ──────────────────────────────────────────────

    @Override
    public synchronized void start() {
        if (running) return;
        group = new NioEventLoopGroup(ioThreads);
        running = true;
        log.info(StructuredLog.event("traffic_tool_started", "host", host, "ioThreads", ioThreads, "drain", drain));
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        group = null;
        log.info(StructuredLog.event("traffic_tool_stopped"));
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 0;
    }

    // ─── TrafficTool ─────────────────────────────────────────────────

    @Override
    public MeasurementResult run(TrafficRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        EventLoopGroup g = group;
        if (!running || g == null) {
            throw new IllegalStateException("traffic tool is not started");
        }

        List<LoopbackSession> sessions = new ArrayList<>();
        try {
            for (AttachInfo endpoint : request.endpoints()) {
                sessions.add(LoopbackSession.open(g, host, request, endpoint, CONNECT_TIMEOUT, MAX_DATAGRAM_BYTES));
            }

            long startNanos = System.nanoTime();
            sessions.forEach(LoopbackSession::startSending);

            Thread.sleep(request.duration().toMillis());
            sessions.forEach(LoopbackSession::stopSending);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            Thread.sleep(drain.toMillis());

            return collect(request, sessions, elapsed);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException(request.direction(), null, "traffic session interrupted", ex);
        } finally {
            sessions.forEach(LoopbackSession::close);
        }
    }

    private static MeasurementResult collect(TrafficRequest request, List<LoopbackSession> sessions, Duration elapsed) {
        long elapsedNanos = Math.max(1L, elapsed.toNanos());
        List<EndpointThroughput> throughputs = new ArrayList<>(sessions.size());
        List<String> errors = new ArrayList<>();

        for (LoopbackSession s : sessions) {
            long bps = (long) (s.receivedBytes() * 8.0 * 1_000_000_000.0 / elapsedNanos);
            throughputs.add(new EndpointThroughput(s.getUeId(), bps));

            String err = s.transportError();
            if (err != null) {
                errors.add(s.getUeId() + ": " + err);
            }

            log.info(StructuredLog.event("traffic_session_closed",
                    "ueId", s.getUeId(),
                    "direction", request.direction(),
                    "sentBytes", s.sentBytes(),
                    "receivedBytes", s.receivedBytes(),
                    "measuredBps", bps,
                    "elapsed", elapsed,
                    "error", err));
        }

        if (!errors.isEmpty()) {
            return MeasurementResult.transportFailed(request.direction(), throughputs, elapsed, String.join("; ", errors));
        }
        return MeasurementResult.ok(request.direction(), throughputs, elapsed);
    }
}
