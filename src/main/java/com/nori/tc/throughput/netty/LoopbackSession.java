package com.nori.tc.throughput.netty;

import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.measurement.TrafficRequest;
import com.nori.tc.throughput.scenario.TrafficDirection;
import com.nori.tc.throughput.scenario.TrafficProtocol;
import com.nori.tc.throughput.testbed.AttachInfo;
import com.nori.tc.throughput.testbed.TransportException;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * LoopbackSession
 *
 * UE 1대 × 단방향 1개의 loopback 트래픽 세션.
 *
 * 구성:
 * - sink  : 수신 측. TCP면 server 채널(연결 1개만 허용), UDP면 datagram 채널. 127.0.0.1 ephemeral port.
 * - sender: 송신 측. PacedSender로 목표 bitrate를 맞춘다.
 *
 * 방향 라벨:
 * - DOWNLINK: sender = core network 측, sink = UE 측
 * - UPLINK  : sender = UE 측, sink = core network 측
 *   (loopback에서는 배선이 같고 로그 라벨만 다르다)
 *
 * 오류:
 * - bind/connect 실패: open()에서 TransportException
 * - 세션 중 I/O 오류나 sender 연결 끊김: SessionErrors에 기록 → 측정 결과 transportOk=false
 */
final class LoopbackSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoopbackSession.class);

    private static final int SINK_RCVBUF_BYTES = 4 * 1024 * 1024;

    private final String ueId;
    private final TrafficDirection direction;
    private final TrafficProtocol protocol;

    private final AtomicLong receivedBytes = new AtomicLong();
    private final SessionErrors errors = new SessionErrors();
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private PacedSender sender;
    private volatile boolean stopping = false;

    private LoopbackSession(String ueId, TrafficDirection direction, TrafficProtocol protocol) {
        this.ueId = ueId;
        this.direction = direction;
        this.protocol = protocol;
    }

    // ─── 생성 ────────────────────────────────────────────────────────────────

    static LoopbackSession open(EventLoopGroup group,
                                String host,
                                TrafficRequest request,
                                AttachInfo endpoint,
                                Duration connectTimeout,
                                int maxDatagramBytes) {
        Objects.requireNonNull(group, "group must not be null");
        LoopbackSession session = new LoopbackSession(endpoint.endpointId(), request.direction(), request.protocol());
        try {
            if (request.protocol() == TrafficProtocol.TCP) {
                session.openTcp(group, host, request.targetBitrateBps(), connectTimeout);
            } else {
                session.openUdp(group, host, request.targetBitrateBps(), connectTimeout, maxDatagramBytes);
            }
        } catch (RuntimeException ex) {
            session.close();
            throw ex;
        }

        log.info(StructuredLog.event("traffic_session_opened",
                "ueId", session.ueId,
                "address", endpoint.ipv4Address(),
                "direction", session.direction,
                "protocol", session.protocol,
                "sender", session.direction == TrafficDirection.DOWNLINK ? "core" : "ue",
                "targetBps", request.targetBitrateBps()));
        return session;
    }

    private void openTcp(EventLoopGroup group, String host, long bitrateBps, Duration connectTimeout) {
        AtomicInteger sinkConnections = new AtomicInteger();

        ServerBootstrap sinkBootstrap = new ServerBootstrap()
                .group(group, group)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.SO_RCVBUF, SINK_RCVBUF_BYTES)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        tag(ch, "sink");
                        channels.add(ch);
                        ch.pipeline().addLast("connLimit", new ConnectionLimitHandler(1, sinkConnections));
                        ch.pipeline().addLast("counter", new ByteCountingHandler(receivedBytes));
                        ch.pipeline().addLast("errors", new TransportErrorHandler(errors));
                    }
                });

        Channel sink = bind(sinkBootstrap.bind(host, 0), connectTimeout, "sink");
        InetSocketAddress sinkAddress = (InetSocketAddress) sink.localAddress();

        Bootstrap senderBootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        tag(ch, "sender");
                        ch.pipeline().addLast("errors", new TransportErrorHandler(errors));
                    }
                });

        Channel senderChannel = bind(senderBootstrap.connect(sinkAddress), connectTimeout, "sender");
        senderChannel.closeFuture().addListener((ChannelFutureListener) f -> {
            if (!stopping) {
                errors.record("sender", "connection closed during session");
            }
        });

        this.sender = new PacedSender(senderChannel, TrafficProtocol.TCP, bitrateBps, null, 0);
    }

    private void openUdp(EventLoopGroup group, String host, long bitrateBps, Duration connectTimeout, int maxDatagramBytes) {
        Bootstrap sinkBootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_RCVBUF, SINK_RCVBUF_BYTES)
                .handler(new ChannelInitializer<DatagramChannel>() {
                    @Override
                    protected void initChannel(DatagramChannel ch) {
                        tag(ch, "sink");
                        ch.pipeline().addLast("counter", new ByteCountingHandler(receivedBytes));
                        ch.pipeline().addLast("errors", new TransportErrorHandler(errors));
                    }
                });

        Channel sink = bind(sinkBootstrap.bind(host, 0), connectTimeout, "sink");
        InetSocketAddress sinkAddress = (InetSocketAddress) sink.localAddress();

        Bootstrap senderBootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .handler(new ChannelInitializer<DatagramChannel>() {
                    @Override
                    protected void initChannel(DatagramChannel ch) {
                        tag(ch, "sender");
                        ch.pipeline().addLast("errors", new TransportErrorHandler(errors));
                    }
                });

        Channel senderChannel = bind(senderBootstrap.bind(host, 0), connectTimeout, "sender");
        this.sender = new PacedSender(senderChannel, TrafficProtocol.UDP, bitrateBps, sinkAddress, maxDatagramBytes);
    }

    private Channel bind(ChannelFuture future, Duration timeout, String role) {
        boolean done = future.awaitUninterruptibly(timeout.toMillis());
        if (!done || !future.isSuccess()) {
            future.cancel(false);
            String detail = done ? String.valueOf(future.cause()) : "timed out after " + timeout.toMillis() + "ms";
            throw new TransportException(direction, ueId, role + " setup failed: " + detail, future.cause());
        }
        Channel ch = future.channel();
        channels.add(ch);
        return ch;
    }

    private void tag(Channel ch, String role) {
        ch.attr(ChannelAttributes.UE_ID).set(ueId);
        ch.attr(ChannelAttributes.DIRECTION).set(direction);
        ch.attr(ChannelAttributes.ROLE).set(role);
    }

    // ─── 실행 ────────────────────────────────────────────────────────────────

    void startSending() {
        sender.start();
    }

    void stopSending() {
        stopping = true;
        if (sender != null) {
            sender.stop();
        }
    }

    String getUeId() {
        return ueId;
    }

    long receivedBytes() {
        return receivedBytes.get();
    }

    long sentBytes() {
        return sender == null ? 0L : sender.sentBytes();
    }

    /** 오류 없으면 null */
    String transportError() {
        return errors.first();
    }

    @Override
    public void close() {
        stopping = true;
        if (sender != null) {
            sender.stop();
        }
        channels.close().awaitUninterruptibly();
    }
}
