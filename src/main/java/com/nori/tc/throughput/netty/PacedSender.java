package com.nori.tc.throughput.netty;

import com.nori.tc.throughput.scenario.TrafficProtocol;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.socket.DatagramPacket;
import io.netty.util.concurrent.ScheduledFuture;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PacedSender
 *
 * 목표 bitrate로 sender 채널에 0으로 채운 payload를 흘려보낸다.
 *
 * 페이싱:
 * - tick(10ms)마다 bitrate/8 * tick 바이트의 credit을 쌓고, 정수 바이트만큼 전송한다.
 *   소수점 이하는 다음 tick으로 이월한다.
 * - TCP: 채널이 writable이 아니면 이번 tick 분량은 버린다(backpressure가 측정값에 그대로 반영).
 * - UDP: maxDatagramBytes 단위로 잘라 sink 주소로 보낸다.
 *
 * 스레드:
 * - run()은 채널 EventLoop에서만 실행된다. credit은 단일 스레드 접근.
 */
final class PacedSender implements Runnable {

    static final long TICK_MS = 10;

    private final Channel channel;
    private final TrafficProtocol protocol;
    private final InetSocketAddress datagramTarget;
    private final int maxDatagramBytes;
    private final double bytesPerTick;
    private final AtomicLong sentBytes = new AtomicLong();

    private double credit = 0.0;
    private volatile ScheduledFuture<?> schedule;

    /**
     * @param datagramTarget UDP일 때 sink 주소. TCP면 null.
     */
    PacedSender(Channel channel,
                TrafficProtocol protocol,
                long targetBitrateBps,
                InetSocketAddress datagramTarget,
                int maxDatagramBytes) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.protocol = Objects.requireNonNull(protocol, "protocol must not be null");
        if (protocol == TrafficProtocol.UDP) {
            Objects.requireNonNull(datagramTarget, "datagramTarget must not be null for UDP");
            if (maxDatagramBytes <= 0) {
                throw new IllegalArgumentException("maxDatagramBytes must be > 0, but was: " + maxDatagramBytes);
            }
        }
        this.datagramTarget = datagramTarget;
        this.maxDatagramBytes = maxDatagramBytes;
        this.bytesPerTick = targetBitrateBps / 8.0 * TICK_MS / 1000.0;
    }

    void start() {
        schedule = channel.eventLoop().scheduleAtFixedRate(this, 0, TICK_MS, TimeUnit.MILLISECONDS);
    }

    void stop() {
        ScheduledFuture<?> f = schedule;
        if (f != null) {
            f.cancel(false);
            schedule = null;
        }
    }

    long sentBytes() {
        return sentBytes.get();
    }

    @Override
    public void run() {
        if (!channel.isActive()) {
            return;
        }

        credit += bytesPerTick;
        int budget = (int) credit;
        if (budget <= 0) {
            return;
        }

        if (protocol == TrafficProtocol.TCP) {
            if (!channel.isWritable()) {
                credit = 0.0;
                return;
            }
            ByteBuf payload = channel.alloc().buffer(budget).writeZero(budget);
            channel.writeAndFlush(payload, channel.voidPromise());
        } else {
            int remaining = budget;
            while (remaining > 0) {
                int size = Math.min(remaining, maxDatagramBytes);
                ByteBuf payload = channel.alloc().buffer(size).writeZero(size);
                channel.write(new DatagramPacket(payload, datagramTarget), channel.voidPromise());
                remaining -= size;
            }
            channel.flush();
        }

        credit -= budget;
        sentBytes.addAndGet(budget);
    }
}
