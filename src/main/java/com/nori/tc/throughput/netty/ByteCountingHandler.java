package com.nori.tc.throughput.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.DatagramPacket;
import io.netty.util.ReferenceCountUtil;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ByteCountingHandler
 *
 * sink 측 종단 핸들러. 수신 바이트 수만 세고 버퍼는 즉시 release한다.
 *
 * - TCP: ByteBuf
 * - UDP: DatagramPacket (content 기준)
 * - 그 외 메시지는 세지 않고 release만 한다.
 */
public class ByteCountingHandler extends ChannelInboundHandlerAdapter {

    private final AtomicLong receivedBytes;

    public ByteCountingHandler(AtomicLong receivedBytes) {
        this.receivedBytes = Objects.requireNonNull(receivedBytes, "receivedBytes must not be null");
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            if (msg instanceof DatagramPacket packet) {
                receivedBytes.addAndGet(packet.content().readableBytes());
            } else if (msg instanceof ByteBuf buf) {
                receivedBytes.addAndGet(buf.readableBytes());
            }
        } finally {
            // 종단 핸들러: 다음으로 넘기지 않고 여기서 release 책임을 진다.
            ReferenceCountUtil.release(msg);
        }
    }
}
