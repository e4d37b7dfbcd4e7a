package com.nori.tc.throughput.netty;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.channel.socket.DatagramPacket;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ByteCountingHandlerTests {

    @Test
    void counts_stream_bytes_and_releases_buffers() {
        AtomicLong counter = new AtomicLong();
        EmbeddedChannel ch = new EmbeddedChannel(new ByteCountingHandler(counter));

        ByteBuf a = Unpooled.buffer(100).writeZero(100);
        ByteBuf b = Unpooled.buffer(28).writeZero(28);
        ch.writeInbound(a);
        ch.writeInbound(b);

        assertEquals(128, counter.get());
        assertEquals(0, a.refCnt());
        assertEquals(0, b.refCnt());
        assertNull(ch.readInbound());
        ch.finishAndReleaseAll();
    }

    @Test
    void counts_datagram_payload() {
        AtomicLong counter = new AtomicLong();
        EmbeddedChannel ch = new EmbeddedChannel(new ByteCountingHandler(counter));

        DatagramPacket packet = new DatagramPacket(Unpooled.buffer(1200).writeZero(1200),
                new InetSocketAddress("127.0.0.1", 9000), new InetSocketAddress("127.0.0.1", 9001));
        ch.writeInbound(packet);

        assertEquals(1200, counter.get());
        assertEquals(0, packet.refCnt());
        ch.finishAndReleaseAll();
    }
}
