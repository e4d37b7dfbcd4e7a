package com.nori.tc.throughput.netty;

import com.nori.tc.throughput.scenario.TrafficDirection;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class TransportErrorHandlerTests {

    @Test
    void first_error_is_kept_and_channel_closed() {
        SessionErrors errors = new SessionErrors();
        EmbeddedChannel ch = new EmbeddedChannel();
        ch.attr(ChannelAttributes.UE_ID).set("ue1");
        ch.attr(ChannelAttributes.DIRECTION).set(TrafficDirection.UPLINK);
        ch.attr(ChannelAttributes.ROLE).set("sink");
        ch.pipeline().addLast(new TransportErrorHandler(errors));

        ch.pipeline().fireExceptionCaught(new IOException("Connection reset by peer"));
        ch.pipeline().fireExceptionCaught(new IOException("second"));

        assertTrue(errors.hasError());
        assertEquals("sink: java.io.IOException: Connection reset by peer", errors.first());
        assertFalse(ch.isOpen());
    }

    @Test
    void error_source_comes_from_channel_role() {
        SessionErrors errors = new SessionErrors();
        EmbeddedChannel ch = new EmbeddedChannel();
        ch.attr(ChannelAttributes.ROLE).set("sender");
        ch.pipeline().addLast(new TransportErrorHandler(errors));

        ch.pipeline().fireExceptionCaught(new IOException("Broken pipe"));

        assertEquals("sender: java.io.IOException: Broken pipe", errors.first());
    }

    @Test
    void untagged_channel_is_reported_as_channel() {
        SessionErrors errors = new SessionErrors();
        EmbeddedChannel ch = new EmbeddedChannel(new TransportErrorHandler(errors));

        ch.pipeline().fireExceptionCaught(new IOException("Broken pipe"));

        assertEquals("channel: java.io.IOException: Broken pipe", errors.first());
        assertFalse(ch.isOpen());
    }

    @Test
    void no_error_means_null() {
        SessionErrors errors = new SessionErrors();
        assertFalse(errors.hasError());
        assertNull(errors.first());
    }
}
