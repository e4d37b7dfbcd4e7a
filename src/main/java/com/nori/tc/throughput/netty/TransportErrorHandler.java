package com.nori.tc.throughput.netty;

import com.nori.tc.throughput.logging.StructuredLog;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * TransportErrorHandler
 *
 * pipeline 마지막에 두어 I/O 예외를 세션 오류로 기록하고 채널을 닫는다.
 * 측정 결과는 transportOk=false가 된다.
 * 오류 출처(sender/sink)는 채널의 ROLE 속성에서 읽는다. 속성이 없으면 "channel".
 */
public class TransportErrorHandler extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(TransportErrorHandler.class);

    private static final String UNKNOWN_ROLE = "channel";

    private final SessionErrors errors;

    public TransportErrorHandler(SessionErrors errors) {
        this.errors = Objects.requireNonNull(errors, "errors must not be null");
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        String role = Objects.requireNonNullElse(ctx.channel().attr(ChannelAttributes.ROLE).get(), UNKNOWN_ROLE);
        errors.record(role, cause);

        log.warn(StructuredLog.event("traffic_channel_error",
                "ueId", ctx.channel().attr(ChannelAttributes.UE_ID).get(),
                "direction", ctx.channel().attr(ChannelAttributes.DIRECTION).get(),
                "role", role,
                "connId", ctx.channel().id().asShortText(),
                "error", String.valueOf(cause)));

        ctx.close();
    }
}
