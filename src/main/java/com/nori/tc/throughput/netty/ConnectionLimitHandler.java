package com.nori.tc.throughput.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * ConnectionLimitHandler
 *
 * 목적:
 * - TCP sink는 짝이 되는 sender 1개만 받는다. 그 외 접속은 카운터를 오염시키지 않도록 즉시 close 한다.
 * - OS 레벨 accept 자체를 막을 수는 없으므로 "accept 후 close"로 제한한다.
 *
 * 동작:
 * - channelActive에서 카운터 증가
 * - maxConn 초과 시 즉시 감소 후 close, 이후 이벤트 전파하지 않음
 * - channelInactive에서 정상 연결에 대해 감소
 */
public class ConnectionLimitHandler extends ChannelInboundHandlerAdapter {

    private final int maxConn;
    private final AtomicInteger current;
    private boolean counted = false;

    public ConnectionLimitHandler(int maxConn, AtomicInteger current) {
        this.maxConn = maxConn;
        this.current = current;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        int now = current.incrementAndGet();
        if (now > maxConn) {
            current.decrementAndGet();
            ctx.close();
            return;
        }
        counted = true;
        ctx.fireChannelActive();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!counted) {
            // 거부된 연결에서 close 전에 도착한 데이터는 세지 않는다.
            ReferenceCountUtil.release(msg);
            return;
        }
        ctx.fireChannelRead(msg);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        try {
            if (counted) {
                current.decrementAndGet();
            }
        } finally {
            ctx.fireChannelInactive();
        }
    }
}
