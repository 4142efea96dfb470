package com.rex.gate.proxy;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Pump every byte read on this channel into the peer channel
 */
public final class RelayHandler extends ChannelInboundHandlerAdapter {

    private static final Logger sLogger = LoggerFactory.getLogger(RelayHandler.class);

    private final Channel mOutput;

    public RelayHandler(Channel ch) {
        sLogger.trace("<init> ch=<{}>", ch);
        mOutput = ch;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (mOutput.isActive()) {
            mOutput.writeAndFlush(msg);
        } else {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        // Peer resets are a normal end of the relay
        if (cause instanceof IOException) {
            sLogger.debug("{} - {}", ctx.channel(), cause.getMessage());
        } else {
            sLogger.warn("{} - {}", ctx.channel(), cause.toString());
        }
        ctx.close();
        if (mOutput.isActive()) {
            mOutput.writeAndFlush(Unpooled.EMPTY_BUFFER)
                    .addListener(ChannelFutureListener.CLOSE);
        }
    }
}
