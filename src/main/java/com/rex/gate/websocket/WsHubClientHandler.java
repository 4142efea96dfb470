package com.rex.gate.websocket;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Registered client, inbound frames are ignored, keep the link alive with pings
 */
public class WsHubClientHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger sLogger = LoggerFactory.getLogger(WsHubClientHandler.class);

    public static final int CLOSE_SERVER_ERROR = 1011;

    @Override // SimpleChannelInboundHandler
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) throws Exception {
        sLogger.trace("ignore {} from {}", frame.getClass().getSimpleName(), ctx.channel().remoteAddress());
    }

    @Override // ChannelInboundHandlerAdapter
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent && ((IdleStateEvent) evt).state() == IdleState.WRITER_IDLE) {
            ctx.writeAndFlush(new PingWebSocketFrame());
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override // SimpleChannelInboundHandler
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        if (cause instanceof IOException) {
            sLogger.debug("{} - {}", ctx.channel().remoteAddress(), cause.toString());
            ctx.close();
            return;
        }
        sLogger.warn("{} - {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.writeAndFlush(new CloseWebSocketFrame(CLOSE_SERVER_ERROR, "Server error"))
                .addListener(ChannelFutureListener.CLOSE);
    }
}
