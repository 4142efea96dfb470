package com.rex.gate.websocket;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.SimpleUserEventChannelHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle received http requests
 * Filter the hub path, upgrade to websocket and hand the channel to the hub
 */
public class WsHubPathInterceptor extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger sLogger = LoggerFactory.getLogger(WsHubPathInterceptor.class);

    private static final int PING_INTERVAL_SECONDS = 20;

    private final BroadcastHub mHub;
    private final String mPath;

    public WsHubPathInterceptor(BroadcastHub hub, String path) {
        sLogger.trace("<init>");
        mHub = hub;
        mPath = path;
    }

    @Override // SimpleChannelInboundHandler
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) throws Exception {
        String path = new QueryStringDecoder(request.uri()).path();
        sLogger.trace("path:<{}> hubPath:<{}>", path, mPath);
        if (mPath.equals(path)) {
            sLogger.debug("channel {} handshaker websocket", ctx.channel().remoteAddress());

            ctx.pipeline()
                    .addLast(new WebSocketServerProtocolHandler(request.uri(), null, true))
                    .addLast(new SimpleUserEventChannelHandler<WebSocketServerProtocolHandler.HandshakeComplete>() {
                        @Override
                        protected void eventReceived(ChannelHandlerContext ctx, WebSocketServerProtocolHandler.HandshakeComplete evt) throws Exception {
                            sLogger.debug("channel {} handshake complete", ctx.channel().remoteAddress());
                            ctx.pipeline()
                                    .remove(WsHubPathInterceptor.this)
                                    .remove(this);
                            if (mHub.register(ctx.channel(), evt.requestHeaders(), evt.requestUri())) {
                                ctx.pipeline()
                                        .addLast(new IdleStateHandler(0, PING_INTERVAL_SECONDS, 0))
                                        .addLast(new WsHubClientHandler());
                            }
                            sLogger.trace("pipeline:{}", ctx.pipeline());
                        }
                    });

            ctx.fireChannelRead(request.retain());
            return;
        }

        sLogger.warn("invalid path {} from {}", path, ctx.channel().remoteAddress());
        ctx.writeAndFlush(new DefaultFullHttpResponse(request.protocolVersion(), HttpResponseStatus.NOT_FOUND))
                .addListener(ChannelFutureListener.CLOSE);
    }

    @Override // SimpleChannelInboundHandler
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        sLogger.warn("{}", cause.toString());
        ctx.close();
    }
}
