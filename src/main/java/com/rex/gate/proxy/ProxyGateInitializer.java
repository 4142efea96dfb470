package com.rex.gate.proxy;

import com.rex.gate.auth.CredentialStore;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Initialize the proxied client channel pipeline
 */
public class ProxyGateInitializer extends ChannelInitializer<SocketChannel> {

    private static final Logger sLogger = LoggerFactory.getLogger(ProxyGateInitializer.class);

    private final EventExecutorGroup mBlockingGroup;
    private final int mIdleSeconds;
    private final CredentialStore mStore;
    private final String mUpstreamHost;
    private final int mUpstreamPort;

    /**
     * @param idleSeconds close the connection once neither side moved data for this long
     */
    public ProxyGateInitializer(EventExecutorGroup blockingGroup, CredentialStore store, String upstreamHost, int upstreamPort, int idleSeconds) {
        sLogger.trace("<init> idle:{}s", idleSeconds);
        mBlockingGroup = blockingGroup;
        mIdleSeconds = idleSeconds;
        mStore = store;
        mUpstreamHost = upstreamHost;
        mUpstreamPort = upstreamPort;
    }

    @Override // ChannelInitializer
    protected void initChannel(SocketChannel ch) throws Exception {
        sLogger.trace("initChannel");
        ch.pipeline()
                .addLast(new IdleStateHandler(0, 0, mIdleSeconds) { // Neither side moved data
                    @Override
                    protected void channelIdle(ChannelHandlerContext ctx, IdleStateEvent evt) throws Exception {
                        sLogger.debug("Idle connection {}", ctx.channel().remoteAddress());
                        ctx.close();
                    }
                })
                .addLast(new RequestPreambleDecoder())
                .addLast(mBlockingGroup, new ProxyGateHandler(mStore, mUpstreamHost, mUpstreamPort));
    }
}
