package com.rex.gate.websocket;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Initialize the websocket hub channel pipeline
 */
public class WsHubInitializer extends ChannelInitializer<SocketChannel> {

    private static final Logger sLogger = LoggerFactory.getLogger(WsHubInitializer.class);

    private final BroadcastHub mHub;
    private final String mPath;

    public WsHubInitializer(BroadcastHub hub, String path) {
        sLogger.trace("<init>");
        mHub = hub;
        mPath = path;
    }

    @Override // ChannelInitializer
    protected void initChannel(SocketChannel ch) throws Exception {
        sLogger.trace("initChannel");
        ch.pipeline()
                .addLast(new HttpServerCodec())
                .addLast(new HttpObjectAggregator(1 << 16)) // 65536
                .addLast(new WsHubPathInterceptor(mHub, mPath));
    }
}
