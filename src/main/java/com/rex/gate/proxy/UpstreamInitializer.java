package com.rex.gate.proxy;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Initialize the upstream channel pipeline
 * Bridge the accepted client with the upstream, closing one side closes the other
 */
public class UpstreamInitializer extends ChannelInitializer<SocketChannel> {

    private static final Logger sLogger = LoggerFactory.getLogger(UpstreamInitializer.class);

    private final Channel mClient;

    public UpstreamInitializer(Channel client) {
        sLogger.trace("<init>");
        mClient = client;
    }

    @Override // ChannelInitializer
    protected void initChannel(final SocketChannel ch) throws Exception {
        // The address is only known once the connect future completes
        sLogger.debug("Relay {} with {}", mClient, ch);
        ch.pipeline().addLast(new RelayHandler(mClient));
        ch.closeFuture().addListener((ChannelFutureListener) future -> {
            sLogger.debug("Upstream closed {}", future.channel());
            if (mClient.isActive()) {
                mClient.writeAndFlush(Unpooled.EMPTY_BUFFER)
                        .addListener(ChannelFutureListener.CLOSE);
            }
        });

        mClient.pipeline().addLast(new RelayHandler(ch));
        mClient.closeFuture().addListener((ChannelFutureListener) future -> {
            sLogger.debug("Client closed {}", future.channel());
            if (ch.isActive()) {
                ch.writeAndFlush(Unpooled.EMPTY_BUFFER)
                        .addListener(ChannelFutureListener.CLOSE);
            }
        });
    }
}
