package com.rex.gate;

import com.rex.gate.auth.CredentialStore;
import com.rex.gate.proxy.ProxyGateInitializer;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Basic auth gated reverse proxy in front of the fixed upstream
 */
public class ProxyServer {

    private static final Logger sLogger = LoggerFactory.getLogger(ProxyServer.class);

    private static final int BLOCKING_THREADS = 16;

    private final EventLoopGroup mBossGroup = new NioEventLoopGroup(1);
    private final EventLoopGroup mWorkerGroup = new NioEventLoopGroup(); // Default use Runtime.getRuntime().availableProcessors() * 2
    private final EventExecutorGroup mBlockingGroup = new DefaultEventExecutorGroup(BLOCKING_THREADS);

    private final GateConfig mConfig;
    private final CredentialStore mStore;
    private ChannelFuture mChannelFuture;

    public ProxyServer(GateConfig config, CredentialStore store) {
        sLogger.trace("<init>");
        mConfig = new GateConfig.Builder(config).build();
        mStore = store;
    }

    /**
     * Start the proxy server
     */
    synchronized public ProxyServer start() {
        if (mChannelFuture != null) {
            sLogger.warn("already started");
            return this;
        }

        final ServerBootstrap bootstrap = new ServerBootstrap()
                .group(mBossGroup, mWorkerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .handler(new LoggingHandler(LogLevel.DEBUG))
                .childHandler(new ProxyGateInitializer(mBlockingGroup, mStore,
                        mConfig.upstreamHost, mConfig.upstreamPort, mConfig.proxyIdleSeconds))
                .childOption(ChannelOption.SO_KEEPALIVE, true);
        final InetSocketAddress address = new InetSocketAddress(mConfig.bindAddress, mConfig.proxyPort);
        mChannelFuture = BindRetry.bind("proxy " + address, mConfig.bindRetries, mConfig.bindRetryDelayMillis,
                () -> bootstrap.bind(address).syncUninterruptibly());
        sLogger.info("Proxy gate {} -> {}:{}", mChannelFuture.channel().localAddress(), mConfig.upstreamHost, mConfig.upstreamPort);
        return this;
    }

    /**
     * Stop the proxy server
     */
    synchronized public ProxyServer stop() {
        sLogger.info("stop");
        if (mChannelFuture != null) {
            mChannelFuture.channel()
                    .close()
                    .syncUninterruptibly();
            mChannelFuture = null;
        }
        mBossGroup.shutdownGracefully();
        mWorkerGroup.shutdownGracefully();
        mBlockingGroup.shutdownGracefully();
        return this;
    }

    public int port() {
        try {
            return ((InetSocketAddress) mChannelFuture.channel().localAddress()).getPort();
        } catch (Exception ex) {
            sLogger.warn("Failed to get port");
        }
        return mConfig.proxyPort;
    }
}
