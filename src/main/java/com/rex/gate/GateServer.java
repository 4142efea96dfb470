package com.rex.gate;

import com.rex.gate.auth.CredentialStore;
import com.rex.gate.auth.SessionRegistry;
import com.rex.gate.bridge.EventBridge;
import com.rex.gate.http.HttpGateHandler;
import com.rex.gate.http.HttpGateInitializer;
import com.rex.gate.websocket.BroadcastHub;
import com.rex.gate.websocket.WsHubInitializer;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Session gated http front door, websocket hub and loopback event bridge
 *
 * The http gate and the hub share one single threaded event loop, so the session registry
 * and the client set need no locks. Credential checks run on a small blocking group.
 * The bridge thread only reaches the hub through {@link BroadcastHub#submit}.
 */
public class GateServer {

    private static final Logger sLogger = LoggerFactory.getLogger(GateServer.class);

    private static final int BLOCKING_THREADS = 4;

    private final EventLoopGroup mBossGroup = new NioEventLoopGroup(1);
    private final EventLoopGroup mGateLoop = new NioEventLoopGroup(1);
    private final EventExecutorGroup mBlockingGroup = new DefaultEventExecutorGroup(BLOCKING_THREADS);

    private final GateConfig mConfig;
    private final SessionRegistry mSessions;
    private final BroadcastHub mHub;
    private final HttpGateHandler mHttpHandler;

    private ChannelFuture mHttpFuture;
    private ChannelFuture mWsFuture;
    private EventBridge mBridge;

    public GateServer(GateConfig config, CredentialStore store) {
        sLogger.trace("<init>");
        mConfig = new GateConfig.Builder(config).build();
        mSessions = new SessionRegistry(mConfig.sessionTtlSeconds);
        mHub = new BroadcastHub(mGateLoop.next(), mSessions, mConfig.sessionCookieName);
        mHttpHandler = new HttpGateHandler(mConfig, store, mSessions, mBlockingGroup);
    }

    /**
     * Start the http gate, the websocket hub and the event bridge
     */
    synchronized public GateServer start() {
        if (mHttpFuture != null) {
            sLogger.warn("already started");
            return this;
        }
        sLogger.debug("Config:{}", mConfig);

        mHttpFuture = bind("http", mConfig.httpPort, new HttpGateInitializer(mHttpHandler));
        sLogger.info("HTTP gate on {}", mHttpFuture.channel().localAddress());

        mWsFuture = bind("websocket", mConfig.wsPort, new WsHubInitializer(mHub, mConfig.wsPath));
        sLogger.info("WebSocket hub on {} path {}", mWsFuture.channel().localAddress(), mConfig.wsPath);

        mBridge = BindRetry.bind("event bridge", mConfig.bindRetries, mConfig.bindRetryDelayMillis,
                () -> new EventBridge(mHub, mConfig.eventPort));
        mBridge.start();
        return this;
    }

    private ChannelFuture bind(String name, int port, ChannelInitializer<SocketChannel> initializer) {
        final ServerBootstrap bootstrap = new ServerBootstrap()
                .group(mBossGroup, mGateLoop)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .handler(new LoggingHandler(LogLevel.DEBUG))
                .childHandler(initializer)
                .childOption(ChannelOption.SO_KEEPALIVE, true);
        final InetSocketAddress address = new InetSocketAddress(mConfig.bindAddress, port);
        return BindRetry.bind(name + " " + address, mConfig.bindRetries, mConfig.bindRetryDelayMillis,
                () -> bootstrap.bind(address).syncUninterruptibly());
    }

    /**
     * Stop everything
     */
    synchronized public GateServer stop() {
        sLogger.info("stop");
        // A start that failed half way still owns the event loops
        if (mBridge != null) {
            mBridge.stop();
            mBridge = null;
        }
        if (mWsFuture != null) {
            mWsFuture.channel().close().syncUninterruptibly();
            mWsFuture = null;
        }
        if (mHttpFuture != null) {
            mHttpFuture.channel().close().syncUninterruptibly();
            mHttpFuture = null;
        }
        mBossGroup.shutdownGracefully();
        mGateLoop.shutdownGracefully();
        mBlockingGroup.shutdownGracefully();
        return this;
    }

    public BroadcastHub hub() {
        return mHub;
    }

    public int httpPort() {
        return port(mHttpFuture, mConfig.httpPort);
    }

    public int wsPort() {
        return port(mWsFuture, mConfig.wsPort);
    }

    public int eventPort() {
        return (mBridge != null) ? mBridge.port() : mConfig.eventPort;
    }

    private static int port(ChannelFuture future, int fallback) {
        try {
            return ((InetSocketAddress) future.channel().localAddress()).getPort();
        } catch (Exception ex) {
            sLogger.warn("Failed to get port");
        }
        return fallback;
    }
}
