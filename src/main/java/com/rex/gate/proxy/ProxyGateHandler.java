package com.rex.gate.proxy;

import com.rex.gate.auth.CredentialFactory;
import com.rex.gate.auth.CredentialFactoryBasic;
import com.rex.gate.auth.CredentialStore;
import com.rex.gate.http.Pages;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Gate one proxied connection
 *
 * Without a stored account every request gets the setup page (POST /setup stores it),
 * the upstream is never contacted. With an account the request must carry
 * Authorization: Basic base64(username:password), otherwise 401 and close.
 * An authorized connection is relayed byte for byte to the fixed upstream.
 *
 * Added on a blocking executor group, credential checks hash and read files.
 */
public class ProxyGateHandler extends SimpleChannelInboundHandler<ProxyRequest> {

    private static final Logger sLogger = LoggerFactory.getLogger(ProxyGateHandler.class);

    static final int CONNECT_TIMEOUT_MILLIS = 15000;

    private final CredentialFactory mFactory = new CredentialFactoryBasic();
    private final CredentialStore mStore;
    private final String mUpstreamHost;
    private final int mUpstreamPort;

    public ProxyGateHandler(CredentialStore store, String upstreamHost, int upstreamPort) {
        sLogger.trace("<init>");
        mStore = store;
        mUpstreamHost = upstreamHost;
        mUpstreamPort = upstreamPort;
    }

    @Override // SimpleChannelInboundHandler
    protected void channelRead0(ChannelHandlerContext ctx, ProxyRequest request) throws Exception {
        RequestPreamble preamble = request.preamble();
        sLogger.trace("method:<{}> path:<{}>", preamble.method(), preamble.path());

        if (!mStore.isConfigured()) {
            handleSetup(ctx, preamble);
            return;
        }

        if (!isAuthorized(preamble)) {
            sLogger.warn("Authentication required <{} {}> from {}", preamble.method(), preamble.path(), ctx.channel().remoteAddress());
            ctx.writeAndFlush(RawResponses.unauthorized())
                    .addListener(ChannelFutureListener.CLOSE);
            return;
        }

        connect(ctx, request.content().retain());
    }

    private void handleSetup(ChannelHandlerContext ctx, RequestPreamble preamble) {
        if ("POST".equals(preamble.method()) && "/setup".equals(preamble.path())) {
            Map<String, List<String>> form = new QueryStringDecoder(preamble.bodyText(), StandardCharsets.UTF_8, false).parameters();
            String username = first(form, "username", "admin").trim();
            String password = first(form, "password", "");
            if (!username.isEmpty() && !password.isEmpty()) {
                try {
                    mStore.save(username, password);
                    ctx.writeAndFlush(RawResponses.redirect("/"))
                            .addListener(ChannelFutureListener.CLOSE);
                    return;
                } catch (IOException ex) {
                    sLogger.warn("Setup failed - {}", ex.toString());
                }
            }
            sLogger.warn("Setup rejected from {}", ctx.channel().remoteAddress());
            ctx.writeAndFlush(RawResponses.html(Pages.setup(Pages.ERROR_SETUP)))
                    .addListener(ChannelFutureListener.CLOSE);
            return;
        }
        ctx.writeAndFlush(RawResponses.html(Pages.setup(null)))
                .addListener(ChannelFutureListener.CLOSE);
    }

    /**
     * Some header named authorization (any case) must carry exactly the expected Basic value
     */
    boolean isAuthorized(RequestPreamble preamble) {
        for (String value : preamble.headers("Authorization")) {
            String[] credential = mFactory.parse(value);
            if (credential == null) {
                continue;
            }
            if (mFactory.create(credential[0], credential[1]).equals(value)
                    && mStore.verify(credential[0], credential[1])) {
                return true;
            }
        }
        return false;
    }

    private void connect(ChannelHandlerContext ctx, ByteBuf raw) {
        final Channel client = ctx.channel();
        InetSocketAddress address = InetSocketAddress.createUnresolved(mUpstreamHost, mUpstreamPort);
        sLogger.debug("Connect <{}> for {}", address, client.remoteAddress());

        new Bootstrap()
                .group(client.eventLoop())
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new UpstreamInitializer(client))
                .connect(address)
                .addListener(new ChannelFutureListener() {
                    @Override
                    public void operationComplete(ChannelFuture future) throws Exception {
                        if (!future.isSuccess()) {
                            raw.release();
                            sLogger.warn("Connect upstream {} failed - {}", address, future.cause().toString());
                            client.close();
                            return;
                        }
                        sLogger.debug("Connect success {}", future.channel());
                        future.channel().writeAndFlush(raw);
                        if (client.pipeline().get(ProxyGateHandler.class) != null) {
                            client.pipeline().remove(ProxyGateHandler.class);
                        }
                        client.config().setAutoRead(true);
                    }
                });
    }

    private static String first(Map<String, List<String>> form, String name, String fallback) {
        List<String> values = form.get(name);
        return (values == null || values.isEmpty()) ? fallback : values.get(0);
    }

    @Override // SimpleChannelInboundHandler
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        if (cause instanceof IOException) {
            sLogger.debug("{} - {}", ctx.channel().remoteAddress(), cause.toString());
        } else {
            sLogger.warn("{}", cause.toString());
        }
        ctx.close();
    }
}
