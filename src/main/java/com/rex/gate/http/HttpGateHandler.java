package com.rex.gate.http;

import com.google.gson.Gson;
import com.rex.gate.GateConfig;
import com.rex.gate.auth.CredentialRecord;
import com.rex.gate.auth.CredentialStore;
import com.rex.gate.auth.Session;
import com.rex.gate.auth.SessionRegistry;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.FutureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Route setup, login, logout, token and static requests
 *
 * Runs on the single gate event loop, the session registry is only touched from here.
 * Credential file access and hashing are handed to a blocking group and the
 * response is completed back on the loop.
 *
 * NO_CREDENTIALS   any GET renders the setup form, POST /setup stores the account
 * CREDENTIALS_SET  POST /login opens a session, GET /logout closes it,
 *                  everything else requires the session cookie
 */
@ChannelHandler.Sharable
public class HttpGateHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger sLogger = LoggerFactory.getLogger(HttpGateHandler.class);

    public static final String PATH_SETUP = "/setup";
    public static final String PATH_LOGIN = "/login";
    public static final String PATH_LOGOUT = "/logout";
    public static final String PATH_WS_TOKEN = "/ws_token";
    public static final String PATH_ROOT = "/";

    private static final Map<String, String> CONTENT_TYPES = new HashMap<>();
    static {
        CONTENT_TYPES.put("html", "text/html; charset=utf-8");
        CONTENT_TYPES.put("htm", "text/html; charset=utf-8");
        CONTENT_TYPES.put("js", "application/javascript; charset=utf-8");
        CONTENT_TYPES.put("css", "text/css; charset=utf-8");
        CONTENT_TYPES.put("json", "application/json; charset=utf-8");
        CONTENT_TYPES.put("png", "image/png");
        CONTENT_TYPES.put("svg", "image/svg+xml");
        CONTENT_TYPES.put("ico", "image/x-icon");
        CONTENT_TYPES.put("mp3", "audio/mpeg");
        CONTENT_TYPES.put("wav", "audio/wav");
        CONTENT_TYPES.put("ogg", "audio/ogg");
    }

    private final Gson mCodec = new Gson();
    private final GateConfig mConfig;
    private final CredentialStore mStore;
    private final SessionRegistry mSessions;
    private final EventExecutorGroup mBlockingGroup;
    private final Path mWebRoot;
    private final Path mEntryFile;
    private final Path mAssetsDir;

    /**
     * @param blockingGroup runs the credential file access and password hashing,
     *                      the session registry stays on the channel event loop
     */
    public HttpGateHandler(GateConfig config, CredentialStore store, SessionRegistry sessions, EventExecutorGroup blockingGroup) {
        sLogger.trace("<init>");
        mConfig = config;
        mStore = store;
        mSessions = sessions;
        mBlockingGroup = blockingGroup;
        mWebRoot = Paths.get(config.webRoot).toAbsolutePath().normalize();
        mEntryFile = mWebRoot.resolve(relative(config.entryPage)).normalize();
        mAssetsDir = mWebRoot.resolve(relative(config.assetsPrefix)).normalize();
    }

    @Override // SimpleChannelInboundHandler
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) throws Exception {
        String path = new QueryStringDecoder(request.uri()).path();
        sLogger.trace("method:<{}> path:<{}>", request.method(), path);

        if (!request.decoderResult().isSuccess()) {
            sLogger.warn("Bad-request from {}", ctx.channel().remoteAddress());
            send(ctx, request, status(HttpResponseStatus.BAD_REQUEST));
            return;
        }

        HttpMethod method = request.method();
        if (HttpMethod.OPTIONS.equals(method)) {
            send(ctx, request, status(HttpResponseStatus.OK));
            return;
        }
        if (!HttpMethod.POST.equals(method) && !HttpMethod.GET.equals(method) && !HttpMethod.HEAD.equals(method)) {
            send(ctx, request, status(HttpResponseStatus.METHOD_NOT_ALLOWED));
            return;
        }

        offload(ctx, request, mStore::load, record -> route(ctx, request, path, record));
    }

    private void route(ChannelHandlerContext ctx, FullHttpRequest request, String path, CredentialRecord record) {
        if (HttpMethod.POST.equals(request.method())) {
            if (record == null) {
                handleSetup(ctx, request, path);
            } else {
                handleLogin(ctx, request, path);
            }
            return;
        }
        if (record == null) {
            send(ctx, request, html(Pages.setup(null)));
            return;
        }
        handleGet(ctx, request, path, record);
    }

    private void handleSetup(ChannelHandlerContext ctx, FullHttpRequest request, String path) {
        if (!PATH_SETUP.equals(path)) {
            send(ctx, request, status(HttpResponseStatus.METHOD_NOT_ALLOWED));
            return;
        }
        Map<String, List<String>> form = form(request);
        String username = first(form, "username", "admin").trim();
        String password = first(form, "password", "");
        if (username.isEmpty() || password.isEmpty()) {
            sLogger.warn("Setup rejected from {}", ctx.channel().remoteAddress());
            send(ctx, request, html(Pages.setup(Pages.ERROR_SETUP)));
            return;
        }
        offload(ctx, request, () -> {
            try {
                mStore.save(username, password);
                return true;
            } catch (IOException ex) {
                sLogger.warn("Setup failed - {}", ex.toString());
                return false;
            }
        }, saved -> send(ctx, request, saved ? redirect(PATH_LOGIN) : html(Pages.setup(Pages.ERROR_SETUP))));
    }

    private void handleLogin(ChannelHandlerContext ctx, FullHttpRequest request, String path) {
        if (!PATH_LOGIN.equals(path)) {
            send(ctx, request, status(HttpResponseStatus.METHOD_NOT_ALLOWED));
            return;
        }
        Map<String, List<String>> form = form(request);
        String username = first(form, "username", "").trim();
        String password = first(form, "password", "");
        offload(ctx, request, () -> mStore.verify(username, password), verified -> {
            if (!verified) {
                sLogger.warn("Login failed from {}", ctx.channel().remoteAddress());
                send(ctx, request, html(Pages.login(Pages.ERROR_LOGIN, username)));
                return;
            }
            String token = mSessions.create(username);
            sLogger.info("Login <{}> from {}", username, ctx.channel().remoteAddress());
            FullHttpResponse response = redirect(PATH_ROOT);
            response.headers().add(HttpHeaderNames.SET_COOKIE, SessionCookie.encode(mConfig.sessionCookieName, token));
            send(ctx, request, response);
        });
    }

    private void handleGet(ChannelHandlerContext ctx, FullHttpRequest request, String path, CredentialRecord record) {
        String token = SessionCookie.fromCookie(request.headers(), mConfig.sessionCookieName);
        Session session = mSessions.get(token);

        if (PATH_SETUP.equals(path)) {
            send(ctx, request, redirect(PATH_LOGIN));
            return;
        }
        if (PATH_LOGIN.equals(path)) {
            send(ctx, request, (session != null) ? redirect(PATH_ROOT) : html(Pages.login(null, record.username)));
            return;
        }
        if (PATH_LOGOUT.equals(path)) {
            mSessions.delete(token);
            FullHttpResponse response = redirect(PATH_LOGIN);
            response.headers().add(HttpHeaderNames.SET_COOKIE, SessionCookie.clear(mConfig.sessionCookieName));
            send(ctx, request, response);
            return;
        }
        if (PATH_ROOT.equals(path)) {
            send(ctx, request, redirect((session != null) ? mConfig.entryPage : PATH_LOGIN));
            return;
        }

        boolean wsToken = PATH_WS_TOKEN.equals(path);
        Path file = wsToken ? null : allowedFile(path);
        if (!wsToken && file == null) {
            send(ctx, request, status(HttpResponseStatus.NOT_FOUND));
            return;
        }
        boolean entry = mEntryFile.equals(file);
        if (session == null) {
            send(ctx, request, entry ? redirect(PATH_LOGIN) : status(HttpResponseStatus.UNAUTHORIZED));
            return;
        }

        if (wsToken) {
            String json = mCodec.toJson(Collections.singletonMap("token", session.token));
            FullHttpResponse response = content(HttpResponseStatus.OK, "application/json; charset=utf-8",
                    json.getBytes(StandardCharsets.UTF_8));
            response.headers().set(HttpHeaderNames.CACHE_CONTROL, HttpHeaderValues.NO_STORE);
            send(ctx, request, response);
            return;
        }
        serveFile(ctx, request, file, entry);
    }

    /**
     * Resolve the request path and match the result against the allow list,
     * so dot segments can not reach anything besides the entry page and the assets directory.
     *
     * @return the file to serve, or null if the path is not allowed
     */
    Path allowedFile(String path) {
        Path file;
        try {
            file = mWebRoot.resolve(relative(path)).normalize();
        } catch (InvalidPathException ex) {
            return null;
        }
        if (file.equals(mEntryFile)) {
            return file;
        }
        if (file.startsWith(mAssetsDir) && !file.equals(mAssetsDir)) {
            return file;
        }
        return null;
    }

    private void serveFile(ChannelHandlerContext ctx, FullHttpRequest request, Path file, boolean entry) {
        if (!Files.isRegularFile(file)) {
            send(ctx, request, status(HttpResponseStatus.NOT_FOUND));
            return;
        }
        byte[] data;
        try {
            data = Files.readAllBytes(file);
        } catch (IOException ex) {
            sLogger.warn("Failed to read {} - {}", file, ex.toString());
            send(ctx, request, status(HttpResponseStatus.INTERNAL_SERVER_ERROR));
            return;
        }
        FullHttpResponse response = content(HttpResponseStatus.OK, contentType(file), data);
        if (entry) {
            response.headers().set(HttpHeaderNames.CACHE_CONTROL, HttpHeaderValues.NO_STORE);
        }
        send(ctx, request, response);
    }

    private interface Completion<T> {
        void complete(T result);
    }

    /**
     * Run the task on the blocking group, continue on the channel event loop.
     * The request is retained until the continuation is done.
     */
    private <T> void offload(ChannelHandlerContext ctx, FullHttpRequest request, Callable<T> task, Completion<T> completion) {
        request.retain();
        mBlockingGroup.submit(task).addListener((FutureListener<T>) future -> ctx.executor().execute(() -> {
            try {
                if (future.isSuccess()) {
                    completion.complete(future.getNow());
                } else {
                    sLogger.warn("Credential task failed - {}", future.cause().toString());
                    send(ctx, request, status(HttpResponseStatus.INTERNAL_SERVER_ERROR));
                }
            } finally {
                request.release();
            }
        }));
    }

    private static String relative(String path) {
        int idx = 0;
        while (idx < path.length() && path.charAt(idx) == '/') {
            idx++;
        }
        return path.substring(idx);
    }

    private static String contentType(Path file) {
        String name = file.getFileName().toString();
        int idx = name.lastIndexOf('.');
        String type = (idx < 0) ? null : CONTENT_TYPES.get(name.substring(idx + 1).toLowerCase(Locale.ROOT));
        return (type != null) ? type : "application/octet-stream";
    }

    private static Map<String, List<String>> form(FullHttpRequest request) {
        String body = request.content().toString(StandardCharsets.UTF_8);
        return new QueryStringDecoder(body, StandardCharsets.UTF_8, false).parameters();
    }

    private static String first(Map<String, List<String>> form, String name, String fallback) {
        List<String> values = form.get(name);
        return (values == null || values.isEmpty()) ? fallback : values.get(0);
    }

    private static FullHttpResponse html(String page) {
        FullHttpResponse response = content(HttpResponseStatus.OK, "text/html; charset=utf-8",
                page.getBytes(StandardCharsets.UTF_8));
        response.headers().set(HttpHeaderNames.CACHE_CONTROL, HttpHeaderValues.NO_STORE);
        return response;
    }

    private static FullHttpResponse content(HttpResponseStatus status, String type, byte[] data) {
        ByteBuf buf = Unpooled.wrappedBuffer(data);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, buf);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, type);
        return response;
    }

    private static FullHttpResponse redirect(String location) {
        FullHttpResponse response = status(HttpResponseStatus.FOUND);
        response.headers().set(HttpHeaderNames.LOCATION, location);
        return response;
    }

    private static FullHttpResponse status(HttpResponseStatus status) {
        return new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.EMPTY_BUFFER);
    }

    private static void send(ChannelHandlerContext ctx, FullHttpRequest request, FullHttpResponse response) {
        HttpUtil.setContentLength(response, response.content().readableBytes());
        if (HttpMethod.HEAD.equals(request.method())) {
            response.content().clear();
        }
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        HttpUtil.setKeepAlive(response, keepAlive);
        ChannelFuture future = ctx.writeAndFlush(response);
        if (!keepAlive) {
            future.addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override // SimpleChannelInboundHandler
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        sLogger.warn("{}", cause.toString());
        ctx.close();
    }
}
