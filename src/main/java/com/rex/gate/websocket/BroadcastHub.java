package com.rex.gate.websocket;

import com.google.gson.Gson;
import com.rex.gate.auth.Session;
import com.rex.gate.auth.SessionRegistry;
import com.rex.gate.http.SessionCookie;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.util.concurrent.EventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keep the authenticated websocket clients and fan out events to them
 *
 * The client set and the session registry are only touched on the hub executor,
 * other threads hand events over with {@link #submit(HubMessage)}.
 */
public class BroadcastHub {

    private static final Logger sLogger = LoggerFactory.getLogger(BroadcastHub.class);

    public static final int CLOSE_UNAUTHORIZED = 4401;

    private final Gson mCodec = new Gson();
    private final Set<Channel> mClients = new LinkedHashSet<>();
    private final EventExecutor mExecutor;
    private final SessionRegistry mSessions;
    private final String mCookieName;

    private final ChannelFutureListener mCloseListener = new ChannelFutureListener() {
        @Override
        public void operationComplete(ChannelFuture future) throws Exception {
            if (mClients.remove(future.channel())) {
                sLogger.info("Client {} disconnected, clients:{}", future.channel().remoteAddress(), mClients.size());
            }
        }
    };

    public BroadcastHub(EventExecutor executor, SessionRegistry sessions, String cookieName) {
        sLogger.trace("<init>");
        mExecutor = executor;
        mSessions = sessions;
        mCookieName = cookieName;
    }

    /**
     * Resolve the session from the cookie, or the token query parameter,
     * close the channel with {@link #CLOSE_UNAUTHORIZED} if neither is valid.
     *
     * @return true if the channel joined the live set
     */
    public boolean register(Channel ch, HttpHeaders headers, String uri) {
        String cookieToken = SessionCookie.fromCookie(headers, mCookieName);
        Session session = mSessions.get(cookieToken);
        String queryToken = null;
        if (session == null) {
            queryToken = SessionCookie.fromQuery(uri);
            session = mSessions.get(queryToken);
        }
        if (session == null) {
            String path = (uri == null) ? "/" : new QueryStringDecoder(uri).path();
            sLogger.warn("Unauthorized websocket {} path:{} cookie:{} token:{}",
                    ch.remoteAddress(), path, cookieToken != null, queryToken != null);
            ch.writeAndFlush(new CloseWebSocketFrame(CLOSE_UNAUTHORIZED, "Unauthorized"))
                    .addListener(ChannelFutureListener.CLOSE);
            return false;
        }

        mClients.add(ch);
        ch.closeFuture().addListener(mCloseListener);
        sLogger.info("Client {} connected as <{}>, clients:{}", ch.remoteAddress(), session.username, mClients.size());
        ch.writeAndFlush(new TextWebSocketFrame(mCodec.toJson(HubMessage.connected())));
        return true;
    }

    /**
     * Send the event to every live client, must run on the hub executor.
     * Clients whose send fails are pruned once the sweep is over.
     */
    public void broadcast(HubMessage event) {
        if (mClients.isEmpty()) {
            sLogger.warn("No client connected, skip {}", event);
            return;
        }
        sLogger.info("Broadcast sound:{} count:{} clients:{}", event.sound, event.count, mClients.size());

        ByteBuf payload = Unpooled.copiedBuffer(mCodec.toJson(event), StandardCharsets.UTF_8);
        Sweep sweep = new Sweep();
        try {
            // Snapshot, a failed write may close the channel and fire the close listener inline
            for (Channel ch : new ArrayList<>(mClients)) {
                if (!ch.isActive()) {
                    sweep.stale.add(ch);
                    continue;
                }
                ch.writeAndFlush(new TextWebSocketFrame(payload.retainedDuplicate()))
                        .addListener(sweep);
            }
        } finally {
            payload.release();
        }
        sweep.finish();
    }

    /**
     * Schedule a broadcast on the hub executor, safe to call from any thread
     */
    public void submit(HubMessage event) {
        mExecutor.execute(() -> broadcast(event));
    }

    public int size() {
        return mClients.size();
    }

    public boolean contains(Channel ch) {
        return mClients.contains(ch);
    }

    private void prune(Channel ch, Throwable cause) {
        if (mClients.remove(ch)) {
            sLogger.debug("Prune client {} - {}", ch.remoteAddress(), (cause != null) ? cause.toString() : "inactive");
        }
        ch.close();
    }

    /**
     * Collect send failures while iterating, prune them afterwards.
     * A failure reported after the sweep prunes right away.
     */
    private class Sweep implements ChannelFutureListener {
        final List<Channel> stale = new ArrayList<>();
        private boolean mDone;

        @Override
        public void operationComplete(ChannelFuture future) throws Exception {
            if (future.isSuccess()) {
                return;
            }
            if (mDone) {
                prune(future.channel(), future.cause());
            } else {
                stale.add(future.channel());
            }
        }

        void finish() {
            mDone = true;
            for (Channel ch : stale) {
                prune(ch, null);
            }
        }
    }
}
