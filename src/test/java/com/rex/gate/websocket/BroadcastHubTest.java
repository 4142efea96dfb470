package com.rex.gate.websocket;

import com.google.gson.Gson;
import com.rex.gate.auth.SessionRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.EmptyHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.util.ReferenceCountUtil;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.*;

public class BroadcastHubTest {

    private static final String COOKIE = "goodgym_session";

    private final Gson mGson = new Gson();
    private SessionRegistry mSessions;
    private EmbeddedChannel mLoop;
    private BroadcastHub mHub;

    @Before
    public void setUp() {
        mSessions = new SessionRegistry();
        mLoop = new EmbeddedChannel();
        mHub = new BroadcastHub(mLoop.eventLoop(), mSessions, COOKIE);
    }

    private static HttpHeaders cookie(String token) {
        return new DefaultHttpHeaders().add(HttpHeaderNames.COOKIE, COOKIE + "=" + token);
    }

    private HubMessage readMessage(EmbeddedChannel channel) {
        TextWebSocketFrame frame = channel.readOutbound();
        assertNotNull(frame);
        try {
            return mGson.fromJson(frame.text(), HubMessage.class);
        } finally {
            frame.release();
        }
    }

    @Test
    public void testUnauthorized() {
        EmbeddedChannel channel = new EmbeddedChannel();
        assertFalse(mHub.register(channel, EmptyHttpHeaders.INSTANCE, "/"));

        CloseWebSocketFrame frame = channel.readOutbound();
        assertEquals(BroadcastHub.CLOSE_UNAUTHORIZED, frame.statusCode());
        assertEquals("Unauthorized", frame.reasonText());
        frame.release();
        assertFalse(channel.isOpen());
        assertEquals(0, mHub.size());

        // Unknown tokens are no better than none
        channel = new EmbeddedChannel();
        assertFalse(mHub.register(channel, cookie("bogus"), "/?token=bogus"));
        assertFalse(mHub.contains(channel));
        channel.finishAndReleaseAll();
    }

    @Test
    public void testCookieSession() {
        String token = mSessions.create("admin");
        EmbeddedChannel channel = new EmbeddedChannel();
        assertTrue(mHub.register(channel, cookie(token), "/"));
        assertTrue(mHub.contains(channel));

        HubMessage ack = readMessage(channel);
        assertEquals(HubMessage.TYPE_CONNECTED, ack.type);
        assertEquals("ok", ack.message);
    }

    @Test
    public void testQueryToken() {
        String token = mSessions.create("admin");
        EmbeddedChannel channel = new EmbeddedChannel();
        // A stale cookie falls back to the query token
        assertTrue(mHub.register(channel, cookie("stale"), "/?token=" + token));
        assertEquals(HubMessage.TYPE_CONNECTED, readMessage(channel).type);
        assertEquals(1, mHub.size());
    }

    @Test
    public void testCloseRemoves() {
        String token = mSessions.create("admin");
        EmbeddedChannel channel = new EmbeddedChannel();
        mHub.register(channel, cookie(token), "/");
        assertEquals(1, mHub.size());

        channel.close();
        assertEquals(0, mHub.size());
        channel.finishAndReleaseAll();
    }

    @Test
    public void testBroadcastNoClient() {
        mHub.broadcast(HubMessage.playAudio(HubMessage.SOUND_COUNT, 1));
        assertEquals(0, mHub.size());
    }

    @Test
    public void testBroadcast() {
        String token = mSessions.create("admin");
        EmbeddedChannel first = new EmbeddedChannel();
        EmbeddedChannel second = new EmbeddedChannel();
        mHub.register(first, cookie(token), "/");
        mHub.register(second, EmptyHttpHeaders.INSTANCE, "/?token=" + token);
        readMessage(first);
        readMessage(second);

        mHub.broadcast(HubMessage.playAudio(HubMessage.SOUND_MILESTONE, 10));
        for (EmbeddedChannel channel : new EmbeddedChannel[] { first, second }) {
            HubMessage msg = readMessage(channel);
            assertEquals(HubMessage.TYPE_PLAY_AUDIO, msg.type);
            assertEquals(HubMessage.SOUND_MILESTONE, msg.sound);
            assertEquals(Integer.valueOf(10), msg.count);
        }
    }

    @Test
    public void testBroadcastPrunesFailure() {
        String token = mSessions.create("admin");
        EmbeddedChannel healthy = new EmbeddedChannel();
        EmbeddedChannel broken = new EmbeddedChannel();
        mHub.register(healthy, cookie(token), "/");
        mHub.register(broken, cookie(token), "/");
        readMessage(healthy);
        readMessage(broken);

        broken.pipeline().addFirst(new ChannelOutboundHandlerAdapter() {
            @Override
            public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                ReferenceCountUtil.release(msg);
                promise.setFailure(new IOException("Broken pipe"));
            }
        });

        mHub.broadcast(HubMessage.playAudio(HubMessage.SOUND_SUCCEED, null));
        assertEquals(HubMessage.SOUND_SUCCEED, readMessage(healthy).sound);
        assertTrue(mHub.contains(healthy));
        assertFalse(mHub.contains(broken));
        assertFalse(broken.isOpen());

        // The survivor keeps receiving
        mHub.broadcast(HubMessage.playAudio(HubMessage.SOUND_COUNT, 2));
        assertEquals(Integer.valueOf(2), readMessage(healthy).count);
    }

    @Test
    public void testSubmitRunsOnExecutor() {
        String token = mSessions.create("admin");
        EmbeddedChannel channel = new EmbeddedChannel();
        mHub.register(channel, cookie(token), "/");
        readMessage(channel);

        mHub.submit(HubMessage.playAudio(HubMessage.SOUND_COUNT, 3));
        assertNull(channel.readOutbound());

        mLoop.runPendingTasks();
        assertEquals(Integer.valueOf(3), readMessage(channel).count);
    }

    @Test
    public void testNullCountOmitted() {
        assertEquals("{\"type\":\"play_audio\",\"sound\":\"succeed\"}",
                mGson.toJson(HubMessage.playAudio(HubMessage.SOUND_SUCCEED, null)));
        assertEquals("{\"type\":\"connected\",\"message\":\"ok\"}", mGson.toJson(HubMessage.connected()));
    }
}
