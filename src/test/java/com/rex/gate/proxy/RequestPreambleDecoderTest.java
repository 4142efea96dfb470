package com.rex.gate.proxy;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class RequestPreambleDecoderTest {

    private static ByteBuf ascii(String text) {
        return Unpooled.copiedBuffer(text, StandardCharsets.ISO_8859_1);
    }

    @Test
    public void testWaitsForHeaderEnd() {
        EmbeddedChannel channel = new EmbeddedChannel(new RequestPreambleDecoder());
        assertFalse(channel.writeInbound(ascii("GET / HTTP/1.1\r\nHost: a\r\n")));
        assertNull(channel.readInbound());
        assertTrue(channel.config().isAutoRead());

        assertTrue(channel.writeInbound(ascii("\r\n")));
        ProxyRequest request = channel.readInbound();
        assertEquals("GET", request.preamble().method());
        assertEquals("a", request.preamble().header("Host"));
        assertEquals("GET / HTTP/1.1\r\nHost: a\r\n\r\n", request.content().toString(StandardCharsets.ISO_8859_1));
        request.release();

        // Paused and out of the way once the preamble is out
        assertFalse(channel.config().isAutoRead());
        assertNull(channel.pipeline().get(RequestPreambleDecoder.class));
        channel.finishAndReleaseAll();
    }

    @Test
    public void testWaitsForDeclaredBody() {
        EmbeddedChannel channel = new EmbeddedChannel(new RequestPreambleDecoder());
        assertFalse(channel.writeInbound(ascii("POST /setup HTTP/1.1\r\nContent-Length: 30\r\n\r\nusername=admin")));
        assertTrue(channel.writeInbound(ascii("&password=secret")));

        ProxyRequest request = channel.readInbound();
        assertEquals("username=admin&password=secret", request.preamble().bodyText());
        request.release();
        channel.finishAndReleaseAll();
    }

    @Test
    public void testBudget() {
        EmbeddedChannel channel = new EmbeddedChannel(new RequestPreambleDecoder(16));
        assertTrue(channel.writeInbound(ascii("GET /a-very-long-path HTTP/1.1\r\n")));

        ProxyRequest request = channel.readInbound();
        assertFalse(request.preamble().isComplete());
        // Every byte received so far is kept for the upstream
        assertEquals("GET /a-very-long-path HTTP/1.1\r\n", request.content().toString(StandardCharsets.ISO_8859_1));
        request.release();
        channel.finishAndReleaseAll();
    }
}
