package com.rex.gate.proxy;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;

/**
 * Hand written responses, the proxied connection carries no http codec
 */
final class RawResponses {

    static final String REALM = "Good-GYM Login";

    private RawResponses() {
    }

    static ByteBuf unauthorized() {
        return ascii("HTTP/1.1 401 Unauthorized\r\n"
                + "WWW-Authenticate: Basic realm=\"" + REALM + "\"\r\n"
                + "Content-Length: 0\r\n"
                + "Connection: close\r\n"
                + "\r\n");
    }

    static ByteBuf redirect(String location) {
        return ascii("HTTP/1.1 302 Found\r\n"
                + "Location: " + location + "\r\n"
                + "Content-Length: 0\r\n"
                + "Connection: close\r\n"
                + "\r\n");
    }

    static ByteBuf html(String page) {
        byte[] body = page.getBytes(StandardCharsets.UTF_8);
        ByteBuf head = ascii("HTTP/1.1 200 OK\r\n"
                + "Content-Type: text/html; charset=utf-8\r\n"
                + "Content-Length: " + body.length + "\r\n"
                + "Cache-Control: no-store\r\n"
                + "Connection: close\r\n"
                + "\r\n");
        return Unpooled.wrappedBuffer(head, Unpooled.wrappedBuffer(body));
    }

    private static ByteBuf ascii(String text) {
        return Unpooled.copiedBuffer(text, StandardCharsets.US_ASCII);
    }
}
