package com.rex.gate.http;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.cookie.Cookie;
import io.netty.handler.codec.http.cookie.CookieHeaderNames;
import io.netty.handler.codec.http.cookie.DefaultCookie;
import io.netty.handler.codec.http.cookie.ServerCookieDecoder;
import io.netty.handler.codec.http.cookie.ServerCookieEncoder;

import java.util.List;

/**
 * Session token carried by cookie, or by query parameter for websocket handshakes
 */
public final class SessionCookie {

    public static final String QUERY_TOKEN = "token";

    private SessionCookie() {
    }

    public static String encode(String name, String token) {
        DefaultCookie cookie = new DefaultCookie(name, token);
        cookie.setPath("/");
        cookie.setHttpOnly(true);
        cookie.setSameSite(CookieHeaderNames.SameSite.Strict);
        return ServerCookieEncoder.STRICT.encode(cookie);
    }

    public static String clear(String name) {
        DefaultCookie cookie = new DefaultCookie(name, "");
        cookie.setPath("/");
        cookie.setMaxAge(0);
        cookie.setHttpOnly(true);
        cookie.setSameSite(CookieHeaderNames.SameSite.Strict);
        return ServerCookieEncoder.STRICT.encode(cookie);
    }

    /**
     * @return the token from the named cookie, or null
     */
    public static String fromCookie(HttpHeaders headers, String name) {
        if (headers == null) {
            return null;
        }
        String header = headers.get(HttpHeaderNames.COOKIE);
        if (header == null || header.isEmpty()) {
            return null;
        }
        for (Cookie cookie : ServerCookieDecoder.STRICT.decode(header)) {
            if (name.equals(cookie.name())) {
                return cookie.value();
            }
        }
        return null;
    }

    /**
     * @return the token query parameter of the request uri, or null
     */
    public static String fromQuery(String uri) {
        if (uri == null) {
            return null;
        }
        List<String> values = new QueryStringDecoder(uri).parameters().get(QUERY_TOKEN);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }
}
