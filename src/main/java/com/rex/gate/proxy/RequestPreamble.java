package com.rex.gate.proxy;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Request line and header block of a proxied connection
 *
 * Only the bounded preamble is tokenized, the bytes are forwarded upstream untouched.
 * A preamble cut short by the budget still yields whatever lines are complete.
 */
public class RequestPreamble {

    private static final byte[] HEADER_END = { '\r', '\n', '\r', '\n' };

    private final String mMethod;
    private final String mPath;
    private final Map<String, List<String>> mHeaders;
    private final byte[] mBody;
    private final boolean mComplete;

    private RequestPreamble(String method, String path, Map<String, List<String>> headers, byte[] body, boolean complete) {
        mMethod = method;
        mPath = path;
        mHeaders = headers;
        mBody = body;
        mComplete = complete;
    }

    public static RequestPreamble parse(byte[] data) {
        int end = indexOfHeaderEnd(data, data.length);
        boolean complete = end >= 0;
        int blockLength = complete ? end : data.length;
        String block = new String(data, 0, blockLength, StandardCharsets.ISO_8859_1);

        String[] lines = block.split("\r\n", -1);
        String method = "";
        String path = "";
        String[] requestLine = lines[0].split(" ");
        if (requestLine.length >= 2) {
            method = requestLine[0];
            path = requestLine[1];
        }

        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        int last = complete ? lines.length : lines.length - 1; // Drop the unterminated tail
        for (int i = 1; i < last; i++) {
            int idx = lines[i].indexOf(':');
            if (idx <= 0) {
                continue;
            }
            String name = lines[i].substring(0, idx).trim();
            String value = lines[i].substring(idx + 1).trim();
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }

        byte[] body = new byte[0];
        if (complete) {
            int from = end + HEADER_END.length;
            body = new byte[data.length - from];
            System.arraycopy(data, from, body, 0, body.length);
        }
        return new RequestPreamble(method, path, headers, body, complete);
    }

    /**
     * @return offset of the blank line ending the header block, or -1
     */
    public static int indexOfHeaderEnd(byte[] data, int length) {
        outer:
        for (int i = 0; i + HEADER_END.length <= length; i++) {
            for (int j = 0; j < HEADER_END.length; j++) {
                if (data[i + j] != HEADER_END[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    public String method() {
        return mMethod;
    }

    /**
     * Path without the query string
     */
    public String path() {
        int idx = mPath.indexOf('?');
        return (idx < 0) ? mPath : mPath.substring(0, idx);
    }

    public String uri() {
        return mPath;
    }

    public String header(String name) {
        List<String> values = mHeaders.get(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }

    public List<String> headers(String name) {
        List<String> values = mHeaders.get(name);
        return (values == null) ? Collections.emptyList() : Collections.unmodifiableList(values);
    }

    /**
     * Declared body length, 0 if absent or not a number
     */
    public int contentLength() {
        String value = header("Content-Length");
        if (value == null) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(value));
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    public byte[] body() {
        return mBody;
    }

    public String bodyText() {
        return new String(mBody, StandardCharsets.UTF_8);
    }

    public boolean isComplete() {
        return mComplete;
    }

    @Override
    public String toString() {
        return "<@" + Integer.toHexString(hashCode()) + " method:" + mMethod + " path:" + path()
                + " headers:" + mHeaders.keySet() + " body:" + mBody.length + " complete:" + mComplete + ">";
    }
}
