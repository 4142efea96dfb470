package com.rex.gate.proxy;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.DefaultByteBufHolder;

/**
 * The tokenized preamble together with the raw bytes that must reach the upstream verbatim
 */
public class ProxyRequest extends DefaultByteBufHolder {

    private final RequestPreamble mPreamble;

    public ProxyRequest(RequestPreamble preamble, ByteBuf raw) {
        super(raw);
        mPreamble = preamble;
    }

    public RequestPreamble preamble() {
        return mPreamble;
    }

    @Override
    public ProxyRequest replace(ByteBuf content) {
        return new ProxyRequest(mPreamble, content);
    }
}
