package com.rex.gate.proxy;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Accumulate the start of a connection until the header block (and a declared form body) is in,
 * or the budget is used up, then emit one {@link ProxyRequest} and step out of the pipeline.
 *
 * Reading is paused after the emit, the gate handler resumes it once the client is relayed.
 */
public class RequestPreambleDecoder extends ByteToMessageDecoder {

    private static final Logger sLogger = LoggerFactory.getLogger(RequestPreambleDecoder.class);

    public static final int DEFAULT_BUDGET = 4096;

    private final int mBudget;

    public RequestPreambleDecoder() {
        this(DEFAULT_BUDGET);
    }

    public RequestPreambleDecoder(int budget) {
        mBudget = budget;
    }

    @Override // ByteToMessageDecoder
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        int readable = in.readableBytes();
        int window = Math.min(readable, mBudget);
        byte[] head = ByteBufUtil.getBytes(in, in.readerIndex(), window);

        if (readable < mBudget) {
            int end = RequestPreamble.indexOfHeaderEnd(head, head.length);
            if (end < 0) {
                return; // Wait for the rest of the header block
            }
            int wanted = end + 4 + RequestPreamble.parse(head).contentLength();
            if (readable < Math.min(wanted, mBudget)) {
                return; // Wait for the declared body
            }
        }

        RequestPreamble preamble = RequestPreamble.parse(head);
        sLogger.debug("Preamble {} from {}", preamble, ctx.channel().remoteAddress());
        ctx.channel().config().setAutoRead(false);
        out.add(new ProxyRequest(preamble, in.readRetainedSlice(readable)));
        ctx.pipeline().remove(this);
    }
}
