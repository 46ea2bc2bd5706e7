package org.muma.dredis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

public class RespEncoder extends MessageToByteEncoder<RespFrame> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RespFrame msg, ByteBuf out) {
        RespFrameEncoder.encode(msg, out);
    }
}
