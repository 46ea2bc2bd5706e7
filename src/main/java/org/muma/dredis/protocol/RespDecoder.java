package org.muma.dredis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * Netty 入站解码器
 * ByteToMessageDecoder 维护一个只追加的累积缓冲区，这里每次从中解出一个完整帧；
 * 半包时直接返回，readerIndex 保持不动，等下一批字节到达后重试。
 */
public class RespDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        try {
            out.add(RespFrameDecoder.decode(in));
        } catch (RespDecodeException e) {
            if (!e.isNotComplete()) {
                // 非法数据无法重新同步，丢弃剩余字节，连接随后会被关闭
                in.skipBytes(in.readableBytes());
                throw e;
            }
        }
    }
}
