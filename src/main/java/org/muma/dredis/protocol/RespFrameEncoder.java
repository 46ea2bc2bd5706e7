package org.muma.dredis.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.dredis.utils.RespCodecUtil;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * RESP 帧编码器
 * 输出的字节与 {@link RespFrameDecoder} 接受的格式完全对应，复合类型递归写出。
 * Map 按 key 排序、Set 按规范顺序写出，保证同一个值的编码结果唯一。
 */
public final class RespFrameEncoder {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] MINUS_ONE = {'-', '1'};

    private RespFrameEncoder() {
    }

    public static void encode(RespFrame frame, ByteBuf out) {
        out.writeByte(frame.type().marker());
        switch (frame.type()) {
            case SIMPLE_STRING -> writeText(out, ((SimpleString) frame).content());
            case ERROR -> writeText(out, ((SimpleError) frame).content());
            case INTEGER -> writeAscii(out, Long.toString(((RespInteger) frame).value()));
            case BULK_STRING -> writeBulkString(out, (BulkString) frame);
            case ARRAY -> writeArray(out, (RespArray) frame);
            case NULL -> out.writeBytes(CRLF);
            case BOOLEAN -> writeAscii(out, ((RespBoolean) frame).value() ? "t" : "f");
            case DOUBLE -> writeAscii(out, RespCodecUtil.formatDouble(((RespDouble) frame).value()));
            case MAP -> writeMap(out, (RespMap) frame);
            case SET -> writeElements(out, ((RespSet) frame).elements());
        }
    }

    private static void writeText(ByteBuf out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    private static void writeAscii(ByteBuf out, String text) {
        out.writeCharSequence(text, StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }

    // $<len>\r\n<data>\r\n，空批量字符串为 $-1\r\n
    private static void writeBulkString(ByteBuf out, BulkString b) {
        if (b.isNull()) {
            out.writeBytes(MINUS_ONE);
            out.writeBytes(CRLF);
            return;
        }
        writeAscii(out, Integer.toString(b.content().length));
        out.writeBytes(b.content());
        out.writeBytes(CRLF);
    }

    private static void writeArray(ByteBuf out, RespArray a) {
        if (a.isNull()) {
            out.writeBytes(MINUS_ONE);
            out.writeBytes(CRLF);
            return;
        }
        writeElements(out, a.elements());
    }

    private static void writeElements(ByteBuf out, List<RespFrame> elements) {
        writeAscii(out, Integer.toString(elements.size()));
        for (RespFrame element : elements) {
            encode(element, out);
        }
    }

    // %<n>\r\n 之后按 key 升序写出 n 对 (key, value)
    private static void writeMap(ByteBuf out, RespMap map) {
        writeAscii(out, Integer.toString(map.size()));
        for (Map.Entry<String, RespFrame> entry : map.entries().entrySet()) {
            encode(mapKey(entry.getKey()), out);
            encode(entry.getValue(), out);
        }
    }

    // key 一般写成 SimpleString；含 CR/LF 的 key (例如来自 HSET 的二进制 field) 只能写成 BulkString
    private static RespFrame mapKey(String key) {
        if (key.indexOf('\r') >= 0 || key.indexOf('\n') >= 0) {
            return new BulkString(key);
        }
        return new SimpleString(key);
    }
}
