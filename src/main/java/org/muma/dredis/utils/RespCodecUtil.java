package org.muma.dredis.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.protocol.RespFrameEncoder;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * RESP 编解码工具类
 * 文本校验、浮点数格式化，以及脱离 Netty pipeline 的 byte[] 编码
 */
public final class RespCodecUtil {

    // 十进制 / 科学计数法，拒绝 Java 特有的 "1.5d"、十六进制浮点等写法
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private RespCodecUtil() {
    }

    public static byte[] encode(RespFrame frame) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            RespFrameEncoder.encode(frame, buf);
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    /**
     * 严格 UTF-8 解码，非法字节序列直接报错而不是替换成 U+FFFD
     */
    public static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    public static String formatDouble(double value) {
        if (Double.isNaN(value)) return "nan";
        if (value == Double.POSITIVE_INFINITY) return "inf";
        if (value == Double.NEGATIVE_INFINITY) return "-inf";
        return Double.toString(value);
    }

    public static double parseDouble(String s) {
        return switch (s.toLowerCase(Locale.ROOT)) {
            case "nan" -> Double.NaN;
            case "inf", "+inf" -> Double.POSITIVE_INFINITY;
            case "-inf" -> Double.NEGATIVE_INFINITY;
            default -> {
                if (!DECIMAL.matcher(s).matches()) {
                    throw new NumberFormatException("Invalid double: " + s);
                }
                yield Double.parseDouble(s);
            }
        };
    }
}
