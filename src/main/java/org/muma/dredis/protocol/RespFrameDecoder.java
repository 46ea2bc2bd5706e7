package org.muma.dredis.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.dredis.utils.RespCodecUtil;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * RESP 帧解码器 (两阶段：先测量，再消费)
 * <p>
 * 1. {@link #expectLength} 只读扫描缓冲区，计算一个完整帧需要多少字节，复合类型递归测量每个元素；
 * 字节不够时抛出 {@link DecodeError#NOT_COMPLETE}。
 * 2. 确认完整后才真正解析载荷，并从缓冲区头部移除恰好这么多字节。
 * <p>
 * 任何失败路径 (半包或非法数据) 都不会移动 readerIndex，调用方可以在收到更多字节后原样重试。
 * 所有方法都是无状态的，可以在多个连接线程上同时使用。
 */
public final class RespFrameDecoder {

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 与 Redis 的 proto-max-bulk-len 默认值一致
    static final long MAX_BULK_LENGTH = 512L * 1024 * 1024;

    // 复合类型的最大嵌套层数，超过即视为非法帧，避免递归耗尽线程栈
    static final int MAX_NESTING_DEPTH = 512;

    private RespFrameDecoder() {
    }

    /**
     * 从 buf 的 readerIndex 处解码一个完整帧，成功时 readerIndex 前进帧长度
     *
     * @throws RespDecodeException 字节不足 (NOT_COMPLETE) 或数据非法
     */
    public static RespFrame decode(ByteBuf buf) {
        int start = buf.readerIndex();
        int length = expectLength(buf);

        FrameReader reader = new FrameReader(buf, start);
        RespFrame frame = reader.readFrame();
        if (reader.index != start + length) {
            throw new RespDecodeException(DecodeError.INVALID_FRAME,
                    "Frame length mismatch: expected " + length + ", parsed " + (reader.index - start));
        }

        buf.skipBytes(length);
        return frame;
    }

    /**
     * 测量 readerIndex 处的完整帧占用的字节数，不消费任何字节
     */
    public static int expectLength(ByteBuf buf) {
        int start = buf.readerIndex();
        return measure(buf, start, 0) - start;
    }

    // 返回帧的结束位置 (不含)
    private static int measure(ByteBuf buf, int start, int depth) {
        if (depth > MAX_NESTING_DEPTH) {
            throw new RespDecodeException(DecodeError.INVALID_FRAME,
                    "Frame nesting exceeds " + MAX_NESTING_DEPTH + " levels");
        }
        RespType type = typeAt(buf, start);
        int cr = findCrlf(buf, start + 1);
        int next = cr + 2;

        switch (type) {
            case BULK_STRING -> {
                long len = parseLength(buf, start + 1, cr);
                if (len == -1) {
                    return next;
                }
                if (len < 0 || len > MAX_BULK_LENGTH) {
                    throw invalidLength(len);
                }
                long end = next + len + 2;
                if (end > buf.writerIndex()) {
                    throw RespDecodeException.notComplete();
                }
                return (int) end;
            }
            case ARRAY, MAP, SET -> {
                long count = parseLength(buf, start + 1, cr);
                if (count == -1 && type == RespType.ARRAY) {
                    return next;
                }
                if (count < 0 || count > Integer.MAX_VALUE) {
                    throw invalidLength(count);
                }
                long items = type == RespType.MAP ? count * 2 : count;
                int offset = next;
                for (long i = 0; i < items; i++) {
                    offset = measure(buf, offset, depth + 1);
                }
                return offset;
            }
            default -> {
                return next;
            }
        }
    }

    private static RespType typeAt(ByteBuf buf, int index) {
        if (index >= buf.writerIndex()) {
            throw RespDecodeException.notComplete();
        }
        byte marker = buf.getByte(index);
        RespType type = RespType.fromMarker(marker);
        if (type == null) {
            throw new RespDecodeException(DecodeError.INVALID_FRAME_TYPE,
                    "Invalid frame type: '" + (char) (marker & 0xFF) + "'");
        }
        return type;
    }

    // 返回从 from 开始第一个 CR 的位置，且其后必须紧跟 LF
    private static int findCrlf(ByteBuf buf, int from) {
        int end = buf.writerIndex();
        int cr = buf.indexOf(from, end, CR);
        if (cr < 0 || cr + 1 >= end) {
            throw RespDecodeException.notComplete();
        }
        if (buf.getByte(cr + 1) != LF) {
            throw new RespDecodeException(DecodeError.INVALID_FRAME, "Expected LF after CR at offset " + cr);
        }
        return cr;
    }

    private static long parseLength(ByteBuf buf, int from, int to) {
        return parseLong(buf.toString(from, to - from, StandardCharsets.US_ASCII));
    }

    private static long parseLong(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespDecodeException(DecodeError.PARSE_INT_ERROR, "Invalid integer: '" + s + "'", e);
        }
    }

    private static RespDecodeException invalidLength(long len) {
        return new RespDecodeException(DecodeError.INVALID_FRAME_LENGTH, "Invalid frame length: " + len);
    }

    /**
     * 第二阶段：在已确认完整的字节上按绝对位置解析，最后由 {@link #decode} 统一 skip
     * <p>
     * 嵌套深度已在测量阶段限制，这里的递归不会超过 {@link #MAX_NESTING_DEPTH} 层。
     */
    private static final class FrameReader {

        private final ByteBuf buf;
        private int index;

        FrameReader(ByteBuf buf, int index) {
            this.buf = buf;
            this.index = index;
        }

        RespFrame readFrame() {
            RespType type = typeAt(buf, index);
            index++;
            return switch (type) {
                case SIMPLE_STRING -> new SimpleString(readText());
                case ERROR -> new SimpleError(readText());
                case INTEGER -> RespInteger.of(parseLong(readAscii()));
                case BULK_STRING -> readBulkString();
                case ARRAY -> readArray();
                case NULL -> readNull();
                case BOOLEAN -> readBoolean();
                case DOUBLE -> readDouble();
                case MAP -> readMap();
                case SET -> readSet();
            };
        }

        // 读取到 CRLF 为止 (不含)，并跳过 CRLF
        private byte[] readLine() {
            int cr = findCrlf(buf, index);
            byte[] line = new byte[cr - index];
            buf.getBytes(index, line);
            index = cr + 2;
            return line;
        }

        private String readAscii() {
            return new String(readLine(), StandardCharsets.US_ASCII);
        }

        private String readText() {
            byte[] line = readLine();
            for (byte b : line) {
                if (b == LF) {
                    throw new RespDecodeException(DecodeError.INVALID_FRAME, "Line frame must not contain LF");
                }
            }
            return utf8(line);
        }

        private BulkString readBulkString() {
            long len = parseLong(readAscii());
            if (len == -1) {
                return BulkString.NULL;
            }
            byte[] content = new byte[(int) len];
            buf.getBytes(index, content);
            index += content.length;
            if (buf.getByte(index) != CR || buf.getByte(index + 1) != LF) {
                throw new RespDecodeException(DecodeError.INVALID_FRAME, "Bulk string must end with CRLF");
            }
            index += 2;
            return new BulkString(content);
        }

        private RespArray readArray() {
            long count = parseLong(readAscii());
            if (count == -1) {
                return RespArray.NULL;
            }
            return new RespArray(readElements((int) count));
        }

        private RespSet readSet() {
            int count = (int) parseLong(readAscii());
            return new RespSet(readElements(count));
        }

        private List<RespFrame> readElements(int count) {
            List<RespFrame> elements = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                elements.add(readFrame());
            }
            return elements;
        }

        private RespMap readMap() {
            int count = (int) parseLong(readAscii());
            SortedMap<String, RespFrame> entries = new TreeMap<>();
            for (int i = 0; i < count; i++) {
                RespFrame key = readFrame();
                RespFrame value = readFrame();
                entries.put(mapKey(key), value);
            }
            return new RespMap(entries);
        }

        private String mapKey(RespFrame key) {
            if (key instanceof SimpleString s) {
                return s.content();
            }
            if (key instanceof BulkString b && !b.isNull()) {
                return utf8(b.content());
            }
            throw new RespDecodeException(DecodeError.INVALID_FRAME, "Map key must be a string, got " + key.type());
        }

        private RespNull readNull() {
            if (readLine().length != 0) {
                throw new RespDecodeException(DecodeError.INVALID_FRAME, "Null frame must be '_\\r\\n'");
            }
            return RespNull.INSTANCE;
        }

        private RespBoolean readBoolean() {
            String s = readAscii();
            return switch (s) {
                case "t" -> RespBoolean.TRUE;
                case "f" -> RespBoolean.FALSE;
                default -> throw new RespDecodeException(DecodeError.INVALID_FRAME, "Invalid boolean: '" + s + "'");
            };
        }

        private RespDouble readDouble() {
            String s = readAscii();
            try {
                return new RespDouble(RespCodecUtil.parseDouble(s));
            } catch (NumberFormatException e) {
                throw new RespDecodeException(DecodeError.PARSE_FLOAT_ERROR, "Invalid double: '" + s + "'", e);
            }
        }

        private static String utf8(byte[] bytes) {
            try {
                return RespCodecUtil.decodeUtf8(bytes);
            } catch (CharacterCodingException e) {
                throw new RespDecodeException(DecodeError.UTF8_ERROR, "Invalid UTF-8 sequence", e);
            }
        }
    }
}
