package org.muma.dredis.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 批量字符串 ($)，唯一二进制安全的标量类型
 * <p>
 * content 为 null 表示 RESP2 的空批量字符串 ($-1)，用 {@link #NULL} 表示。
 * 字节数组按内容比较，顺序为无符号字典序，NULL 排在最前。
 * <p>
 * content 不做防御性拷贝：帧会作为集合元素存进后端，构造后不得再修改传入或取出的数组，
 * 否则哈希值变化会破坏集合成员关系。
 */
public record BulkString(byte[] content) implements RespFrame {

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    public static BulkString of(String s) {
        return new BulkString(s);
    }

    public static BulkString of(byte[] content) {
        return new BulkString(content);
    }

    public boolean isNull() {
        return content == null;
    }

    public int length() {
        return content == null ? -1 : content.length;
    }

    // 宽松解码，非法字节替换为 U+FFFD，仅用于日志
    public String asString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public RespType type() {
        return RespType.BULK_STRING;
    }

    @Override
    public int comparePayload(RespFrame other) {
        byte[] that = ((BulkString) other).content;
        if (content == null || that == null) {
            return Boolean.compare(content != null, that != null);
        }
        return Arrays.compareUnsigned(content, that);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BulkString b && Arrays.equals(content, b.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "BulkString[null]" : "BulkString[" + asString() + "]";
    }
}
