package org.muma.dredis.protocol;

import java.util.Objects;

// 简单字符串 (+)，不能包含 CR / LF
public record SimpleString(String content) implements RespFrame {

    public SimpleString {
        Objects.requireNonNull(content, "content");
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("SimpleString must not contain CR or LF");
        }
    }

    public static SimpleString of(String content) {
        return new SimpleString(content);
    }

    @Override
    public RespType type() {
        return RespType.SIMPLE_STRING;
    }

    @Override
    public int comparePayload(RespFrame other) {
        return content.compareTo(((SimpleString) other).content);
    }
}
