package org.muma.dredis.protocol;

import java.util.Objects;

// 错误消息 (-)，只携带文本，不是异常
public record SimpleError(String content) implements RespFrame {

    public SimpleError {
        Objects.requireNonNull(content, "content");
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("SimpleError must not contain CR or LF");
        }
    }

    public static SimpleError of(String content) {
        return new SimpleError(content);
    }

    @Override
    public RespType type() {
        return RespType.ERROR;
    }

    @Override
    public int comparePayload(RespFrame other) {
        return content.compareTo(((SimpleError) other).content);
    }
}
