package org.muma.dredis.protocol;

// 布尔 (#t / #f)
public record RespBoolean(boolean value) implements RespFrame {

    public static final RespBoolean TRUE = new RespBoolean(true);
    public static final RespBoolean FALSE = new RespBoolean(false);

    public static RespBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public RespType type() {
        return RespType.BOOLEAN;
    }

    @Override
    public int comparePayload(RespFrame other) {
        return Boolean.compare(value, ((RespBoolean) other).value);
    }
}
