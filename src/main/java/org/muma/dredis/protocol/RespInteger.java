package org.muma.dredis.protocol;

// 整数 (:)，64 位有符号
public record RespInteger(long value) implements RespFrame {

    public static final RespInteger ZERO = new RespInteger(0);
    public static final RespInteger ONE = new RespInteger(1);

    public static RespInteger of(long value) {
        if (value == 0) return ZERO;
        if (value == 1) return ONE;
        return new RespInteger(value);
    }

    @Override
    public RespType type() {
        return RespType.INTEGER;
    }

    @Override
    public int comparePayload(RespFrame other) {
        return Long.compare(value, ((RespInteger) other).value);
    }
}
