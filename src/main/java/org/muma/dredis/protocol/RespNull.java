package org.muma.dredis.protocol;

// 空值 (_)
public record RespNull() implements RespFrame {

    public static final RespNull INSTANCE = new RespNull();

    @Override
    public RespType type() {
        return RespType.NULL;
    }

    @Override
    public int comparePayload(RespFrame other) {
        return 0;
    }

    @Override
    public String toString() {
        return "RespNull";
    }
}
