package org.muma.dredis.protocol;

/**
 * RESP 帧类型
 * 声明顺序即帧之间比较时的判别序 (discriminant order)，不要随意调整。
 */
public enum RespType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    ARRAY('*'),
    NULL('_'),
    BOOLEAN('#'),
    DOUBLE(','),
    MAP('%'),
    SET('~');

    private static final RespType[] BY_MARKER = new RespType[128];

    static {
        for (RespType type : values()) {
            BY_MARKER[type.marker] = type;
        }
    }

    private final byte marker;

    RespType(char marker) {
        this.marker = (byte) marker;
    }

    public byte marker() {
        return marker;
    }

    /**
     * @return 对应的类型，未知标识返回 null
     */
    public static RespType fromMarker(byte marker) {
        if (marker < 0) return null;
        return BY_MARKER[marker];
    }
}
