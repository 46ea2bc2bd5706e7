package org.muma.dredis.protocol;

/**
 * 浮点数 (,)
 * <p>
 * 使用 {@link Double#compare} 做全序：任意两个 NaN 相等，NaN 排在 +inf 之后，-0.0 小于 0.0。
 * equals / hashCode 与之保持一致 (record 默认的 double 比较语义正好相同，这里显式写出)。
 */
public record RespDouble(double value) implements RespFrame {

    public static RespDouble of(double value) {
        return new RespDouble(value);
    }

    public boolean isNaN() {
        return Double.isNaN(value);
    }

    @Override
    public RespType type() {
        return RespType.DOUBLE;
    }

    @Override
    public int comparePayload(RespFrame other) {
        return Double.compare(value, ((RespDouble) other).value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RespDouble d && Double.compare(value, d.value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}
