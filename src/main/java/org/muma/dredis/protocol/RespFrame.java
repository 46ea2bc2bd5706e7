package org.muma.dredis.protocol;

/**
 * RESP 帧：线上可交换的全部值类型 (封闭集合)
 * <p>
 * 帧之间是全序的：先按 {@link RespType} 判别序比较，再比较载荷。
 * 因为帧会直接作为 Set 元素和 Map 值存进后端，所以 equals / hashCode 必须与 compareTo 保持一致。
 */
public sealed interface RespFrame extends Comparable<RespFrame> permits
        SimpleString, SimpleError, RespInteger, BulkString, RespArray,
        RespNull, RespBoolean, RespDouble, RespMap, RespSet {

    RespType type();

    /**
     * 同类型载荷比较，调用方保证 other 与 this 类型相同
     */
    int comparePayload(RespFrame other);

    @Override
    default int compareTo(RespFrame other) {
        int c = Integer.compare(type().ordinal(), other.type().ordinal());
        return c != 0 ? c : comparePayload(other);
    }
}
