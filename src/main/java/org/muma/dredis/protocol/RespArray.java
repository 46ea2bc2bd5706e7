package org.muma.dredis.protocol;

import java.util.Arrays;
import java.util.List;

/**
 * 数组 (*)，元素有序，可递归嵌套
 * <p>
 * elements 为 null 表示 RESP2 的空数组 (*-1)，用 {@link #NULL} 表示。
 */
public record RespArray(List<RespFrame> elements) implements RespFrame {

    public static final RespArray NULL = new RespArray(null);
    public static final RespArray EMPTY = new RespArray(List.of());

    public RespArray {
        if (elements != null) {
            elements = List.copyOf(elements);
        }
    }

    public static RespArray of(RespFrame... elements) {
        return new RespArray(Arrays.asList(elements));
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? 0 : elements.size();
    }

    public RespFrame get(int index) {
        return elements.get(index);
    }

    @Override
    public RespType type() {
        return RespType.ARRAY;
    }

    @Override
    public int comparePayload(RespFrame other) {
        List<RespFrame> that = ((RespArray) other).elements;
        if (elements == null || that == null) {
            return Boolean.compare(elements != null, that != null);
        }
        return compareLists(elements, that);
    }

    static int compareLists(List<RespFrame> a, List<RespFrame> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }
}
