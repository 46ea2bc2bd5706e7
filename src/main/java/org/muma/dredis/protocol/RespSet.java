package org.muma.dredis.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 集合 (~)
 * <p>
 * 语义上是集合：equals / hashCode / compareTo 都在排序后的副本上计算，
 * 相同元素不同插入顺序的两个 Set 不可区分。构造时即规范化为排序列表，编码也按该顺序输出。
 */
public record RespSet(List<RespFrame> elements) implements RespFrame {

    public RespSet {
        List<RespFrame> sorted = new ArrayList<>(elements);
        Collections.sort(sorted);
        elements = Collections.unmodifiableList(sorted);
    }

    public static RespSet of(RespFrame... elements) {
        return new RespSet(Arrays.asList(elements));
    }

    public int size() {
        return elements.size();
    }

    @Override
    public RespType type() {
        return RespType.SET;
    }

    @Override
    public int comparePayload(RespFrame other) {
        return RespArray.compareLists(elements, ((RespSet) other).elements);
    }
}
