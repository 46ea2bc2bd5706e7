package org.muma.dredis.protocol;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 有序映射 (%)
 * <p>
 * 底层是 TreeMap，按 key 排序，迭代和编码顺序与插入顺序无关。
 * 构造时复制一份，对外暴露的 entries 是只读视图，帧本身不可变。
 */
public record RespMap(SortedMap<String, RespFrame> entries) implements RespFrame {

    public RespMap() {
        this(new TreeMap<>());
    }

    public RespMap {
        // 总是按 key 的自然顺序重建，不沿用调用方 SortedMap 的比较器
        TreeMap<String, RespFrame> copy = new TreeMap<>();
        copy.putAll(entries);
        entries = copy;
    }

    public static RespMap of(Map<String, RespFrame> entries) {
        TreeMap<String, RespFrame> copy = new TreeMap<>();
        copy.putAll(entries);
        return new RespMap(copy);
    }

    public RespFrame get(String key) {
        return entries.get(key);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public SortedMap<String, RespFrame> entries() {
        return Collections.unmodifiableSortedMap(entries);
    }

    @Override
    public RespType type() {
        return RespType.MAP;
    }

    @Override
    public int comparePayload(RespFrame other) {
        Iterator<Map.Entry<String, RespFrame>> a = entries.entrySet().iterator();
        Iterator<Map.Entry<String, RespFrame>> b = ((RespMap) other).entries.entrySet().iterator();
        while (a.hasNext() && b.hasNext()) {
            Map.Entry<String, RespFrame> x = a.next();
            Map.Entry<String, RespFrame> y = b.next();
            int c = x.getKey().compareTo(y.getKey());
            if (c != 0) return c;
            c = x.getValue().compareTo(y.getValue());
            if (c != 0) return c;
        }
        return Boolean.compare(a.hasNext(), b.hasNext());
    }
}
