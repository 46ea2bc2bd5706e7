package org.muma.dredis.store.impl;

import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.protocol.SimpleString;
import org.muma.dredis.store.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 ConcurrentHashMap 的内存后端
 * <p>
 * CHM 内部按桶加锁：不同 key 的读写完全并行，同一 key 的操作串行，
 * 且锁只在单次 get / put / computeIfAbsent 期间持有，不会跨多次调用。
 * 进程内只创建一个实例，由所有连接共享。
 */
public class MemoryBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(MemoryBackend.class);

    // 1. 扁平 KV
    private final Map<String, RespFrame> map = new ConcurrentHashMap<>();

    // 2. 哈希表：外层 key -> 内层 field map
    private final Map<String, Map<String, RespFrame>> hmap = new ConcurrentHashMap<>();

    // 3. 集合：元素是 RespFrame，依赖其 equals / hashCode
    private final Map<String, Set<RespFrame>> dset = new ConcurrentHashMap<>();

    @Override
    public RespFrame get(String key) {
        return map.get(key);
    }

    @Override
    public void set(String key, RespFrame value) {
        map.put(key, value);
    }

    @Override
    public RespFrame hget(String key, String field) {
        Map<String, RespFrame> fields = hmap.get(key);
        return fields == null ? null : fields.get(field);
    }

    @Override
    public void hset(String key, String field, RespFrame value) {
        hmap.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).put(field, value);
    }

    @Override
    public Map<String, RespFrame> hgetall(String key) {
        Map<String, RespFrame> fields = hmap.get(key);
        // CHM 的迭代是弱一致的，这里复制一份，调用方拿到的是稳定快照
        return fields == null ? null : new TreeMap<>(fields);
    }

    @Override
    public List<RespFrame> hmget(String key, List<String> fields) {
        Map<String, RespFrame> inner = hmap.get(key);
        if (inner == null) {
            return null;
        }
        List<RespFrame> values = new ArrayList<>(fields.size());
        for (String field : fields) {
            RespFrame value = inner.get(field);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    @Override
    public RespFrame echo(String text) {
        return new SimpleString(text);
    }

    @Override
    public int sadd(String key, RespFrame item) {
        Set<RespFrame> set = dset.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet());
        return set.add(item) ? 1 : 0;
    }

    @Override
    public int sismember(String key, RespFrame item) {
        Set<RespFrame> set = dset.get(key);
        return set != null && set.contains(item) ? 1 : 0;
    }

    @Override
    public void flush() {
        log.info("Flushing backend: {} keys, {} hashes, {} sets", map.size(), hmap.size(), dset.size());
        map.clear();
        hmap.clear();
        dset.clear();
    }
}
