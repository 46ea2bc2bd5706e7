package org.muma.dredis.store;

import org.muma.dredis.protocol.RespFrame;

import java.util.List;
import java.util.Map;

/**
 * 后端存储
 * <p>
 * 三个互相独立的命名空间：
 * <ul>
 *     <li>map  : key -> RespFrame，扁平 KV</li>
 *     <li>hmap : key -> (field -> RespFrame)，哈希表的哈希表</li>
 *     <li>dset : key -> Set&lt;RespFrame&gt;</li>
 * </ul>
 * 同一个 key 可以同时出现在多个命名空间里，互不影响。
 * 实现必须支持多连接线程并发读写，且不能使用全局锁 (不相关的 key 之间完全并行)。
 * 未命中一律返回 null，不是错误。
 */
public interface Backend {

    RespFrame get(String key);

    void set(String key, RespFrame value);

    RespFrame hget(String key, String field);

    // 外层 key 首次写入时创建内层 map，之后不会删除
    void hset(String key, String field, RespFrame value);

    /**
     * @return 内层 map 的快照 (按 field 排序)，外层 key 不存在时返回 null
     */
    Map<String, RespFrame> hgetall(String key);

    /**
     * 按请求顺序返回存在的 field 对应的值，不存在的 field 直接跳过 (结果可能比请求短)
     *
     * @return 外层 key 不存在时返回 null
     */
    List<RespFrame> hmget(String key, List<String> fields);

    RespFrame echo(String text);

    /**
     * @return 新加入返回 1，已存在返回 0
     */
    int sadd(String key, RespFrame item);

    /**
     * @return 存在返回 1，否则 (包括 key 不存在) 返回 0
     */
    int sismember(String key, RespFrame item);

    // 清空全部命名空间
    void flush();
}
