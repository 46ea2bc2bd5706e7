package org.muma.dredis.store.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.dredis.protocol.BulkString;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.protocol.RespInteger;
import org.muma.dredis.protocol.SimpleString;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MemoryBackendTest {

    private MemoryBackend backend;

    @BeforeEach
    void setUp() {
        backend = new MemoryBackend();
    }

    @Test
    void testGetAndSet() {
        assertNull(backend.get("k"));

        backend.set("k", BulkString.of("v1"));
        assertEquals(BulkString.of("v1"), backend.get("k"));

        // 后写覆盖
        backend.set("k", RespInteger.of(2));
        assertEquals(RespInteger.of(2), backend.get("k"));
    }

    @Test
    void testHSetAndHGet() {
        assertNull(backend.hget("user:1", "name"));

        backend.hset("user:1", "name", BulkString.of("root"));
        backend.hset("user:1", "name", BulkString.of("admin"));
        assertEquals(BulkString.of("admin"), backend.hget("user:1", "name"));
        assertNull(backend.hget("user:1", "age"));
    }

    @Test
    void testHGetAllReturnsSortedSnapshot() {
        assertNull(backend.hgetall("u1"));

        backend.hset("u1", "k2", BulkString.of("v2"));
        backend.hset("u1", "k1", BulkString.of("v1"));
        Map<String, RespFrame> all = backend.hgetall("u1");

        assertEquals(List.of("k1", "k2"), new ArrayList<>(all.keySet()));

        // 快照不受后续写入影响
        backend.hset("u1", "k3", BulkString.of("v3"));
        assertEquals(2, all.size());
        assertEquals(3, backend.hgetall("u1").size());
    }

    @Test
    void testHMGetOmitsMissingFields() {
        assertNull(backend.hmget("h", List.of("a")));

        backend.hset("h", "a", BulkString.of("1"));
        backend.hset("h", "c", BulkString.of("3"));

        List<RespFrame> values = backend.hmget("h", List.of("c", "b", "a"));
        assertEquals(List.of(BulkString.of("3"), BulkString.of("1")), values);
        assertTrue(backend.hmget("h", List.of("x", "y")).isEmpty());
    }

    @Test
    void testSAddUsesSetSemantics() {
        assertEquals(1, backend.sadd("s", BulkString.of("a")));
        assertEquals(0, backend.sadd("s", BulkString.of("a")));
        assertEquals(1, backend.sadd("s", BulkString.of("b")));

        // 后续 SADD 不会替换掉已有的集合
        assertEquals(1, backend.sismember("s", BulkString.of("a")));
        assertEquals(1, backend.sismember("s", BulkString.of("b")));
        assertEquals(0, backend.sismember("s", BulkString.of("c")));
    }

    @Test
    void testSIsMemberOnMissingKeyIsZero() {
        assertEquals(0, backend.sismember("never", BulkString.of("a")));
    }

    @Test
    void testNamespacesAreIndependent() {
        backend.set("k", BulkString.of("string"));
        backend.hset("k", "f", BulkString.of("hash"));
        backend.sadd("k", BulkString.of("member"));

        assertEquals(BulkString.of("string"), backend.get("k"));
        assertEquals(BulkString.of("hash"), backend.hget("k", "f"));
        assertEquals(1, backend.sismember("k", BulkString.of("member")));
        assertEquals(0, backend.sismember("k", BulkString.of("string")));
    }

    @Test
    void testEcho() {
        assertEquals(new SimpleString("hello"), backend.echo("hello"));
    }

    @Test
    void testFlush() {
        backend.set("a", BulkString.of("1"));
        backend.hset("b", "f", BulkString.of("2"));
        backend.sadd("c", BulkString.of("3"));

        backend.flush();

        assertNull(backend.get("a"));
        assertNull(backend.hgetall("b"));
        assertEquals(0, backend.sismember("c", BulkString.of("3")));
    }

    /**
     * 多线程同时写同一个 hash / set：不能丢写，每个成员恰好被报告一次 "新加入"
     */
    @Test
    void testConcurrentWritesOnSameKey() throws Exception {
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    int added = 0;
                    for (int i = 0; i < perThread; i++) {
                        backend.hset("shared", "t" + id + "-" + i, RespInteger.of(i));
                        // 所有线程争抢同一批成员
                        added += backend.sadd("members", RespInteger.of(i));
                    }
                    return added;
                }));
            }
            start.countDown();

            int totalAdded = 0;
            for (Future<Integer> f : futures) {
                totalAdded += f.get(10, TimeUnit.SECONDS);
            }

            assertEquals(perThread, totalAdded);
            assertEquals(threads * perThread, backend.hgetall("shared").size());
        } finally {
            pool.shutdownNow();
        }
    }
}
