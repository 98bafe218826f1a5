package org.muma.respkv.store.impl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisList;
import org.muma.respkv.common.exception.WrongTypeException;
import org.muma.respkv.store.lock.LockHandle;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStorageEngineTest {

    private MemoryStorageEngine storage;

    @BeforeEach
    void setUp() {
        // 关闭后台 sweep，由测试手动驱动
        storage = new MemoryStorageEngine();
    }

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    private static RedisData<byte[]> string(String value) {
        return new RedisData<>(RedisDataType.STRING, value.getBytes(StandardCharsets.UTF_8));
    }

    private static RedisData<byte[]> expiring(String value, long expireAt) {
        RedisData<byte[]> data = string(value);
        data.setExpireAt(expireAt);
        return data;
    }

    @Test
    void testPutGetRemove() {
        storage.put("k", string("v"));

        assertTrue(storage.exists("k"));
        assertEquals(RedisDataType.STRING, storage.typeOf("k"));
        assertArrayEquals("v".getBytes(StandardCharsets.UTF_8), storage.getTyped("k", RedisDataType.STRING, byte[].class));

        assertTrue(storage.remove("k"));
        assertFalse(storage.remove("k"));
        assertNull(storage.get("k"));
        assertNull(storage.typeOf("k"));
    }

    @Test
    void testLazyExpiration() {
        storage.put("gone", expiring("v", System.currentTimeMillis() - 1));

        // 物理上还在，逻辑上已经不存在
        assertEquals(1, storage.size());
        assertNull(storage.get("gone"));
        assertEquals(0, storage.size());
        assertEquals(-2, storage.ttlMillis("gone"));
    }

    @Test
    void testRemoveOfExpiredEntryReportsAbsent() {
        storage.put("gone", expiring("v", System.currentTimeMillis() - 1));
        assertFalse(storage.remove("gone"));
    }

    @Test
    void testExpireAndPersist() {
        storage.put("k", string("v"));
        assertEquals(-1, storage.ttlMillis("k"));
        assertFalse(storage.persist("k"));

        assertTrue(storage.expire("k", System.currentTimeMillis() + 10_000));
        long ttl = storage.ttlMillis("k");
        assertTrue(ttl > 9_000 && ttl <= 10_000, "ttl=" + ttl);

        assertTrue(storage.persist("k"));
        assertEquals(-1, storage.ttlMillis("k"));
        assertFalse(storage.expire("missing", System.currentTimeMillis() + 1000));
    }

    @Test
    void testPutReplacesTtl() {
        storage.put("k", expiring("v", System.currentTimeMillis() + 10_000));
        storage.put("k", string("v2"));

        assertEquals(-1, storage.ttlMillis("k"));
    }

    @Test
    void testActiveExpireCycleReclaimsWithoutAccess() {
        long past = System.currentTimeMillis() - 1;
        for (int i = 0; i < 100; i++) {
            storage.put("tmp:" + i, expiring("v", past));
        }
        storage.put("live", expiring("v", System.currentTimeMillis() + 60_000));
        storage.put("plain", string("v"));

        // 过期比例很高，一次 cycle 会连续跑多轮
        int evicted = storage.activeExpireCycle();
        assertTrue(evicted > MemoryStorageEngine.SWEEP_SAMPLE_SIZE, "evicted=" + evicted);

        while (storage.activeExpireCycle() > 0) {
            // 直到清理干净
        }
        assertEquals(2, storage.size());
        assertTrue(storage.exists("live"));
        assertTrue(storage.exists("plain"));
    }

    @Test
    void testRepeatedCyclesReachKeysBehindLiveOnes() {
        long hourLater = System.currentTimeMillis() + 3_600_000;
        for (int i = 0; i < 1000; i++) {
            storage.put("live:" + i, expiring("v", hourLater));
        }
        long past = System.currentTimeMillis() - 1;
        for (int i = 0; i < 50; i++) {
            storage.put("dead:" + i, expiring("v", past));
        }

        // 每次 cycle 从上次的位置继续，足够多次之后整张 TTL 表都被扫过
        int evicted = 0;
        for (int i = 0; i < 200; i++) {
            evicted += storage.activeExpireCycle();
        }

        assertEquals(50, evicted);
        assertEquals(1000, storage.size());
        for (int i = 0; i < 50; i++) {
            assertFalse(storage.exists("dead:" + i));
        }
    }

    @Test
    void testSweepSkipsKeyLockedByCommand() throws Exception {
        storage.put("k", expiring("v", System.currentTimeMillis() - 1));
        Callable<Integer> sweep = storage::activeExpireCycle;
        ExecutorService sweeper = Executors.newSingleThreadExecutor();
        try {
            // 命令线程持有 k 的锁时，清理线程不能动它
            try (LockHandle ignored = storage.getLockManager().lock("k")) {
                assertEquals(0, sweeper.submit(sweep).get(5, TimeUnit.SECONDS));
                assertEquals(1, storage.size());
            }
            assertEquals(1, sweeper.submit(sweep).get(5, TimeUnit.SECONDS));
            assertEquals(0, storage.size());
        } finally {
            sweeper.shutdownNow();
        }
    }

    @Test
    void testSweepLeavesKeyRewrittenWithLaterExpiry() {
        long past = System.currentTimeMillis() - 1;
        storage.put("k", expiring("old", past));
        // 同一个 key 被重新写入，过期时间延后
        storage.put("k", expiring("new", System.currentTimeMillis() + 60_000));

        assertEquals(0, storage.activeExpireCycle());
        assertTrue(storage.exists("k"));
    }

    @Test
    void testBackgroundSweep() throws InterruptedException {
        MemoryStorageEngine swept = new MemoryStorageEngine(10, 16);
        try {
            swept.put("k", expiring("v", System.currentTimeMillis() + 20));
            long deadline = System.currentTimeMillis() + 5_000;
            while (swept.size() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, swept.size());
        } finally {
            swept.shutdown();
        }
    }

    @Test
    void testTypedAccess() {
        storage.put("str", string("v"));

        assertThrows(WrongTypeException.class, () -> storage.getTyped("str", RedisDataType.LIST, RedisList.class));
        assertThrows(WrongTypeException.class,
                () -> storage.getOrCreate("str", RedisDataType.LIST, RedisList.class, RedisList::new));
        assertNull(storage.getTyped("missing", RedisDataType.LIST, RedisList.class));

        RedisList created = storage.getOrCreate("list", RedisDataType.LIST, RedisList.class, RedisList::new);
        assertSame(created, storage.getOrCreate("list", RedisDataType.LIST, RedisList.class, RedisList::new));
        assertEquals(RedisDataType.LIST, storage.typeOf("list"));
    }

    @Test
    void testKeysSkipsExpired() {
        storage.put("user:1", string("a"));
        storage.put("user:2", string("b"));
        storage.put("user:3", expiring("c", System.currentTimeMillis() - 1));
        storage.put("order:1", string("d"));

        List<String> keys = storage.keys("user:*");
        assertEquals(Set.of("user:1", "user:2"), new HashSet<>(keys));
        assertEquals(3, storage.keys("*").size());
    }

    @Test
    void testFlush() {
        storage.put("a", string("1"));
        storage.put("b", expiring("2", System.currentTimeMillis() + 10_000));

        storage.flush();

        assertEquals(0, storage.size());
        assertEquals(0, storage.activeExpireCycle());
    }
}
