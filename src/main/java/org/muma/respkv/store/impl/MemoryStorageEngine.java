package org.muma.respkv.store.impl;

import io.netty.util.concurrent.DefaultThreadFactory;
import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.exception.WrongTypeException;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.lock.KeyLockManager;
import org.muma.respkv.store.lock.LockHandle;
import org.muma.respkv.utils.GlobPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    public static final int DEFAULT_LOCK_STRIPES = 1024;

    // 每轮最多抽查的 key 数
    static final int SWEEP_SAMPLE_SIZE = 20;
    // 单次 sweep 最多连续跑的轮数，防止长时间占用
    private static final int SWEEP_MAX_ROUNDS = 16;

    // 1. 数据存储 (Key -> Data)
    private final Map<String, RedisData<?>> memoryDb = new ConcurrentHashMap<>();

    // 2. 过期索引 (Key -> ExpireAt Timestamp)
    // 清理线程只需要扫描这里，不必遍历全库
    private final Map<String, Long> ttlMap = new ConcurrentHashMap<>();

    private final KeyLockManager lockManager;

    // sweep 的断点，ConcurrentHashMap 的迭代器是弱一致性的，可以跨多次 cycle 使用
    private Iterator<Map.Entry<String, Long>> sweepCursor;

    // 3. 定期清理线程 (sweepIntervalMs <= 0 时不启动)
    private final ScheduledExecutorService cleanupExecutor;

    public MemoryStorageEngine() {
        this(0, DEFAULT_LOCK_STRIPES);
    }

    public MemoryStorageEngine(long sweepIntervalMs, int lockStripes) {
        this.lockManager = new KeyLockManager(lockStripes);
        if (sweepIntervalMs > 0) {
            this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(new DefaultThreadFactory("kv-expire-sweep", true));
            cleanupExecutor.scheduleWithFixedDelay(this::activeExpireCycle, sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
            log.info("Active expire cycle scheduled every {}ms", sweepIntervalMs);
        } else {
            this.cleanupExecutor = null;
        }
    }

    /**
     * 定期删除 (简化版 Redis activeExpireCycle)
     * 每轮从上次停下的位置继续抽查 SWEEP_SAMPLE_SIZE 个带 TTL 的 key；如果过期比例超过 25%，说明还有很多垃圾，立即再来一轮。
     * 删除前要拿到 key 所在 stripe 的锁，拿不到说明有命令正在操作它，跳过留给下一次。
     *
     * @return 本次删除的 key 数量
     */
    synchronized int activeExpireCycle() {
        int totalExpired = 0;
        try {
            for (int round = 0; round < SWEEP_MAX_ROUNDS && !ttlMap.isEmpty(); round++) {
                long now = System.currentTimeMillis();
                int sampled = 0;
                int expired = 0;
                boolean wrapped = false;

                while (sampled < SWEEP_SAMPLE_SIZE) {
                    // 游标走到末尾后从头开始，每轮最多绕回一次
                    if (sweepCursor == null || !sweepCursor.hasNext()) {
                        if (wrapped) break;
                        sweepCursor = ttlMap.entrySet().iterator();
                        wrapped = true;
                        if (!sweepCursor.hasNext()) break;
                    }
                    Map.Entry<String, Long> entry = sweepCursor.next();
                    sampled++;
                    if (now >= entry.getValue() && tryExpire(entry.getKey(), entry.getValue(), now)) {
                        expired++;
                    }
                }
                totalExpired += expired;
                if (expired * 4 <= sampled) break;
            }
        } catch (RuntimeException e) {
            // 异常不能逃出 scheduled task，否则后续调度会被取消
            log.error("Active expire cycle failed", e);
        }
        if (totalExpired > 0) {
            log.debug("Active expire cycle: expired {} keys", totalExpired);
        }
        return totalExpired;
    }

    // 在 key 锁内重新确认后再删除
    private boolean tryExpire(String key, long indexedExpireAt, long now) {
        try (LockHandle handle = lockManager.tryLock(key)) {
            if (handle == null) {
                return false;
            }
            RedisData<?> data = memoryDb.get(key);
            if (data == null) {
                // 只剩过期索引里的残留
                return ttlMap.remove(key, indexedExpireAt);
            }
            if (data.isExpired(now)) {
                evict(key, data);
                return true;
            }
            return false;
        }
    }

    // 只删除自己看到的那个 Entry，并发重复删除是幂等的
    private void evict(String key, RedisData<?> data) {
        if (memoryDb.remove(key, data)) {
            ttlMap.remove(key, data.getExpireAt());
        }
    }

    @Override
    public RedisData<?> get(String key) {
        RedisData<?> data = memoryDb.get(key);
        if (data == null) return null;

        // 惰性删除 (Lazy Expiration)
        if (data.isExpired()) {
            evict(key, data);
            return null;
        }
        return data;
    }

    @Override
    public void put(String key, RedisData<?> data) {
        memoryDb.put(key, data);
        // 有过期时间则登记到 ttlMap，否则从 ttlMap 移除 (可能由有过期变为无过期)
        if (data.hasExpire()) {
            ttlMap.put(key, data.getExpireAt());
        } else {
            ttlMap.remove(key);
        }
    }

    @Override
    public boolean remove(String key) {
        RedisData<?> data = memoryDb.remove(key);
        ttlMap.remove(key);
        // 已过期但尚未清理的 key 对客户端来说本来就不存在
        return data != null && !data.isExpired();
    }

    @Override
    public boolean exists(String key) {
        return get(key) != null;
    }

    @Override
    public RedisDataType typeOf(String key) {
        RedisData<?> data = get(key);
        return data == null ? null : data.getType();
    }

    @Override
    public <T> T getTyped(String key, RedisDataType type, Class<T> clazz) {
        RedisData<?> data = get(key);
        if (data == null) return null;
        if (data.getType() != type) {
            throw new WrongTypeException();
        }
        return data.getValue(clazz);
    }

    @Override
    public <T> T getOrCreate(String key, RedisDataType type, Class<T> clazz, Supplier<T> factory) {
        T existing = getTyped(key, type, clazz);
        if (existing != null) return existing;

        T created = factory.get();
        put(key, new RedisData<>(type, created));
        return created;
    }

    @Override
    public boolean expire(String key, long expireAt) {
        RedisData<?> data = get(key);
        if (data == null) return false;
        data.setExpireAt(expireAt);
        ttlMap.put(key, expireAt);
        return true;
    }

    @Override
    public boolean persist(String key) {
        RedisData<?> data = get(key);
        if (data == null || !data.hasExpire()) return false;
        data.setExpireAt(RedisData.NO_EXPIRE);
        ttlMap.remove(key);
        return true;
    }

    @Override
    public long ttlMillis(String key) {
        RedisData<?> data = get(key);
        if (data == null) return -2;
        long expireAt = data.getExpireAt();
        if (expireAt == RedisData.NO_EXPIRE) return -1;
        // get 之后到这里可能恰好过期
        return Math.max(0, expireAt - System.currentTimeMillis());
    }

    @Override
    public List<String> keys(String pattern) {
        GlobPattern glob = GlobPattern.compile(pattern);
        long now = System.currentTimeMillis();
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, RedisData<?>> entry : memoryDb.entrySet()) {
            if (entry.getValue().isExpired(now)) continue;
            if (glob.matches(entry.getKey())) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    @Override
    public int size() {
        return memoryDb.size();
    }

    @Override
    public void flush() {
        memoryDb.clear();
        ttlMap.clear();
        log.info("Store flushed");
    }

    @Override
    public KeyLockManager getLockManager() {
        return lockManager;
    }

    @Override
    public void shutdown() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
        }
    }
}
