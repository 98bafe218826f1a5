package org.muma.respkv.store;

import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.store.lock.KeyLockManager;

import java.util.List;
import java.util.function.Supplier;

/**
 * 存储引擎抽象
 * <p>
 * 所有读写路径都会先检查过期：已过期的 Entry 视为不存在并被删除 (惰性删除)。
 * 对同一个 key 的 "读-改-写" 必须在 {@link #getLockManager()} 提供的锁内完成，
 * 这一点由 CommandDispatcher 统一保证，命令实现里不需要再加锁。
 */
public interface StorageEngine {

    // --- 基础 KV 操作 ---

    RedisData<?> get(String key);

    // 覆盖旧值 (包括类型)，TTL 跟随新 Entry
    void put(String key, RedisData<?> data);

    boolean remove(String key);

    boolean exists(String key);

    RedisDataType typeOf(String key);

    // --- 类型化访问 ---

    /**
     * 取出 key 的数据载体
     *
     * @return key 不存在时返回 null
     * @throws org.muma.respkv.common.exception.WrongTypeException 类型不匹配
     */
    <T> T getTyped(String key, RedisDataType type, Class<T> clazz);

    /**
     * 同 {@link #getTyped}，但 key 不存在时创建一个空容器并写入
     */
    <T> T getOrCreate(String key, RedisDataType type, Class<T> clazz, Supplier<T> factory);

    // --- 过期 ---

    /**
     * @param expireAt 绝对时间戳 (ms)
     * @return key 不存在返回 false
     */
    boolean expire(String key, long expireAt);

    boolean persist(String key);

    /**
     * @return 剩余毫秒数；-2 表示 key 不存在，-1 表示没有过期时间
     */
    long ttlMillis(String key);

    // --- 全库操作 ---

    /**
     * glob 匹配所有未过期的 key
     * 遍历是弱一致的：可以和写操作并发，但不保证看到同一时刻的快照
     */
    List<String> keys(String pattern);

    int size();

    void flush();

    KeyLockManager getLockManager();

    void shutdown();
}
