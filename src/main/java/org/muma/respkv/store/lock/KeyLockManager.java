package org.muma.respkv.store.lock;

import java.util.Arrays;
import java.util.Collection;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 分段 Key 锁 (Lock Striping)
 * <p>
 * 每个 key 按 hash 落到一个 stripe 上。一条命令涉及多个 key 时，
 * 按 stripe 下标升序加锁，所有线程遵循同一顺序，因此不会出现循环等待。
 * 访问不相交 stripe 的命令可以并发执行。
 */
public class KeyLockManager {

    private final ReentrantLock[] stripes;
    private final int mask;

    public KeyLockManager(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        int size = Integer.highestOneBit(stripeCount);
        if (size < stripeCount) size <<= 1;
        this.stripes = new ReentrantLock[size];
        for (int i = 0; i < size; i++) {
            stripes[i] = new ReentrantLock();
        }
        this.mask = size - 1;
    }

    public int stripeCount() {
        return stripes.length;
    }

    public int stripeOf(String key) {
        int h = key.hashCode();
        // 与 HashMap 相同的扰动，让高位也参与
        h ^= (h >>> 16);
        return h & mask;
    }

    /**
     * 锁住 keys 对应的全部 stripe，返回的句柄用 try-with-resources 释放
     */
    public LockHandle lock(Collection<String> keys) {
        if (keys.isEmpty()) {
            return LockHandle.EMPTY;
        }
        int[] indexes = keys.stream().mapToInt(this::stripeOf).sorted().distinct().toArray();
        return acquire(indexes);
    }

    public LockHandle lock(String key) {
        return acquire(new int[]{stripeOf(key)});
    }

    /**
     * 尝试锁住 key 所在的 stripe，不等待
     *
     * @return 锁句柄；stripe 正被其他线程持有时返回 null
     */
    public LockHandle tryLock(String key) {
        int index = stripeOf(key);
        if (!stripes[index].tryLock()) {
            return null;
        }
        return new LockHandle(this, new int[]{index});
    }

    /**
     * 锁住所有 stripe (FLUSHALL)，此时没有任何带 key 的命令在执行
     */
    public LockHandle lockAll() {
        int[] indexes = new int[stripes.length];
        Arrays.setAll(indexes, i -> i);
        return acquire(indexes);
    }

    private LockHandle acquire(int[] sortedIndexes) {
        int locked = 0;
        try {
            for (int index : sortedIndexes) {
                stripes[index].lock();
                locked++;
            }
        } catch (RuntimeException | Error e) {
            for (int i = locked - 1; i >= 0; i--) {
                stripes[sortedIndexes[i]].unlock();
            }
            throw e;
        }
        return new LockHandle(this, sortedIndexes);
    }

    void release(int[] sortedIndexes) {
        for (int i = sortedIndexes.length - 1; i >= 0; i--) {
            stripes[sortedIndexes[i]].unlock();
        }
    }

    // 测试用
    boolean isHeldByCurrentThread(String key) {
        return stripes[stripeOf(key)].isHeldByCurrentThread();
    }
}
