package org.muma.respkv.common;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Redis List 封装
 * 底层用 ArrayDeque：两端 push/pop 为 O(1)，按下标访问为 O(N)。
 * <p>
 * 非线程安全，调用方必须持有该 key 的锁。
 */
public class RedisList {

    private final ArrayDeque<byte[]> deque = new ArrayDeque<>();

    /**
     * 头部插入 (LPUSH)
     */
    public void lpush(byte[] element) {
        deque.addFirst(element);
    }

    /**
     * 尾部插入 (RPUSH)
     */
    public void rpush(byte[] element) {
        deque.addLast(element);
    }

    // 空列表返回 null
    public byte[] lpop() {
        return deque.pollFirst();
    }

    public byte[] rpop() {
        return deque.pollLast();
    }

    public int size() {
        return deque.size();
    }

    public boolean isEmpty() {
        return deque.isEmpty();
    }

    /**
     * 范围查询 (LRANGE)，start/stop 均为闭区间，支持负数下标
     */
    public List<byte[]> range(long start, long stop) {
        int size = deque.size();
        if (start < 0) start = size + start;
        if (stop < 0) stop = size + stop;
        if (start < 0) start = 0;
        if (start > stop || start >= size) {
            return Collections.emptyList();
        }
        if (stop >= size) stop = size - 1;

        List<byte[]> result = new ArrayList<>((int) (stop - start + 1));
        Iterator<byte[]> it = deque.iterator();
        for (long i = 0; i <= stop && it.hasNext(); i++) {
            byte[] item = it.next();
            if (i >= start) result.add(item);
        }
        return result;
    }

    /**
     * 按下标取元素 (LINDEX)，越界返回 null
     */
    public byte[] index(long index) {
        int size = deque.size();
        if (index < 0) index = size + index;
        if (index < 0 || index >= size) return null;

        // 靠近尾部时从后往前找
        if (index > size / 2) {
            Iterator<byte[]> it = deque.descendingIterator();
            long steps = size - 1 - index;
            for (long i = 0; i < steps; i++) it.next();
            return it.next();
        }
        Iterator<byte[]> it = deque.iterator();
        for (long i = 0; i < index; i++) it.next();
        return it.next();
    }
}
