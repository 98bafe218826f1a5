package org.muma.respkv.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis Hash 封装，field 以 ISO-8859-1 String 保存 (与 key 相同的约定)
 * 按插入顺序遍历，HGETALL / HKEYS / HVALS 的输出顺序稳定
 */
public class RedisHash {

    private final Map<String, byte[]> table = new LinkedHashMap<>();

    /**
     * @return 1 表示新字段，0 表示覆盖
     */
    public int put(String field, byte[] value) {
        return table.put(field, value) == null ? 1 : 0;
    }

    public byte[] get(String field) {
        return table.get(field);
    }

    public int remove(String field) {
        return table.remove(field) != null ? 1 : 0;
    }

    public boolean contains(String field) {
        return table.containsKey(field);
    }

    public int size() {
        return table.size();
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }

    public List<String> fields() {
        return new ArrayList<>(table.keySet());
    }

    public List<byte[]> values() {
        return new ArrayList<>(table.values());
    }

    // 只读视图，用于 HGETALL
    public Map<String, byte[]> toMap() {
        return Collections.unmodifiableMap(table);
    }
}
