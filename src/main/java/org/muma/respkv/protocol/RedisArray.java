package org.muma.respkv.protocol;

import java.util.List;

// 5. 数组 (*) - elements 为 null 表示 *-1
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray EMPTY = new RedisArray(new RedisMessage[0]);
    public static final RedisArray NULL = new RedisArray(null);

    public static RedisArray ofBytes(List<byte[]> items) {
        RedisMessage[] result = new RedisMessage[items.size()];
        for (int i = 0; i < items.size(); i++) {
            result[i] = new BulkString(items.get(i));
        }
        return new RedisArray(result);
    }

    public static RedisArray ofKeys(List<String> keys) {
        RedisMessage[] result = new RedisMessage[keys.size()];
        for (int i = 0; i < keys.size(); i++) {
            result[i] = BulkString.ofKey(keys.get(i));
        }
        return new RedisArray(result);
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    // 请求数组里的元素都是 BulkString (由 RespDecoder 保证)
    public BulkString arg(int index) {
        return (BulkString) elements[index];
    }
}
