package org.muma.respkv.common;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * 存储单元 (Entry)：类型标签 + 数据载体 + 过期时间
 * <p>
 * type 在构造后不可变；要换类型只能整体替换 Entry。
 * 相等性保持对象同一性，惰性删除依赖 {@code Map.remove(key, value)} 只删掉自己看到的那个 Entry。
 */
@Getter
@ToString
public class RedisData<T> {

    // 过期时间 (-1 表示不过期)
    public static final long NO_EXPIRE = -1;

    private final RedisDataType type;

    // String 是 byte[], List 是 RedisList, Hash 是 RedisHash, Set 是 RedisSet
    @Setter
    private T data;

    // 清理线程会无锁读取
    @Setter
    private volatile long expireAt = NO_EXPIRE;

    public RedisData(RedisDataType type, T data) {
        this.type = type;
        this.data = data;
    }

    public boolean isExpired() {
        return isExpired(System.currentTimeMillis());
    }

    public boolean isExpired(long now) {
        long at = expireAt;
        return at != NO_EXPIRE && now >= at;
    }

    public boolean hasExpire() {
        return expireAt != NO_EXPIRE;
    }

    // 避免外部强制转换时的 Unchecked warning，同时做类型检查
    public <V> V getValue(Class<V> clazz) {
        if (clazz.isInstance(data)) {
            return clazz.cast(data);
        }
        throw new IllegalStateException("Data type mismatch. Expected " + clazz.getSimpleName()
                + " but found " + (data == null ? "null" : data.getClass().getSimpleName()));
    }
}
