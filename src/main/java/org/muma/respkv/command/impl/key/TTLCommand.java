package org.muma.respkv.command.impl.key;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * TTL key / PTTL key
 * -2: key 不存在 (或已过期被删)；-1: 存在但没有过期时间
 */
public class TTLCommand implements RedisCommand {

    private final boolean millis;

    public TTLCommand(boolean millis) {
        this.millis = millis;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        long ttlMs = storage.ttlMillis(key(args, 1));
        if (ttlMs < 0 || millis) {
            return new RedisInteger(ttlMs);
        }
        // 秒级按四舍五入，和 Redis 保持一致
        return new RedisInteger((ttlMs + 500) / 1000);
    }
}
