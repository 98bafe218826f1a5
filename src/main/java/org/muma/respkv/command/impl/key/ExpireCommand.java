package org.muma.respkv.command.impl.key;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.exception.RedisCommandException;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * EXPIRE key seconds / PEXPIRE key milliseconds
 * <p>
 * ttl <= 0 时直接删除 key (返回 1)，与 Redis 一致。
 */
public class ExpireCommand implements RedisCommand {

    private final boolean millis;

    public ExpireCommand(boolean millis) {
        this.millis = millis;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = key(args, 1);
        long ttl = longArg(args, 2);

        if (ttl <= 0) {
            return storage.remove(key) ? RedisInteger.ONE : RedisInteger.ZERO;
        }

        long ttlMs;
        try {
            ttlMs = millis ? ttl : Math.multiplyExact(ttl, 1000L);
            long expireAt = Math.addExact(System.currentTimeMillis(), ttlMs);
            return storage.expire(key, expireAt) ? RedisInteger.ONE : RedisInteger.ZERO;
        } catch (ArithmeticException e) {
            throw new RedisCommandException("ERR invalid expire time in '" + (millis ? "pexpire" : "expire") + "' command");
        }
    }
}
