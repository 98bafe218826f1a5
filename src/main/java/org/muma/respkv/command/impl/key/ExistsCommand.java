package org.muma.respkv.command.impl.key;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * EXISTS key [key ...]
 * 重复的 key 会被重复计数 (与 Redis 一致)
 */
public class ExistsCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        int count = 0;
        for (int i = 1; i < args.size(); i++) {
            if (storage.exists(key(args, i))) {
                count++;
            }
        }
        return new RedisInteger(count);
    }
}
