package org.muma.respkv.command.impl.key;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * PERSIST key
 * 返回 1 表示移除了过期时间；key 不存在或本来就没有过期时间返回 0
 */
public class PersistCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return storage.persist(key(args, 1)) ? RedisInteger.ONE : RedisInteger.ZERO;
    }
}
