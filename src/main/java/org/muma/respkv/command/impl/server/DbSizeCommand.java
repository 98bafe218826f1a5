package org.muma.respkv.command.impl.server;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * DBSIZE
 * 与 Redis 一样，可能包含已过期但尚未被清理的 key
 */
public class DbSizeCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return new RedisInteger(storage.size());
    }
}
