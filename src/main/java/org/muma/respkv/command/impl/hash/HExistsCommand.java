package org.muma.respkv.command.impl.hash;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisHash;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

public class HExistsCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        RedisHash hash = storage.getTyped(key(args, 1), RedisDataType.HASH, RedisHash.class);
        boolean exists = hash != null && hash.contains(args.arg(2).asKey());
        return exists ? RedisInteger.ONE : RedisInteger.ZERO;
    }
}
