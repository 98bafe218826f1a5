package org.muma.respkv.command.impl.hash;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisHash;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

public class HGetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        RedisHash hash = storage.getTyped(key(args, 1), RedisDataType.HASH, RedisHash.class);
        if (hash == null) {
            return BulkString.NULL;
        }
        return new BulkString(hash.get(args.arg(2).asKey()));
    }
}
