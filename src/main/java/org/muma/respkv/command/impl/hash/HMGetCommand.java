package org.muma.respkv.command.impl.hash;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisHash;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * HMGET key field [field ...]
 * 不存在的字段对应 nil
 */
public class HMGetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        RedisHash hash = storage.getTyped(key(args, 1), RedisDataType.HASH, RedisHash.class);

        RedisMessage[] result = new RedisMessage[args.size() - 2];
        for (int i = 2; i < args.size(); i++) {
            byte[] value = hash == null ? null : hash.get(args.arg(i).asKey());
            result[i - 2] = new BulkString(value);
        }
        return new RedisArray(result);
    }
}
