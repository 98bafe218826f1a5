package org.muma.respkv.command.impl.hash;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisHash;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * HDEL key field [field ...]
 * 最后一个字段被删除后，key 也随之删除
 */
public class HDelCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = key(args, 1);
        RedisHash hash = storage.getTyped(key, RedisDataType.HASH, RedisHash.class);
        if (hash == null) {
            return RedisInteger.ZERO;
        }

        int deleted = 0;
        for (int i = 2; i < args.size(); i++) {
            deleted += hash.remove(args.arg(i).asKey());
        }
        if (hash.isEmpty()) {
            storage.remove(key);
        }
        return new RedisInteger(deleted);
    }
}
