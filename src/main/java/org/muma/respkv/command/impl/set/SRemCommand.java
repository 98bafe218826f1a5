package org.muma.respkv.command.impl.set;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisSet;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * SREM key member [member ...]
 * 集合被删空后删除 key
 */
public class SRemCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = key(args, 1);
        RedisSet set = storage.getTyped(key, RedisDataType.SET, RedisSet.class);
        if (set == null) {
            return RedisInteger.ZERO;
        }

        int removed = 0;
        for (int i = 2; i < args.size(); i++) {
            removed += set.remove(args.arg(i).content());
        }
        if (set.isEmpty()) {
            storage.remove(key);
        }
        return new RedisInteger(removed);
    }
}
