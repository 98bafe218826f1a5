package org.muma.respkv.command.impl.key;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * DEL key [key ...]
 */
public class DelCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        int deletedCount = 0;
        for (int i = 1; i < args.size(); i++) {
            if (storage.remove(key(args, i))) {
                deletedCount++;
            }
        }
        return new RedisInteger(deletedCount);
    }
}
