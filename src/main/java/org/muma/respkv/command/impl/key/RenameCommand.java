package org.muma.respkv.command.impl.key;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.exception.NoSuchKeyException;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * RENAME key newkey
 * 两个 key 都已被 Dispatcher 锁住；值和 TTL 一起搬走
 */
public class RenameCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String source = key(args, 1);
        String target = key(args, 2);

        RedisData<?> data = storage.get(source);
        if (data == null) {
            throw new NoSuchKeyException();
        }
        if (source.equals(target)) {
            return SimpleString.OK;
        }

        storage.remove(source);
        storage.put(target, data);
        return SimpleString.OK;
    }
}
