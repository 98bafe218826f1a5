package org.muma.respkv.command.impl.key;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * KEYS pattern
 * 【时间复杂度】 O(N)，N 为库中 key 的总数
 */
public class KeysCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return RedisArray.ofKeys(storage.keys(key(args, 1)));
    }
}
