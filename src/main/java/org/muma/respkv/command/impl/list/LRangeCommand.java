package org.muma.respkv.command.impl.list;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisList;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * LRANGE key start stop
 * <p>
 * 【时间复杂度】 O(S+N)
 * S 是 start 偏移量，N 是指定区间内的元素数量。
 */
public class LRangeCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        long start = longArg(args, 2);
        long stop = longArg(args, 3);

        RedisList list = storage.getTyped(key(args, 1), RedisDataType.LIST, RedisList.class);
        if (list == null) {
            return RedisArray.EMPTY;
        }
        return RedisArray.ofBytes(list.range(start, stop));
    }
}
