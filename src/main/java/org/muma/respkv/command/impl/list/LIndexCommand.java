package org.muma.respkv.command.impl.list;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisList;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * LINDEX key index
 * 支持负数下标，越界返回 nil
 */
public class LIndexCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        long index = longArg(args, 2);
        RedisList list = storage.getTyped(key(args, 1), RedisDataType.LIST, RedisList.class);
        if (list == null) {
            return BulkString.NULL;
        }
        return new BulkString(list.index(index));
    }
}
