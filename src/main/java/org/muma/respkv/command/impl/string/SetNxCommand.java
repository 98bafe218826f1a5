package org.muma.respkv.command.impl.string;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * SETNX key value
 * 返回 1 表示写入，0 表示 key 已存在
 */
public class SetNxCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = key(args, 1);
        if (storage.exists(key)) {
            return RedisInteger.ZERO;
        }
        storage.put(key, new RedisData<>(RedisDataType.STRING, args.arg(2).content()));
        return RedisInteger.ONE;
    }
}
