package org.muma.respkv.command.impl.string;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * MSET key value [key value ...]
 * 所有 key 在执行前一起加锁，其他命令看不到 "写了一半" 的状态
 */
public class MSetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() % 2 == 0) {
            return errorArgs("mset");
        }
        for (int i = 1; i < args.size(); i += 2) {
            storage.put(key(args, i), new RedisData<>(RedisDataType.STRING, args.arg(i + 1).content()));
        }
        return SimpleString.OK;
    }
}
