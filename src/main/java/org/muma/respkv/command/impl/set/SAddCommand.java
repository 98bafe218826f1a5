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
 * SADD key member [member ...]
 * 返回实际新增的成员个数
 */
public class SAddCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        RedisSet set = storage.getOrCreate(key(args, 1), RedisDataType.SET, RedisSet.class, RedisSet::new);

        int addedCount = 0;
        for (int i = 2; i < args.size(); i++) {
            addedCount += set.add(args.arg(i).content());
        }
        return new RedisInteger(addedCount);
    }
}
