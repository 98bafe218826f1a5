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
 * HSET key field value [field value ...]
 * 返回新增字段的个数 (覆盖已有字段不计数)
 */
public class HSetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        // 必须是 Key + 成对的 FV，总长度减去命令名和 Key 后必须是偶数
        if ((args.size() - 2) % 2 != 0) {
            return errorArgs("hset");
        }

        RedisHash hash = storage.getOrCreate(key(args, 1), RedisDataType.HASH, RedisHash.class, RedisHash::new);

        int createdCount = 0;
        for (int i = 2; i < args.size(); i += 2) {
            createdCount += hash.put(args.arg(i).asKey(), args.arg(i + 1).content());
        }
        return new RedisInteger(createdCount);
    }
}
