package org.muma.respkv.command.impl.string;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * MGET key [key ...]
 * 不存在或非 String 类型的 key 返回 nil，不报错
 */
public class MGetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        RedisMessage[] result = new RedisMessage[args.size() - 1];
        for (int i = 1; i < args.size(); i++) {
            RedisData<?> data = storage.get(key(args, i));
            if (data == null || data.getType() != RedisDataType.STRING) {
                result[i - 1] = BulkString.NULL;
            } else {
                result[i - 1] = new BulkString(data.getValue(byte[].class));
            }
        }
        return new RedisArray(result);
    }
}
