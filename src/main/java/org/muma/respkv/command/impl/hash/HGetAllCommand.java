package org.muma.respkv.command.impl.hash;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisHash;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

import java.util.Map;

/**
 * HGETALL key
 * 返回 field1, value1, field2, value2 ... 的扁平数组
 */
public class HGetAllCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        RedisHash hash = storage.getTyped(key(args, 1), RedisDataType.HASH, RedisHash.class);
        if (hash == null) {
            return RedisArray.EMPTY;
        }

        RedisMessage[] result = new RedisMessage[hash.size() * 2];
        int i = 0;
        for (Map.Entry<String, byte[]> entry : hash.toMap().entrySet()) {
            result[i++] = BulkString.ofKey(entry.getKey());
            result[i++] = new BulkString(entry.getValue());
        }
        return new RedisArray(result);
    }
}
