package org.muma.respkv.command.impl.hash;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisHash;
import org.muma.respkv.common.exception.NotIntegerException;
import org.muma.respkv.common.exception.OverflowException;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

import java.nio.charset.StandardCharsets;

/**
 * HINCRBY key field increment
 * 字段不存在时从 0 开始；所有校验在写入前完成
 */
public class HIncrByCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = key(args, 1);
        String field = args.arg(2).asKey();
        long increment = longArg(args, 3);

        RedisHash existing = storage.getTyped(key, RedisDataType.HASH, RedisHash.class);
        long current = 0;
        if (existing != null) {
            byte[] old = existing.get(field);
            if (old != null) {
                try {
                    current = RedisCommand.parseLong(old);
                } catch (NotIntegerException e) {
                    throw new NotIntegerException("ERR hash value is not an integer");
                }
            }
        }

        long result;
        try {
            result = Math.addExact(current, increment);
        } catch (ArithmeticException e) {
            throw new OverflowException();
        }

        RedisHash hash = existing != null ? existing
                : storage.getOrCreate(key, RedisDataType.HASH, RedisHash.class, RedisHash::new);
        hash.put(field, Long.toString(result).getBytes(StandardCharsets.US_ASCII));
        return new RedisInteger(result);
    }
}
