package org.muma.respkv.command.impl.string;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.exception.OverflowException;
import org.muma.respkv.common.exception.WrongTypeException;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

import java.nio.charset.StandardCharsets;

/**
 * INCR / DECR / INCRBY / DECRBY
 * <p>
 * 旧值按有符号 64 位十进制整数解析；溢出时报错而不是回绕。
 * 保留原有的过期时间。
 */
public class IncrByCommand implements RedisCommand {

    public enum Mode {
        INCR, DECR, INCRBY, DECRBY
    }

    private final Mode mode;

    public IncrByCommand(Mode mode) {
        this.mode = mode;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = key(args, 1);
        long increment = switch (mode) {
            case INCR -> 1;
            case DECR -> -1;
            case INCRBY -> longArg(args, 2);
            case DECRBY -> negate(longArg(args, 2));
        };

        RedisData<?> data = storage.get(key);
        long current = 0;
        if (data != null) {
            if (data.getType() != RedisDataType.STRING) {
                throw new WrongTypeException();
            }
            current = RedisCommand.parseLong(data.getValue(byte[].class));
        }

        long result;
        try {
            result = Math.addExact(current, increment);
        } catch (ArithmeticException e) {
            throw new OverflowException();
        }

        byte[] bytes = Long.toString(result).getBytes(StandardCharsets.US_ASCII);
        if (data == null) {
            storage.put(key, new RedisData<>(RedisDataType.STRING, bytes));
        } else {
            // 原地替换，TTL 不变
            @SuppressWarnings("unchecked")
            RedisData<byte[]> stringData = (RedisData<byte[]>) data;
            stringData.setData(bytes);
        }
        return new RedisInteger(result);
    }

    private long negate(long value) {
        if (value == Long.MIN_VALUE) {
            throw new OverflowException();
        }
        return -value;
    }
}
