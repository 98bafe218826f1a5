package org.muma.respkv.command.impl.string;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.exception.WrongTypeException;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * APPEND key value
 * 返回追加后的长度；key 不存在时等价于 SET
 */
public class AppendCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = key(args, 1);
        byte[] suffix = args.arg(2).content();

        RedisData<?> data = storage.get(key);
        if (data == null) {
            storage.put(key, new RedisData<>(RedisDataType.STRING, suffix));
            return new RedisInteger(suffix.length);
        }
        if (data.getType() != RedisDataType.STRING) {
            throw new WrongTypeException();
        }

        byte[] current = data.getValue(byte[].class);
        byte[] merged = new byte[current.length + suffix.length];
        System.arraycopy(current, 0, merged, 0, current.length);
        System.arraycopy(suffix, 0, merged, current.length, suffix.length);

        @SuppressWarnings("unchecked")
        RedisData<byte[]> stringData = (RedisData<byte[]>) data;
        stringData.setData(merged);
        return new RedisInteger(merged.length);
    }
}
