package org.muma.respkv.command.impl.list;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisList;
import org.muma.respkv.common.exception.NotIntegerException;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * LPOP / RPOP key [count]
 * <p>
 * 不带 count：返回单个元素或 nil
 * 带 count：返回数组；key 不存在返回 nil 数组
 * 列表被弹空后删除 key
 */
public class PopCommand implements RedisCommand {

    private final boolean left;

    public PopCommand(boolean left) {
        this.left = left;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = key(args, 1);
        boolean withCount = args.size() == 3;
        long count = 1;
        if (withCount) {
            count = longArg(args, 2);
            if (count < 0) {
                throw new NotIntegerException("ERR value is out of range, must be positive");
            }
        }

        RedisList list = storage.getTyped(key, RedisDataType.LIST, RedisList.class);
        if (list == null) {
            return withCount ? RedisArray.NULL : BulkString.NULL;
        }

        if (!withCount) {
            byte[] element = pop(list);
            removeIfEmpty(storage, key, list);
            return new BulkString(element);
        }

        int n = (int) Math.min(count, list.size());
        RedisMessage[] result = new RedisMessage[n];
        for (int i = 0; i < n; i++) {
            result[i] = new BulkString(pop(list));
        }
        removeIfEmpty(storage, key, list);
        return new RedisArray(result);
    }

    private byte[] pop(RedisList list) {
        return left ? list.lpop() : list.rpop();
    }

    private void removeIfEmpty(StorageEngine storage, String key, RedisList list) {
        if (list.isEmpty()) {
            storage.remove(key);
        }
    }
}
