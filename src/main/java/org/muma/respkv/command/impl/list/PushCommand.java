package org.muma.respkv.command.impl.list;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisList;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * LPUSH / RPUSH key element [element ...]
 * <p>
 * 【时间复杂度】 O(K)，K 是推入元素的数量
 * LPUSH 多元素时相当于依次 LPUSH：LPUSH mylist a b c -> c, b, a
 */
public class PushCommand implements RedisCommand {

    private final boolean left;

    public PushCommand(boolean left) {
        this.left = left;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        // 类型不匹配时在这里抛出，还没有任何修改
        RedisList list = storage.getOrCreate(key(args, 1), RedisDataType.LIST, RedisList.class, RedisList::new);

        for (int i = 2; i < args.size(); i++) {
            byte[] element = args.arg(i).content();
            if (left) {
                list.lpush(element);
            } else {
                list.rpush(element);
            }
        }
        return new RedisInteger(list.size());
    }
}
