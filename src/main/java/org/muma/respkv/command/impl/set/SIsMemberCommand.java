package org.muma.respkv.command.impl.set;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisSet;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

public class SIsMemberCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        RedisSet set = storage.getTyped(key(args, 1), RedisDataType.SET, RedisSet.class);
        boolean member = set != null && set.contains(args.arg(2).content());
        return member ? RedisInteger.ONE : RedisInteger.ZERO;
    }
}
