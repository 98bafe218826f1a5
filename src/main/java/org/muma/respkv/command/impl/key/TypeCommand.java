package org.muma.respkv.command.impl.key;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

public class TypeCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        RedisDataType type = storage.typeOf(key(args, 1));
        return new SimpleString(type == null ? "none" : type.typeName());
    }
}
