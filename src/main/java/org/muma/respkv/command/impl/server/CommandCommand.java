package org.muma.respkv.command.impl.server;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * COMMAND [subcommand ...]
 * redis-cli 连接时会发送 COMMAND DOCS，返回空数组即可让它正常工作
 */
public class CommandCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return RedisArray.EMPTY;
    }
}
