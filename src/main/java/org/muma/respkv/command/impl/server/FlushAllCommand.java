package org.muma.respkv.command.impl.server;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.exception.SyntaxException;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

import java.util.Locale;

/**
 * FLUSHALL [ASYNC|SYNC]
 * 注册为独占命令：执行时持有全部 stripe 锁，所以清空对其他命令是原子的。
 * ASYNC 与 SYNC 行为相同。
 */
public class FlushAllCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() == 2) {
            String mode = args.arg(1).asString().toUpperCase(Locale.ROOT);
            if (!mode.equals("ASYNC") && !mode.equals("SYNC")) {
                throw new SyntaxException();
            }
        }
        storage.flush();
        return SimpleString.OK;
    }
}
