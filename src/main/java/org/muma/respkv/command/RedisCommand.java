package org.muma.respkv.command;

import org.muma.respkv.common.exception.NotIntegerException;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.utils.NumberUtils;

public interface RedisCommand {

    /**
     * 执行命令
     * <p>
     * 调用前 CommandDispatcher 已经校验过参数个数，并持有本命令涉及的全部 key 锁。
     * 业务错误抛 {@link org.muma.respkv.common.exception.RedisCommandException}，由 Dispatcher 转为错误回复。
     *
     * @param args 完整请求数组，下标 0 是命令名
     */
    RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context);

    /**
     * 辅助工具：第 index 个参数作为 key (ISO-8859-1)
     */
    default String key(RedisArray args, int index) {
        return args.arg(index).asKey();
    }

    /**
     * 辅助工具：第 index 个参数解析为 long，失败抛 NotIntegerException
     */
    default long longArg(RedisArray args, int index) {
        return parseLong(args.arg(index).content());
    }

    /**
     * 辅助工具：参数个数需要额外校验的命令 (如成对出现的 field value) 使用
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    static long parseLong(byte[] bytes) {
        try {
            return NumberUtils.parseLong(bytes);
        } catch (NumberFormatException e) {
            throw new NotIntegerException();
        }
    }
}
