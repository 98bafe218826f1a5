package org.muma.respkv.command;

import org.muma.respkv.protocol.RedisArray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 命令注册信息：实现 + 参数个数 + key 位置
 *
 * @param minArgs  最少参数个数 (含命令名)
 * @param maxArgs  最多参数个数 (含命令名)，-1 表示不限
 * @param firstKey 第一个 key 的下标，0 表示命令不涉及 key
 * @param lastKey  最后一个 key 的下标，负数表示从末尾倒数 (-1 即最后一个参数)
 * @param step     key 之间的间隔 (MSET 为 2)
 * @param allKeys  需要独占整个库 (FLUSHALL)
 */
public record CommandSpec(String name, RedisCommand command,
                          int minArgs, int maxArgs,
                          int firstKey, int lastKey, int step,
                          boolean allKeys) {

    public static CommandSpec noKeys(String name, RedisCommand command, int minArgs, int maxArgs) {
        return new CommandSpec(name, command, minArgs, maxArgs, 0, 0, 0, false);
    }

    public static CommandSpec singleKey(String name, RedisCommand command, int minArgs, int maxArgs) {
        return new CommandSpec(name, command, minArgs, maxArgs, 1, 1, 1, false);
    }

    public static CommandSpec multiKey(String name, RedisCommand command, int minArgs, int maxArgs,
                                       int firstKey, int lastKey, int step) {
        return new CommandSpec(name, command, minArgs, maxArgs, firstKey, lastKey, step, false);
    }

    public static CommandSpec exclusive(String name, RedisCommand command, int minArgs, int maxArgs) {
        return new CommandSpec(name, command, minArgs, maxArgs, 0, 0, 0, true);
    }

    public boolean arityMatches(int argc) {
        return argc >= minArgs && (maxArgs < 0 || argc <= maxArgs);
    }

    /**
     * 从请求中取出本命令会访问的 key
     */
    public List<String> extractKeys(RedisArray args) {
        if (firstKey <= 0) return Collections.emptyList();
        int argc = args.size();
        int last = lastKey < 0 ? argc + lastKey : lastKey;
        List<String> keys = new ArrayList<>();
        for (int i = firstKey; i <= last && i < argc; i += step) {
            keys.add(args.arg(i).asKey());
        }
        return keys;
    }
}
