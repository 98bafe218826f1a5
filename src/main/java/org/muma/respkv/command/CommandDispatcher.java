package org.muma.respkv.command;

import org.muma.respkv.command.impl.hash.*;
import org.muma.respkv.command.impl.key.*;
import org.muma.respkv.command.impl.list.*;
import org.muma.respkv.command.impl.server.*;
import org.muma.respkv.command.impl.set.*;
import org.muma.respkv.command.impl.string.*;
import org.muma.respkv.common.exception.RedisCommandException;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.lock.KeyLockManager;
import org.muma.respkv.store.lock.LockHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令注册表 + 执行器
 * <p>
 * 一条命令的执行流程：查表 -> 校验参数个数 -> 按 stripe 顺序锁住涉及的 key -> 执行 -> 释放锁。
 * 锁只在单条命令执行期间持有，命令之间不持锁。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long SLOW_COMMAND_THRESHOLD_MS = 10;

    private final Map<String, CommandSpec> commandMap = new HashMap<>();
    private final StorageEngine storage;

    public CommandDispatcher(StorageEngine storage) {
        this.storage = storage;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按数据结构分类注册
     */
    private void initCommandRegistry() {
        registerServerCommands();
        registerGenericCommands();
        registerStringCommands();
        registerListCommands();
        registerHashCommands();
        registerSetCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerServerCommands() {
        register(CommandSpec.noKeys("PING", new PingCommand(), 1, 2));
        register(CommandSpec.noKeys("ECHO", new EchoCommand(), 2, 2));
        register(CommandSpec.noKeys("DBSIZE", new DbSizeCommand(), 1, 1));
        register(CommandSpec.noKeys("COMMAND", new CommandCommand(), 1, -1));
        register(CommandSpec.exclusive("FLUSHALL", new FlushAllCommand(), 1, 2));
    }

    private void registerGenericCommands() {
        register(CommandSpec.multiKey("DEL", new DelCommand(), 2, -1, 1, -1, 1));
        register(CommandSpec.multiKey("EXISTS", new ExistsCommand(), 2, -1, 1, -1, 1));
        register(CommandSpec.singleKey("EXPIRE", new ExpireCommand(false), 3, 3));
        register(CommandSpec.singleKey("PEXPIRE", new ExpireCommand(true), 3, 3));
        register(CommandSpec.singleKey("PERSIST", new PersistCommand(), 2, 2));
        register(CommandSpec.singleKey("TTL", new TTLCommand(false), 2, 2));
        register(CommandSpec.singleKey("PTTL", new TTLCommand(true), 2, 2));
        register(CommandSpec.singleKey("TYPE", new TypeCommand(), 2, 2));
        register(CommandSpec.multiKey("RENAME", new RenameCommand(), 3, 3, 1, 2, 1));
        // KEYS 走弱一致遍历，不加锁
        register(CommandSpec.noKeys("KEYS", new KeysCommand(), 2, 2));
    }

    private void registerStringCommands() {
        register(CommandSpec.singleKey("GET", new GetCommand(), 2, 2));
        register(CommandSpec.singleKey("SET", new SetCommand(), 3, -1));
        register(CommandSpec.singleKey("SETNX", new SetNxCommand(), 3, 3));
        register(CommandSpec.multiKey("MGET", new MGetCommand(), 2, -1, 1, -1, 1));
        register(CommandSpec.multiKey("MSET", new MSetCommand(), 3, -1, 1, -1, 2));
        register(CommandSpec.singleKey("INCR", new IncrByCommand(IncrByCommand.Mode.INCR), 2, 2));
        register(CommandSpec.singleKey("DECR", new IncrByCommand(IncrByCommand.Mode.DECR), 2, 2));
        register(CommandSpec.singleKey("INCRBY", new IncrByCommand(IncrByCommand.Mode.INCRBY), 3, 3));
        register(CommandSpec.singleKey("DECRBY", new IncrByCommand(IncrByCommand.Mode.DECRBY), 3, 3));
        register(CommandSpec.singleKey("APPEND", new AppendCommand(), 3, 3));
        register(CommandSpec.singleKey("STRLEN", new StrLenCommand(), 2, 2));
    }

    private void registerListCommands() {
        register(CommandSpec.singleKey("LPUSH", new PushCommand(true), 3, -1));
        register(CommandSpec.singleKey("RPUSH", new PushCommand(false), 3, -1));
        register(CommandSpec.singleKey("LPOP", new PopCommand(true), 2, 3));
        register(CommandSpec.singleKey("RPOP", new PopCommand(false), 2, 3));
        register(CommandSpec.singleKey("LRANGE", new LRangeCommand(), 4, 4));
        register(CommandSpec.singleKey("LLEN", new LLenCommand(), 2, 2));
        register(CommandSpec.singleKey("LINDEX", new LIndexCommand(), 3, 3));
    }

    private void registerHashCommands() {
        register(CommandSpec.singleKey("HSET", new HSetCommand(), 4, -1));
        register(CommandSpec.singleKey("HGET", new HGetCommand(), 3, 3));
        register(CommandSpec.singleKey("HMGET", new HMGetCommand(), 3, -1));
        register(CommandSpec.singleKey("HDEL", new HDelCommand(), 3, -1));
        register(CommandSpec.singleKey("HGETALL", new HGetAllCommand(), 2, 2));
        register(CommandSpec.singleKey("HKEYS", new HKeysCommand(), 2, 2));
        register(CommandSpec.singleKey("HVALS", new HValsCommand(), 2, 2));
        register(CommandSpec.singleKey("HLEN", new HLenCommand(), 2, 2));
        register(CommandSpec.singleKey("HEXISTS", new HExistsCommand(), 3, 3));
        register(CommandSpec.singleKey("HINCRBY", new HIncrByCommand(), 4, 4));
    }

    private void registerSetCommands() {
        register(CommandSpec.singleKey("SADD", new SAddCommand(), 3, -1));
        register(CommandSpec.singleKey("SREM", new SRemCommand(), 3, -1));
        register(CommandSpec.singleKey("SMEMBERS", new SMembersCommand(), 2, 2));
        register(CommandSpec.singleKey("SISMEMBER", new SIsMemberCommand(), 3, 3));
        register(CommandSpec.singleKey("SCARD", new SCardCommand(), 2, 2));
    }

    private void register(CommandSpec spec) {
        commandMap.put(spec.name(), spec);
    }

    public boolean isRegistered(String commandName) {
        return commandMap.containsKey(commandName.toUpperCase(Locale.ROOT));
    }

    /**
     * 核心分发逻辑
     *
     * @param args 完整请求，下标 0 是命令名
     */
    public RedisMessage dispatch(RedisArray args, RedisContext context) {
        String commandName = args.arg(0).asString();
        CommandSpec spec = commandMap.get(commandName.toUpperCase(Locale.ROOT));

        // 1. 查找命令
        if (spec == null) {
            log.debug("Command not found: {}", commandName);
            return unknownCommand(commandName, args);
        }

        // 2. 参数个数
        if (!spec.arityMatches(args.size())) {
            return new ErrorMessage("ERR wrong number of arguments for '"
                    + commandName.toLowerCase(Locale.ROOT) + "' command");
        }

        // 3. 加锁执行并监控耗时
        long startTime = System.nanoTime();
        KeyLockManager lockManager = storage.getLockManager();
        try (LockHandle ignored = spec.allKeys() ? lockManager.lockAll() : lockManager.lock(spec.extractKeys(args))) {
            RedisMessage response = spec.command().execute(storage, args, context);

            long duration = (System.nanoTime() - startTime) / 1_000_000; // ms
            if (duration > SLOW_COMMAND_THRESHOLD_MS) {
                log.warn("Slow command detected: {} cost {}ms, client {}", spec.name(), duration,
                        context == null ? null : context.remoteAddress());
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", spec.name(), duration);
            }
            return response;

        } catch (RedisCommandException e) {
            // 预期内的业务错误 (类型错误、数值错误、语法错误)
            log.debug("Command {} rejected: {}", spec.name(), e.getMessage());
            return new ErrorMessage(e.getMessage());

        } catch (IllegalArgumentException e) {
            log.warn("Command execution failed (Client Error): {} - {}", spec.name(), e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (Exception e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", spec.name(), e);
            return new ErrorMessage("ERR internal server error");
        }
    }

    private ErrorMessage unknownCommand(String commandName, RedisArray args) {
        StringBuilder sb = new StringBuilder("ERR unknown command '")
                .append(commandName)
                .append("', with args beginning with: ");
        for (int i = 1; i < args.size(); i++) {
            sb.append('\'').append(args.arg(i).asString()).append("' ");
        }
        return new ErrorMessage(sb.toString());
    }
}
