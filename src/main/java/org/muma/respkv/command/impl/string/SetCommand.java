package org.muma.respkv.command.impl.string;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.exception.RedisCommandException;
import org.muma.respkv.common.exception.SyntaxException;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

import java.util.Locale;

/**
 * SET key value [ttl]
 * SET key value [EX seconds | PX milliseconds | KEEPTTL] [NX | XX]
 * <p>
 * 第一种写法里 ttl 是裸整数 (秒)；第二种是 Redis 的标准选项。
 * 覆盖任意类型的旧值；不带过期选项时清除旧的 TTL。
 */
public class SetCommand implements RedisCommand {

    private static final String INVALID_EXPIRE = "ERR invalid expire time in 'set' command";

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = key(args, 1);
        byte[] value = args.arg(2).content();

        // --- 1. 参数解析阶段 ---
        boolean nx = false;
        boolean xx = false;
        boolean keepTtl = false;
        long ttlMs = -1;

        if (args.size() == 4 && isInteger(args.arg(3))) {
            ttlMs = toMillis(longArg(args, 3), 1000);
        } else {
            for (int i = 3; i < args.size(); i++) {
                String opt = args.arg(i).asString().toUpperCase(Locale.ROOT);
                switch (opt) {
                    case "NX" -> {
                        if (xx) throw new SyntaxException();
                        nx = true;
                    }
                    case "XX" -> {
                        if (nx) throw new SyntaxException();
                        xx = true;
                    }
                    case "KEEPTTL" -> {
                        if (ttlMs != -1) throw new SyntaxException();
                        keepTtl = true;
                    }
                    case "EX", "PX" -> {
                        if (ttlMs != -1 || keepTtl || i + 1 >= args.size()) throw new SyntaxException();
                        ttlMs = toMillis(longArg(args, ++i), opt.equals("EX") ? 1000 : 1);
                    }
                    default -> throw new SyntaxException();
                }
            }
        }

        // --- 2. 条件检查 (NX/XX)，key 锁由 Dispatcher 持有 ---
        RedisData<?> existing = storage.get(key);
        if (nx && existing != null) {
            return BulkString.NULL;
        }
        if (xx && existing == null) {
            return BulkString.NULL;
        }

        // --- 3. 写入阶段 ---
        RedisData<byte[]> newData = new RedisData<>(RedisDataType.STRING, value);
        if (ttlMs > 0) {
            newData.setExpireAt(System.currentTimeMillis() + ttlMs);
        } else if (keepTtl && existing != null) {
            newData.setExpireAt(existing.getExpireAt());
        }
        storage.put(key, newData);

        return SimpleString.OK;
    }

    private long toMillis(long amount, long unit) {
        if (amount <= 0) {
            throw new RedisCommandException(INVALID_EXPIRE);
        }
        try {
            long ms = Math.multiplyExact(amount, unit);
            // 确保 now + ms 不溢出
            Math.addExact(System.currentTimeMillis(), ms);
            return ms;
        } catch (ArithmeticException e) {
            throw new RedisCommandException(INVALID_EXPIRE);
        }
    }

    private boolean isInteger(BulkString arg) {
        byte[] bytes = arg.content();
        if (bytes.length == 0) return false;
        for (int i = 0; i < bytes.length; i++) {
            byte b = bytes[i];
            if (!(b >= '0' && b <= '9') && !(i == 0 && b == '-' && bytes.length > 1)) {
                return false;
            }
        }
        return true;
    }
}
