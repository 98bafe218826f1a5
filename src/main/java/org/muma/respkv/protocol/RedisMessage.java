package org.muma.respkv.protocol;

/**
 * RESP2 消息的统一抽象
 * 请求 (数组) 与回复 (五种类型) 都用它表示
 */
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {
}
