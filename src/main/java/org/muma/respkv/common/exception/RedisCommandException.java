package org.muma.respkv.common.exception;

/**
 * 命令级错误的基类
 * message 即返回给客户端的完整错误文本 (含 ERR / WRONGTYPE 前缀)，连接保持打开
 */
public class RedisCommandException extends RuntimeException {

    public RedisCommandException(String message) {
        super(message);
    }
}
