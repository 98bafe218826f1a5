package org.muma.respkv.common.exception;

// 用于必须区分 "不存在" 与 "空值" 的命令，如 RENAME
public class NoSuchKeyException extends RedisCommandException {

    public NoSuchKeyException() {
        super("ERR no such key");
    }
}
