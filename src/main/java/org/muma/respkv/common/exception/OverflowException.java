package org.muma.respkv.common.exception;

public class OverflowException extends RedisCommandException {

    public OverflowException() {
        super("ERR increment or decrement would overflow");
    }
}
