package org.muma.respkv.common.exception;

public class SyntaxException extends RedisCommandException {

    public SyntaxException() {
        super("ERR syntax error");
    }

    public SyntaxException(String message) {
        super(message);
    }
}
