package org.muma.respkv.common.exception;

public class NotIntegerException extends RedisCommandException {

    public static final String MESSAGE = "ERR value is not an integer or out of range";

    public NotIntegerException() {
        super(MESSAGE);
    }

    public NotIntegerException(String message) {
        super(message);
    }
}
