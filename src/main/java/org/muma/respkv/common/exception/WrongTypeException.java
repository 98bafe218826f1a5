package org.muma.respkv.common.exception;

public class WrongTypeException extends RedisCommandException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public WrongTypeException() {
        super(MESSAGE);
    }
}
