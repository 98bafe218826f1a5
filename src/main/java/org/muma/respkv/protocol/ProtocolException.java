package org.muma.respkv.protocol;

/**
 * 协议格式错误，对当前连接是致命的：回一条错误后关闭连接
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super("ERR Protocol error: " + message);
    }
}
