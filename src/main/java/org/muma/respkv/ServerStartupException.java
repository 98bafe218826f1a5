package org.muma.respkv;

/**
 * 启动阶段的资源错误 (绑定/监听失败)，对进程是致命的
 */
public class ServerStartupException extends RuntimeException {

    public ServerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
