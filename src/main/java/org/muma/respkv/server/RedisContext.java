package org.muma.respkv.server;

import io.netty.channel.ChannelHandlerContext;

import java.net.SocketAddress;

/**
 * 命令执行上下文
 * 封装了与当前连接相关的环境信息；单元测试里直接调用命令时可以为 null 连接
 */
public class RedisContext {

    private final ChannelHandlerContext nettyCtx;

    public RedisContext(ChannelHandlerContext nettyCtx) {
        this.nettyCtx = nettyCtx;
    }

    public SocketAddress remoteAddress() {
        return nettyCtx == null ? null : nettyCtx.channel().remoteAddress();
    }
}
