package org.muma.respkv.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.ProtocolException;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单个客户端连接的处理器 (每个连接一个实例)
 * <p>
 * 同一连接的命令总是在它所属的 EventLoop 线程上顺序执行，所以 Pipelining 的回复顺序与请求顺序一致。
 * 回复先 write 进出站缓冲区，等本批读取结束 (channelReadComplete) 再统一 flush。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisArray> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 当前连接数 (所有连接共享)
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;
    private RedisContext context;
    // 收到 QUIT 后置位，同一批里后面的命令全部丢弃
    private boolean closing;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        context = new RedisContext(ctx);
        int total = connectedClients.incrementAndGet();
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.decrementAndGet();
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisArray command) {
        if (closing) {
            return;
        }
        if (context == null) {
            context = new RedisContext(ctx);
        }

        // QUIT 需要操作连接本身，不经过 Dispatcher
        if ("QUIT".equalsIgnoreCase(command.arg(0).asString())) {
            closing = true;
            ctx.channel().config().setAutoRead(false);
            ctx.writeAndFlush(SimpleString.OK).addListener(ChannelFutureListener.CLOSE);
            return;
        }

        RedisMessage response = dispatcher.dispatch(command, context);
        ctx.write(response);
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) {
        ctx.flush();
    }

    /**
     * 出站缓冲区积压时暂停读取，避免慢客户端撑爆内存
     */
    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (!closing) {
            ctx.channel().config().setAutoRead(ctx.channel().isWritable());
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;

        if (root instanceof ProtocolException) {
            // 协议错误：先把已有回复和错误一起发出去，再关闭连接
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), root.getMessage());
            ctx.writeAndFlush(new ErrorMessage(root.getMessage())).addListener(ChannelFutureListener.CLOSE);
        } else if (root instanceof IOException) {
            // 客户端断开 (Connection reset by peer 等)
            log.debug("I/O error on {}: {}", ctx.channel().remoteAddress(), root.getMessage());
            ctx.close();
        } else {
            log.error("Unexpected error on {}", ctx.channel().remoteAddress(), root);
            ctx.close();
        }
    }
}
