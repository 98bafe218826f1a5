package org.muma.respkv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import lombok.Getter;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.config.ServerConfig;
import org.muma.respkv.protocol.RespDecoder;
import org.muma.respkv.protocol.RespEncoder;
import org.muma.respkv.server.RedisCommandHandler;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 服务器入口 (Listener / Acceptor)
 * <p>
 * Boss 线程负责 accept，Worker 线程组负责所有连接的读写与命令执行。
 * 所有连接共享同一个 StorageEngine，由构造时显式创建并注入，没有全局单例。
 */
public class RespKvServer {

    private static final Logger log = LoggerFactory.getLogger(RespKvServer.class);

    // 优雅关闭：静默期 / 最长等待
    private static final long SHUTDOWN_QUIET_PERIOD_MS = 100;
    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    private final ServerConfig config;
    @Getter
    private final StorageEngine storage;
    @Getter
    private final CommandDispatcher dispatcher;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RespKvServer(ServerConfig config) {
        this.config = config;
        this.storage = new MemoryStorageEngine(config.getSweepIntervalMs(), config.getLockStripes());
        this.dispatcher = new CommandDispatcher(storage);
    }

    /**
     * 绑定端口并开始 accept，返回时已经可以接受连接
     *
     * @throws ServerStartupException 绑定或监听失败
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Server already started");
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());
        RespEncoder encoder = new RespEncoder();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // 在 Boss 线程上打印 accept 细节
                .handler(new LoggingHandler(LogLevel.DEBUG))
                .option(ChannelOption.SO_BACKLOG, config.getBacklog())
                .option(ChannelOption.SO_REUSEADDR, true)
                // 禁用 Nagle 算法，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(encoder)
                                .addLast(new RedisCommandHandler(dispatcher));
                    }
                });

        log.info("Starting RESP KV server on {}:{}", config.getBindAddress(), config.getPort());
        try {
            serverChannel = bootstrap.bind(config.getBindAddress(), config.getPort()).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseResources();
            throw new ServerStartupException("Interrupted while binding port " + config.getPort(), e);
        } catch (Exception e) {
            releaseResources();
            throw new ServerStartupException("Failed to bind " + config.getBindAddress() + ":" + config.getPort(), e);
        }
        log.info("RESP KV server started, listening on {}", serverChannel.localAddress());
    }

    public int getBoundPort() {
        if (serverChannel == null) {
            throw new IllegalStateException("Server not started");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /**
     * 阻塞直到监听 Channel 关闭
     */
    public void awaitClose() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    /**
     * 优雅关闭：
     * 1. 关闭监听 Channel，不再接受新连接
     * 2. Worker 组优雅退出，正在执行的命令会跑完
     * 3. 释放 Boss 组与存储的后台线程
     * 可重复调用。
     */
    public void shutdown() {
        if (!started.get() || !stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down RESP KV server...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        releaseResources();
        log.info("RESP KV server shutdown complete");
    }

    private void releaseResources() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(SHUTDOWN_QUIET_PERIOD_MS, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                    .syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
        storage.shutdown();
    }

    public static void main(String[] args) throws InterruptedException {
        ServerConfig config = ServerConfig.load(args, System.getenv());
        RespKvServer server = new RespKvServer(config);
        try {
            server.start();
        } catch (ServerStartupException e) {
            log.error("Failed to start server", e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown, "kv-shutdown-hook"));
        server.awaitClose();
    }
}
