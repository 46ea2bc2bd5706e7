package org.muma.dredis;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.dredis.command.CommandDispatcher;
import org.muma.dredis.config.DredisConfig;
import org.muma.dredis.protocol.RespDecoder;
import org.muma.dredis.protocol.RespEncoder;
import org.muma.dredis.server.RedisCommandHandler;
import org.muma.dredis.store.Backend;
import org.muma.dredis.store.impl.MemoryBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DredisServer {

    private static final Logger log = LoggerFactory.getLogger(DredisServer.class);

    private final DredisConfig config;

    public DredisServer(DredisConfig config) {
        this.config = config;
    }

    public void start() throws InterruptedException {
        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        // 进程内唯一的共享存储，交给每个连接
        Backend backend = new MemoryBackend();
        CommandDispatcher dispatcher = new CommandDispatcher(backend, config.getSlowLogMillis());
        RedisCommandHandler commandHandler = new RedisCommandHandler(dispatcher);

        try {
            var bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .handler(new LoggingHandler(LogLevel.INFO))
                    // 禁用 Nagle，降低小包回复的延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            // 解码器有状态 (累积缓冲区)，每个连接一个；命令处理器无状态，共享
                            ch.pipeline()
                                    .addLast(new RespDecoder())
                                    .addLast(new RespEncoder())
                                    .addLast(commandHandler);
                        }
                    });

            log.info("Starting dredis server on {}:{}", config.getHost(), config.getPort());
            ChannelFuture future = bootstrap.bind(config.getHost(), config.getPort()).sync();

            log.info("dredis started successfully.");
            future.channel().closeFuture().sync();
        } finally {
            backend.flush();
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
        }
    }

    public static void main(String[] args) throws InterruptedException {
        DredisConfig config = DredisConfig.getInstance();
        config.load(args);
        new DredisServer(config).start();
    }
}
