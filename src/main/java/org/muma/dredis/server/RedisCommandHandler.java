package org.muma.dredis.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.dredis.command.CommandDispatcher;
import org.muma.dredis.protocol.RespDecodeException;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.protocol.SimpleError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 连接处理器
 * <p>
 * 每个连接固定在一个 EventLoop 线程上，请求按到达顺序执行、按顺序回复；
 * 不同连接之间并行，共享的只有 Backend。
 * 协议错误后字节流无法重新同步，回复错误并关闭连接。
 */
@ChannelHandler.Sharable
public class RedisCommandHandler extends SimpleChannelInboundHandler<RespFrame> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
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
    protected void channelRead0(ChannelHandlerContext ctx, RespFrame msg) {
        if (log.isDebugEnabled()) {
            log.debug("Received from {}: {}", ctx.channel().remoteAddress(), msg);
        }
        ctx.writeAndFlush(dispatcher.dispatch(msg));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof RespDecodeException e) {
            log.warn("Protocol error from {} ({}): {}, closing connection",
                    ctx.channel().remoteAddress(), e.error(), e.getMessage());
            String message = ("ERR Protocol error: " + e.getMessage()).replace('\r', ' ').replace('\n', ' ');
            ctx.writeAndFlush(new SimpleError(message))
                    .addListener(ChannelFutureListener.CLOSE);
            return;
        }
        log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }

    public int getConnectedClients() {
        return connectedClients.get();
    }
}
