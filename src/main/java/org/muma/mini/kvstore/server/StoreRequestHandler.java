package org.muma.mini.kvstore.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.muma.mini.kvstore.protocol.RespMessage;
import org.muma.mini.kvstore.protocol.StoreMessageCodec;
import org.muma.mini.kvstore.protocol.StoreRequest;
import org.muma.mini.kvstore.protocol.StoreResponse;
import org.muma.mini.kvstore.store.StoreService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个连接一个实例. Netty IO 线程只负责解码, 业务逻辑全部提交到 StoreCoreExecutor,
 * 同一连接上的请求按到达顺序处理和响应.
 */
public class StoreRequestHandler extends SimpleChannelInboundHandler<RespMessage> {

    private static final Logger log = LoggerFactory.getLogger(StoreRequestHandler.class);

    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final StoreService service;
    private final StoreCoreExecutor coreExecutor;
    private boolean streamBroken;

    public StoreRequestHandler(StoreService service, StoreCoreExecutor coreExecutor) {
        this.service = service;
        this.coreExecutor = coreExecutor;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.decrementAndGet());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RespMessage msg) {
        StoreRequest request;
        try {
            request = StoreMessageCodec.decodeRequest(msg);
        } catch (IllegalArgumentException e) {
            log.warn("Error while reading request from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            request = null;
        }

        final StoreRequest decoded = request;
        try {
            coreExecutor.submit(() -> {
                StoreResponse response;
                if (decoded == null) {
                    response = service.malformed();
                } else {
                    try {
                        response = service.handle(decoded);
                    } catch (RuntimeException e) {
                        log.error("Error processing {} request for key '{}'", decoded.type(), decoded.key(), e);
                        response = StoreResponse.failed(decoded.key());
                    }
                }
                ctx.writeAndFlush(StoreMessageCodec.encodeResponse(response));
            });
        } catch (RejectedExecutionException e) {
            log.warn("Store is shutting down, dropping request from {}", ctx.channel().remoteAddress());
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            // 字节流已经错位, 回一个失败响应后断开连接. 残留字节可能再次触发异常, 只响应一次
            if (streamBroken) return;
            streamBroken = true;
            log.warn("Undecodable request from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            try {
                // 走核心线程, 保证排在之前已提交请求的响应后面
                coreExecutor.submit(() -> ctx.writeAndFlush(StoreMessageCodec.encodeResponse(service.malformed()))
                        .addListener(ChannelFutureListener.CLOSE));
            } catch (RejectedExecutionException e) {
                ctx.close();
            }
        } else {
            log.error("Unexpected error on channel {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
