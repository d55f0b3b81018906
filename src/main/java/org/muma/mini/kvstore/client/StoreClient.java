package org.muma.mini.kvstore.client;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.muma.mini.kvstore.protocol.RespArray;
import org.muma.mini.kvstore.protocol.RespDecoder;
import org.muma.mini.kvstore.protocol.RespEncoder;
import org.muma.mini.kvstore.protocol.RespMessage;
import org.muma.mini.kvstore.protocol.StoreMessageCodec;
import org.muma.mini.kvstore.protocol.StoreRequest;
import org.muma.mini.kvstore.protocol.StoreResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 同步 KV 客户端, 一次只有一个请求在途
 */
public class StoreClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StoreClient.class);

    private final EventLoopGroup group;
    private final Channel channel;
    private final Duration timeout;

    private volatile CompletableFuture<RespMessage> pending;

    public StoreClient(String host, int port) throws IOException {
        this(host, port, Duration.ofSeconds(5));
    }

    public StoreClient(String host, int port, Duration timeout) throws IOException {
        this.timeout = timeout;
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("KvStore-Client", true));

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new RespEncoder())
                                .addLast(new ResponseHandler());
                    }
                });

        var connectFuture = bootstrap.connect(host, port).awaitUninterruptibly();
        if (!connectFuture.isSuccess()) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw new IOException("Failed to connect to " + host + ":" + port, connectFuture.cause());
        }
        this.channel = connectFuture.channel();
        log.debug("Connected to {}:{}", host, port);
    }

    public StoreResponse store(String key, String value) throws IOException {
        return execute(StoreRequest.store(key, value));
    }

    public StoreResponse store(String key, byte[] value) throws IOException {
        return execute(StoreRequest.store(key, value));
    }

    public StoreResponse load(String key) throws IOException {
        return execute(StoreRequest.load(key));
    }

    public StoreResponse erase(String key) throws IOException {
        return execute(StoreRequest.erase(key));
    }

    public StoreResponse execute(StoreRequest request) throws IOException {
        return send(StoreMessageCodec.encodeRequest(request));
    }

    /**
     * 发送任意 RESP 帧 (可以是不合法的请求) 并等待响应
     */
    public synchronized StoreResponse send(RespArray frame) throws IOException {
        CompletableFuture<RespMessage> future = new CompletableFuture<>();
        pending = future;
        channel.writeAndFlush(frame).addListener(f -> {
            if (!f.isSuccess()) future.completeExceptionally(f.cause());
        });
        return StoreMessageCodec.decodeResponse(await(future));
    }

    private RespMessage await(CompletableFuture<RespMessage> future) throws IOException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for response", e);
        } catch (ExecutionException e) {
            throw new IOException("Request failed", e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("No response within " + timeout.toMillis() + " ms", e);
        } finally {
            pending = null;
        }
    }

    @Override
    public void close() {
        channel.close().awaitUninterruptibly();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    private class ResponseHandler extends SimpleChannelInboundHandler<RespMessage> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, RespMessage msg) {
            CompletableFuture<RespMessage> future = pending;
            if (future != null) {
                future.complete(msg);
            } else {
                log.warn("Dropping unsolicited response: {}", msg);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            CompletableFuture<RespMessage> future = pending;
            if (future != null) {
                future.completeExceptionally(new ClosedChannelException());
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("Client channel error", cause);
            CompletableFuture<RespMessage> future = pending;
            if (future != null) {
                future.completeExceptionally(cause);
            }
            ctx.close();
        }
    }
}
