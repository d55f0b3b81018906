package org.muma.mini.kvstore;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.muma.mini.kvstore.config.StoreConfig;
import org.muma.mini.kvstore.persist.DatabaseFile;
import org.muma.mini.kvstore.persist.SaveBackoff;
import org.muma.mini.kvstore.protocol.RespDecoder;
import org.muma.mini.kvstore.protocol.RespEncoder;
import org.muma.mini.kvstore.server.StoreCoreExecutor;
import org.muma.mini.kvstore.server.StoreRequestHandler;
import org.muma.mini.kvstore.store.StoreService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 持久化 KV 服务进程
 * <p>
 * 构造时加载数据库并绑定端口 (绑定失败直接抛异常); run() 阻塞到 stop();
 * close() 停止服务后无条件再落盘一次.
 */
public class MiniKvServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final StoreCoreExecutor coreExecutor;
    private final StoreService service;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final Channel serverChannel;

    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public MiniKvServer(StoreConfig config) {
        this(config, new StoreCoreExecutor());
    }

    MiniKvServer(StoreConfig config, StoreCoreExecutor coreExecutor) {
        // 1. 核心线程 + 存储
        this.coreExecutor = coreExecutor;
        DatabaseFile databaseFile = new DatabaseFile(Paths.get(config.getStorageFile()), config.getFilePermissions());
        SaveBackoff backoff = new SaveBackoff(config.getSaveInitialBackoff(), config.getSaveMaxBackoff());
        this.service = new StoreService(databaseFile, backoff, coreExecutor.executor());
        if (backoff.isDisabled()) {
            log.info("Save backoff disabled, every write is saved synchronously");
        }

        // 2. 网络
        this.bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("KvStore-Boss", true));
        this.workerGroup = new NioEventLoopGroup(config.getWorkerThreads(), new DefaultThreadFactory("KvStore-Worker", true));

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new LoggingHandler(LogLevel.INFO))
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new RespEncoder())
                                .addLast(new StoreRequestHandler(service, coreExecutor));
                    }
                });

        log.info("Binding server socket on {}:{}", config.getHost(), config.getPort());
        ChannelFuture bindFuture = bootstrap.bind(config.getHost(), config.getPort()).awaitUninterruptibly();
        if (!bindFuture.isSuccess()) {
            log.error("Error binding socket {}:{}", config.getHost(), config.getPort(), bindFuture.cause());
            shutdownEventLoops();
            coreExecutor.shutdown();
            throw new IllegalStateException("Error binding socket " + config.getHost() + ":" + config.getPort(), bindFuture.cause());
        }
        this.serverChannel = bindFuture.channel();
        log.info("Mini-KvStore listening on {}", serverChannel.localAddress());
    }

    /**
     * 阻塞直到 stop() 被调用
     */
    public void run() {
        serverChannel.closeFuture().syncUninterruptibly();
    }

    /**
     * 关闭监听端口和连接, 等待网络线程退出. 可重复调用.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) return;
        log.info("Stopping Mini-KvStore...");
        serverChannel.close().syncUninterruptibly();
        shutdownEventLoops();
    }

    /**
     * 停止服务, 丢弃尚未触发的 flush 定时器, 然后无条件同步落盘一次
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        stop();
        if (!coreExecutor.shutdown()) {
            // 核心线程还活着 (例如卡在写盘), 不能在这里并发访问数据库
            log.error("Core executor still running, final database save skipped");
            return;
        }
        // 核心线程已退出, 在当前线程访问数据库是安全的
        if (!service.flushNow()) {
            log.error("Final database save failed, latest changes may be lost");
        }
        log.info("Mini-KvStore closed. Writes to disk: {}", service.getDatabaseFile().getWriteCount());
    }

    public InetSocketAddress getLocalAddress() {
        return (InetSocketAddress) serverChannel.localAddress();
    }

    StoreService getService() {
        return service;
    }

    private void shutdownEventLoops() {
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    public static void main(String[] args) {
        StoreConfig config = StoreConfig.load(args, System.getenv());
        MiniKvServer server = new MiniKvServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "KvStore-Shutdown"));
        log.info("Mini-KvStore started successfully.");
        server.run();
    }
}
