package org.muma.mini.kvstore.server;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * 核心业务线程 (Single Thread Logic)
 * 请求处理和定时 flush 都在这里排队执行, 数据库因此无需加锁.
 */
public class StoreCoreExecutor {

    private static final Logger log = LoggerFactory.getLogger(StoreCoreExecutor.class);

    // Netty 的 DefaultEventExecutor 是单线程事件循环, 同时支持 schedule
    private final EventExecutor singleThread = new DefaultEventExecutor(new DefaultThreadFactory("KvStore-Core", true));

    private final long terminationTimeoutMillis;

    public StoreCoreExecutor() {
        this(10_000);
    }

    /**
     * @param terminationTimeoutMillis shutdown() 等待核心线程退出的最长时间
     */
    public StoreCoreExecutor(long terminationTimeoutMillis) {
        this.terminationTimeoutMillis = terminationTimeoutMillis;
    }

    public void submit(Runnable task) {
        singleThread.execute(task);
    }

    public EventExecutor executor() {
        return singleThread;
    }

    /**
     * 停止接收新任务; 尚未触发的定时任务直接丢弃, 不等待
     *
     * @return 核心线程是否已经退出. 返回 false 时线程可能仍在访问数据库
     */
    public boolean shutdown() {
        Future<?> terminated = singleThread.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        if (!terminated.awaitUninterruptibly(terminationTimeoutMillis, TimeUnit.MILLISECONDS)) {
            log.warn("Core executor did not terminate within {} ms", terminationTimeoutMillis);
            return false;
        }
        return true;
    }
}
