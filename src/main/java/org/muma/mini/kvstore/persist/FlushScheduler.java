package org.muma.mini.kvstore.persist;

import io.netty.util.concurrent.EventExecutor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * 决定什么时候把内存数据库落盘
 * <p>
 * DISABLED: 退避参数全为 0, 每次写请求同步落盘 (阻塞当前请求, 主要给测试用)
 * IDLE:     没有待执行的 flush, 下一次写请求会在 currentDelay 后安排一次 flush
 * ARMED:    已经安排了 flush, 期间的写请求全部由这一次 flush 覆盖 (debounce)
 * <p>
 * flush 任务提交到与请求处理相同的单线程 executor 上, 所以不会和请求并发执行.
 * 所有方法都必须在该 executor 线程上调用.
 */
public class FlushScheduler {

    private static final Logger log = LoggerFactory.getLogger(FlushScheduler.class);

    public enum State {
        DISABLED, IDLE, ARMED
    }

    @Getter
    private final SaveBackoff backoff;
    private final EventExecutor executor;
    private final BooleanSupplier flushAction;

    @Getter
    private State state;
    /** 最近一次安排 flush 时使用的延迟, 尚未安排过则为 null */
    @Getter
    private Duration lastScheduledDelay;

    /**
     * @param flushAction 执行一次落盘, 成功返回 true
     */
    public FlushScheduler(SaveBackoff backoff, EventExecutor executor, BooleanSupplier flushAction) {
        this.backoff = backoff;
        this.executor = executor;
        this.flushAction = flushAction;
        this.state = backoff.isDisabled() ? State.DISABLED : State.IDLE;
    }

    /**
     * 一次成功的写操作之后调用
     */
    public void requestFlush() {
        switch (state) {
            case DISABLED -> {
                // 同步模式: 阻塞到写盘结束, 失败不重试
                if (!flushAction.getAsBoolean()) {
                    log.warn("Synchronous database save failed, data stays in memory until the next write");
                }
            }
            case IDLE -> arm(backoff.getCurrentDelay());
            case ARMED -> {
                // 已经有 flush 在排队, 它会带上这次修改
            }
        }
    }

    private void arm(Duration delay) {
        try {
            executor.schedule(this::onFlushTimer, delay.toMillis(), TimeUnit.MILLISECONDS);
            state = State.ARMED;
            lastScheduledDelay = delay;
            log.debug("Database flush scheduled in {} ms", delay.toMillis());
        } catch (RejectedExecutionException e) {
            // executor 正在关闭, 关闭流程里的最终 flush 会兜底
            log.warn("Database flush not scheduled, executor is shutting down");
            state = State.IDLE;
        }
    }

    private void onFlushTimer() {
        state = State.IDLE;
        if (flushAction.getAsBoolean()) {
            if (backoff.getConsecutiveErrors() > 0) {
                log.info("Database save recovered after {} failed attempts", backoff.getConsecutiveErrors());
            }
            backoff.reportSuccess();
        } else {
            backoff.reportError();
            log.warn("Database save failed ({} in a row), retrying in {} ms",
                    backoff.getConsecutiveErrors(), backoff.getCurrentDelay().toMillis());
            arm(backoff.getCurrentDelay());
        }
    }

    public boolean isArmed() {
        return state == State.ARMED;
    }
}
