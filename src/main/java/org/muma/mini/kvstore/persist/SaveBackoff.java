package org.muma.mini.kvstore.persist;

import lombok.Getter;

import java.time.Duration;

/**
 * 落盘重试的指数退避
 * <p>
 * 正常情况下延迟为 initialDelay; 每失败一次翻倍 (0 先变成 1ms), 上限 maxDelay;
 * 成功一次立即回到 initialDelay.
 */
public class SaveBackoff {

    static final Duration MIN_RETRY_DELAY = Duration.ofMillis(1);

    private final Duration initialDelay;
    private final Duration maxDelay;

    /** 下一次落盘应该等待的时间 */
    @Getter
    private Duration currentDelay;
    @Getter
    private int consecutiveErrors;

    public SaveBackoff(Duration initialDelay, Duration maxDelay) {
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("backoff delays must not be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(
                    "max backoff " + maxDelay.toMillis() + "ms is smaller than initial backoff " + initialDelay.toMillis() + "ms");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.currentDelay = initialDelay;
    }

    /** 两个延迟都为 0 时不启用定时器, 落盘改为同步 */
    public boolean isDisabled() {
        return initialDelay.isZero() && maxDelay.isZero();
    }

    public void reportSuccess() {
        consecutiveErrors = 0;
        currentDelay = initialDelay;
    }

    public void reportError() {
        consecutiveErrors++;
        Duration next = currentDelay.isZero() ? MIN_RETRY_DELAY : currentDelay.multipliedBy(2);
        currentDelay = next.compareTo(maxDelay) > 0 ? maxDelay : next;
    }
}
