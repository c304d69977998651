package com.replaybot.cn.runner;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 运行级取消信号：在每次尝试开始前和轮次之间检查；轮间等待可被立即打断。
 */
public final class RunCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch signal = new CountDownLatch(1);

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.countDown();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Waits up to {@code millis}; returns false when the run was cancelled before or during the wait.
     */
    public boolean pause(long millis) {
        if (isCancelled()) {
            return false;
        }
        if (millis <= 0L) {
            return true;
        }
        try {
            return !signal.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
    }
}
