package com.replaybot.cn.runner;

import com.replaybot.cn.model.FetchOutcome;

/**
 * Called once per completed target from the collecting thread. Exceptions thrown here are swallowed.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (completed, total) -> {
    };

    void onProgress(int completed, int total);

    /**
     * Receives the outcome that just completed, right before {@link #onProgress}.
     */
    default void onOutcome(FetchOutcome outcome) {
    }
}
