package com.replaybot.cn.model;

import java.util.List;

public record RetryRound(int number, int concurrency, List<FetchTarget> targets) {
    public RetryRound {
        if (number < 0) {
            throw new IllegalArgumentException("round number must be >= 0");
        }
        concurrency = Math.max(1, concurrency);
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public String label() {
        return number == 0 ? "initial" : "retry-" + number;
    }
}
