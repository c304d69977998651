package com.replaybot.cn.runner;

import com.replaybot.cn.model.FetchOutcome;

import java.util.List;

/**
 * Decides whether round 0 hit a date-level no-data condition (holiday, or a date the servers
 * have not archived yet) instead of per-target faults.
 */
public final class NoDataClassifier {
    private final double threshold;

    public NoDataClassifier(double threshold) {
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("no-data threshold must be in (0, 1]: " + threshold);
        }
        this.threshold = threshold;
    }

    public boolean isDateLevelNoData(List<FetchOutcome> roundZero) {
        if (roundZero == null || roundZero.isEmpty()) {
            return false;
        }
        return share(roundZero) >= threshold;
    }

    public static double share(List<FetchOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            return 0.0;
        }
        int noData = 0;
        for (FetchOutcome outcome : outcomes) {
            if (outcome.isNoData()) {
                noData++;
            }
        }
        return noData / (double) outcomes.size();
    }
}
