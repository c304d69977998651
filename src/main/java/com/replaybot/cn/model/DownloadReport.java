package com.replaybot.cn.model;

import java.util.List;

/**
 * 一次运行的下载报告，运行结束时构建一次，之后不再修改。
 * 无数据的股票也列入失败清单（原因注明无数据），因此成功数 + 失败数 = 股票总数。
 */
public final class DownloadReport {
    public final int date;
    public final DownloadMode mode;
    public final int total;
    public final int successCount;
    public final int resumedCount;
    public final int noDataCount;
    public final List<FailureEntry> failures;
    public final int roundsExecuted;
    public final boolean retriesSkippedForNoData;
    public final boolean degradedServerPool;
    public final boolean cancelled;
    public final long elapsedMs;

    public DownloadReport(
            int date,
            DownloadMode mode,
            int total,
            int successCount,
            int resumedCount,
            int noDataCount,
            List<FailureEntry> failures,
            int roundsExecuted,
            boolean retriesSkippedForNoData,
            boolean degradedServerPool,
            boolean cancelled,
            long elapsedMs
    ) {
        this.date = date;
        this.mode = mode;
        this.total = Math.max(0, total);
        this.successCount = Math.max(0, successCount);
        this.resumedCount = Math.max(0, resumedCount);
        this.noDataCount = Math.max(0, noDataCount);
        this.failures = failures == null ? List.of() : List.copyOf(failures);
        this.roundsExecuted = Math.max(0, roundsExecuted);
        this.retriesSkippedForNoData = retriesSkippedForNoData;
        this.degradedServerPool = degradedServerPool;
        this.cancelled = cancelled;
        this.elapsedMs = Math.max(0L, elapsedMs);
    }

    public int failureCount() {
        return failures.size();
    }

    public double successPct() {
        return total <= 0 ? 0.0 : successCount * 100.0 / total;
    }

    public double failurePct() {
        return total <= 0 ? 0.0 : failures.size() * 100.0 / total;
    }

    public record FailureEntry(String code, String reason) {
        public FailureEntry {
            code = code == null ? "" : code;
            reason = reason == null ? "" : reason;
        }
    }
}
