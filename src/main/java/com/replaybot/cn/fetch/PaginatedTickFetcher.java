package com.replaybot.cn.fetch;

import com.replaybot.cn.data.TickSession;
import com.replaybot.cn.data.TickSource;
import com.replaybot.cn.model.FailureKind;
import com.replaybot.cn.model.FetchOutcome;
import com.replaybot.cn.model.FetchTarget;
import com.replaybot.cn.model.PageResult;
import com.replaybot.cn.model.ServerCandidate;
import com.replaybot.cn.model.ServerPool;
import com.replaybot.cn.model.TickRecord;
import com.replaybot.cn.output.ArtifactStore;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.LongSupplier;

/**
 * 分页拉取单只股票某日的全部分笔成交。
 * 每次尝试按顺序最多轮换 {@code retryCount} 台服务器，每台服务器使用独立会话；
 * 页长小于批大小或返回空页即结束，残缺响应视为该服务器本次失败。
 */
public final class PaginatedTickFetcher implements TargetFetcher {
    private final TickSource source;
    private final ArtifactStore store;
    private final int date;
    private final int batchSize;
    private final int retryCount;
    private final long attemptDeadlineNanos;
    private final LongSupplier nanoClock;

    public PaginatedTickFetcher(
            TickSource source,
            ArtifactStore store,
            int date,
            int batchSize,
            int retryCount,
            Duration attemptDeadline
    ) {
        this(source, store, date, batchSize, retryCount, attemptDeadline, System::nanoTime);
    }

    PaginatedTickFetcher(
            TickSource source,
            ArtifactStore store,
            int date,
            int batchSize,
            int retryCount,
            Duration attemptDeadline,
            LongSupplier nanoClock
    ) {
        this.source = source;
        this.store = store;
        this.date = date;
        this.batchSize = Math.max(1, batchSize);
        this.retryCount = Math.max(1, retryCount);
        this.attemptDeadlineNanos = Math.max(1L, attemptDeadline.toNanos());
        this.nanoClock = nanoClock;
    }

    @Override
    public FetchOutcome fetch(FetchTarget target, ServerPool pool) {
        List<ServerCandidate> servers = pool.candidates(retryCount);
        if (servers.isEmpty()) {
            return FetchOutcome.failed(target, FailureKind.CONNECTIVITY, "no servers available", 0);
        }
        long deadline = nanoClock.getAsLong() + attemptDeadlineNanos;
        FetchOutcome last = null;
        int tries = 0;
        for (ServerCandidate server : servers) {
            if (Thread.currentThread().isInterrupted()) {
                return FetchOutcome.failed(target, FailureKind.CANCELLED, "interrupted", tries);
            }
            tries++;
            FetchOutcome outcome = fetchFromServer(target, server, tries, deadline);
            if (!outcome.isFailed()
                    || outcome.failureKind == FailureKind.STORAGE
                    || outcome.failureKind == FailureKind.DEADLINE) {
                return outcome;
            }
            last = outcome;
        }
        return last;
    }

    private FetchOutcome fetchFromServer(FetchTarget target, ServerCandidate server, int tries, long deadline) {
        List<TickRecord> accumulated = new ArrayList<>();
        try (TickSession session = source.open(server)) {
            int offset = 0;
            boolean more = true;
            while (more) {
                if (nanoClock.getAsLong() - deadline > 0L) {
                    return FetchOutcome.failed(target, FailureKind.DEADLINE, String.format(
                            Locale.ROOT,
                            "attempt deadline exceeded on %s after %d records",
                            server.label(),
                            accumulated.size()
                    ), tries);
                }
                PageResult page = session.fetchPage(target.market, target.code, offset, batchSize, date);
                switch (page.kind) {
                    case TRANSIENT_FAILURE:
                        return FetchOutcome.failed(target, FailureKind.PROTOCOL, String.format(
                                Locale.ROOT,
                                "transient protocol error on %s at offset %d: %s",
                                server.label(),
                                offset,
                                page.error
                        ), tries);
                    case END_OF_DATA:
                        more = false;
                        break;
                    default:
                        accumulated.addAll(page.records);
                        if (page.size() < batchSize) {
                            more = false;
                        } else {
                            offset += batchSize;
                        }
                        break;
                }
            }
        } catch (IOException e) {
            return FetchOutcome.failed(target, FailureKind.CONNECTIVITY,
                    server.label() + " connect failed: " + describe(e), tries);
        }

        if (accumulated.isEmpty()) {
            return FetchOutcome.noData(target,
                    String.format(Locale.ROOT, "no data for %d (market=%d)", date, target.market), tries);
        }
        try {
            store.writeTicks(target, accumulated);
        } catch (IOException e) {
            return FetchOutcome.failed(target, FailureKind.STORAGE, "write failed: " + describe(e), tries);
        }
        return FetchOutcome.success(target, accumulated.size(), tries);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
