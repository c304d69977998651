package com.replaybot.cn.fetch;

import com.replaybot.cn.data.QuoteResult;
import com.replaybot.cn.data.QuoteSource;
import com.replaybot.cn.model.FailureKind;
import com.replaybot.cn.model.FetchOutcome;
import com.replaybot.cn.model.FetchTarget;
import com.replaybot.cn.model.ServerCandidate;
import com.replaybot.cn.model.ServerPool;
import com.replaybot.cn.output.ArtifactStore;

import java.io.IOException;
import java.util.List;

/**
 * Previous-close lookup: one request per server, no internal retry loop.
 */
public final class PreCloseFetcher implements TargetFetcher {
    private final QuoteSource source;
    private final ArtifactStore store;
    private final int retryCount;

    public PreCloseFetcher(QuoteSource source, ArtifactStore store, int retryCount) {
        this.source = source;
        this.store = store;
        this.retryCount = Math.max(1, retryCount);
    }

    @Override
    public FetchOutcome fetch(FetchTarget target, ServerPool pool) {
        List<ServerCandidate> servers = pool.candidates(retryCount);
        if (servers.isEmpty()) {
            return FetchOutcome.failed(target, FailureKind.CONNECTIVITY, "no servers available", 0);
        }
        FetchOutcome last = null;
        int tries = 0;
        for (ServerCandidate server : servers) {
            if (Thread.currentThread().isInterrupted()) {
                return FetchOutcome.failed(target, FailureKind.CANCELLED, "interrupted", tries);
            }
            tries++;
            QuoteResult quote = source.fetchPreClose(server, target.code);
            if (quote.ok()) {
                try {
                    store.writePreClose(target, quote.value);
                } catch (IOException e) {
                    return FetchOutcome.failed(target, FailureKind.STORAGE, "write failed: " + e.getMessage(), tries);
                }
                return FetchOutcome.success(target, 1, tries);
            }
            if (quote.kind == QuoteResult.Kind.INVALID) {
                last = FetchOutcome.failed(target, FailureKind.VALIDATION, "invalid value: " + quote.error, tries);
            } else {
                last = FetchOutcome.failed(target, FailureKind.CONNECTIVITY, quote.error, tries);
            }
        }
        return last;
    }
}
