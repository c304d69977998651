package com.replaybot.cn.fetch;

import com.replaybot.cn.model.FetchOutcome;
import com.replaybot.cn.model.FetchTarget;
import com.replaybot.cn.model.ServerPool;
import com.replaybot.cn.output.ArtifactStore;

/**
 * 已有完整产物的股票直接记为成功（续传），不发起任何网络请求，也不重写文件。
 */
public final class ResumeGuard implements TargetFetcher {
    private final ArtifactStore store;
    private final TargetFetcher delegate;

    public ResumeGuard(ArtifactStore store, TargetFetcher delegate) {
        this.store = store;
        this.delegate = delegate;
    }

    @Override
    public FetchOutcome fetch(FetchTarget target, ServerPool pool) {
        if (store.exists(target.code)) {
            return FetchOutcome.resumed(target);
        }
        return delegate.fetch(target, pool);
    }
}
