package com.replaybot.cn.fetch;

import com.replaybot.cn.model.FetchOutcome;
import com.replaybot.cn.model.FetchTarget;
import com.replaybot.cn.model.ServerPool;

/**
 * One attempt for one target against the run's server pool. Implementations never throw for
 * remote or storage problems; they return a {@link FetchOutcome}.
 */
@FunctionalInterface
public interface TargetFetcher {
    FetchOutcome fetch(FetchTarget target, ServerPool pool);
}
