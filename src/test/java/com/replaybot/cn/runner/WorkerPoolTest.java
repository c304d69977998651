package com.replaybot.cn.runner;

import com.replaybot.cn.model.FailureKind;
import com.replaybot.cn.model.FetchOutcome;
import com.replaybot.cn.model.FetchTarget;
import com.replaybot.cn.model.ServerCandidate;
import com.replaybot.cn.model.ServerPool;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerPoolTest {
    private static final ServerPool POOL = ServerPool.healthy(List.of(new ServerCandidate("10.0.0.1", 7709)));

    @Test
    void run_shouldNeverExceedConcurrency() {
        ScriptedFetcher fetcher = new ScriptedFetcher((code, attempt) -> ScriptedFetcher.Result.SUCCESS).withDelay(20);
        List<FetchTarget> targets = ScriptedFetcher.targets(24);

        List<FetchOutcome> outcomes = new WorkerPool(new RunCancellation()).run(targets, 3, fetcher, POOL, ProgressListener.NONE);

        assertEquals(24, outcomes.size());
        assertTrue(fetcher.maxActive() <= 3, "max in flight was " + fetcher.maxActive());
        for (int i = 0; i < targets.size(); i++) {
            assertEquals(targets.get(i), outcomes.get(i).target);
            assertTrue(outcomes.get(i).isSuccess());
        }
    }

    @Test
    void run_shouldIsolateUnexpectedExceptions() {
        List<FetchTarget> targets = ScriptedFetcher.targets(5);

        List<FetchOutcome> outcomes = new WorkerPool(new RunCancellation()).run(targets, 2, (target, pool) -> {
            if (target.code.equals("000003")) {
                throw new IllegalStateException("boom");
            }
            return FetchOutcome.success(target, 1, 1);
        }, POOL, ProgressListener.NONE);

        assertEquals(5, outcomes.size());
        assertTrue(outcomes.get(2).isFailed());
        assertEquals(FailureKind.OTHER, outcomes.get(2).failureKind);
        assertTrue(outcomes.get(2).reason.contains("boom"));
        assertEquals(4, outcomes.stream().filter(FetchOutcome::isSuccess).count());
    }

    @Test
    void run_shouldReportProgressOncePerTargetAndSurviveCallbackErrors() {
        List<Integer> progress = new ArrayList<>();
        AtomicInteger seen = new AtomicInteger();
        ProgressListener listener = new ProgressListener() {
            @Override
            public void onProgress(int completed, int total) {
                progress.add(completed);
                if (completed == 2) {
                    throw new IllegalStateException("listener bug");
                }
            }

            @Override
            public void onOutcome(FetchOutcome outcome) {
                seen.incrementAndGet();
            }
        };
        ScriptedFetcher fetcher = new ScriptedFetcher((code, attempt) -> ScriptedFetcher.Result.NO_DATA);

        List<FetchOutcome> outcomes = new WorkerPool(new RunCancellation()).run(ScriptedFetcher.targets(6), 4, fetcher, POOL, listener);

        assertEquals(6, outcomes.size());
        assertEquals(List.of(1, 2, 3, 4, 5, 6), progress);
        assertEquals(6, seen.get());
    }

    @Test
    void run_shouldMarkEverythingCancelledWhenAlreadyCancelled() {
        RunCancellation cancellation = new RunCancellation();
        cancellation.cancel();
        ScriptedFetcher fetcher = new ScriptedFetcher((code, attempt) -> ScriptedFetcher.Result.SUCCESS);

        List<FetchOutcome> outcomes = new WorkerPool(cancellation).run(ScriptedFetcher.targets(4), 2, fetcher, POOL, ProgressListener.NONE);

        assertEquals(0, fetcher.totalCalls());
        for (FetchOutcome outcome : outcomes) {
            assertEquals(FailureKind.CANCELLED, outcome.failureKind);
        }
    }

    @Test
    void run_shouldStopStartingTargetsAfterCancel() {
        RunCancellation cancellation = new RunCancellation();
        ScriptedFetcher fetcher = new ScriptedFetcher((code, attempt) -> {
            if (code.equals("000002")) {
                cancellation.cancel();
            }
            return ScriptedFetcher.Result.SUCCESS;
        });

        List<FetchOutcome> outcomes = new WorkerPool(cancellation).run(ScriptedFetcher.targets(10), 1, fetcher, POOL, ProgressListener.NONE);

        assertEquals(10, outcomes.size());
        assertEquals(2, fetcher.totalCalls());
        assertEquals(8, outcomes.stream().filter(o -> o.failureKind == FailureKind.CANCELLED).count());
    }

    @Test
    void run_shouldReturnEmptyForNoTargets() {
        assertTrue(new WorkerPool(null).run(List.of(), 4, (t, p) -> null, POOL, null).isEmpty());
    }
}
