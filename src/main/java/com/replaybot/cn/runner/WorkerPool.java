package com.replaybot.cn.runner;

import com.replaybot.cn.fetch.TargetFetcher;
import com.replaybot.cn.model.FailureKind;
import com.replaybot.cn.model.FetchOutcome;
import com.replaybot.cn.model.FetchTarget;
import com.replaybot.cn.model.ServerPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单轮调度：固定大小线程池，每只股票一次尝试。
 * 工作线程只返回不可变结果，计数和回调都在收集线程中完成；单只股票的异常不会影响其他股票。
 */
public final class WorkerPool {
    private static final Logger LOG = LogManager.getLogger(WorkerPool.class);
    private static final AtomicInteger POOL_SEQ = new AtomicInteger(0);

    private final RunCancellation cancellation;

    public WorkerPool(RunCancellation cancellation) {
        this.cancellation = cancellation == null ? new RunCancellation() : cancellation;
    }

    /**
     * Runs one attempt per target with at most {@code concurrency} in flight.
     *
     * @return outcomes aligned with {@code targets} by index; never throws
     */
    public List<FetchOutcome> run(
            List<FetchTarget> targets,
            int concurrency,
            TargetFetcher fetcher,
            ServerPool pool,
            ProgressListener listener
    ) {
        int total = targets.size();
        FetchOutcome[] results = new FetchOutcome[total];
        if (total == 0) {
            return List.of();
        }
        int threads = Math.max(1, Math.min(concurrency, total));
        ExecutorService executor = Executors.newFixedThreadPool(threads, namedThreads());
        CompletionService<Indexed> completion = new ExecutorCompletionService<>(executor);
        List<Future<Indexed>> futures = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            int index = i;
            FetchTarget target = targets.get(i);
            futures.add(completion.submit(() -> new Indexed(index, attempt(target, fetcher, pool))));
        }

        int completed = 0;
        try {
            while (completed < total) {
                Future<Indexed> future = completion.take();
                Indexed done;
                try {
                    done = future.get();
                } catch (ExecutionException e) {
                    done = null;
                    LOG.warn("worker task failed unexpectedly: {}", String.valueOf(e.getCause()));
                }
                if (done != null) {
                    results[done.index] = done.outcome;
                }
                completed++;
                notifyProgress(listener, done == null ? null : done.outcome, completed, total);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            for (Future<Indexed> future : futures) {
                future.cancel(true);
            }
            LOG.warn("collector interrupted with {}/{} targets completed; cancelling run", completed, total);
        } finally {
            executor.shutdownNow();
        }

        List<FetchOutcome> out = new ArrayList<>(Arrays.asList(results));
        for (int i = 0; i < total; i++) {
            if (out.get(i) == null) {
                FetchTarget target = targets.get(i);
                out.set(i, cancellation.isCancelled()
                        ? FetchOutcome.failed(target, FailureKind.CANCELLED, "cancelled", 0)
                        : FetchOutcome.failed(target, FailureKind.OTHER, "worker task failed", 0));
            }
        }
        return out;
    }

    private FetchOutcome attempt(FetchTarget target, TargetFetcher fetcher, ServerPool pool) {
        if (cancellation.isCancelled()) {
            return FetchOutcome.failed(target, FailureKind.CANCELLED, "cancelled", 0);
        }
        try {
            FetchOutcome outcome = fetcher.fetch(target, pool);
            if (outcome == null) {
                return FetchOutcome.failed(target, FailureKind.OTHER, "fetcher returned no outcome", 0);
            }
            return outcome;
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            LOG.debug("attempt for {} threw", target.code, e);
            return FetchOutcome.failed(target, FailureKind.OTHER, "unexpected error: " + message, 0);
        }
    }

    private static void notifyProgress(ProgressListener listener, FetchOutcome outcome, int completed, int total) {
        if (listener == null) {
            return;
        }
        try {
            if (outcome != null) {
                listener.onOutcome(outcome);
            }
            listener.onProgress(completed, total);
        } catch (RuntimeException e) {
            LOG.debug("progress callback failed: {}", e.toString());
        }
    }

    private static ThreadFactory namedThreads() {
        int poolNo = POOL_SEQ.incrementAndGet();
        AtomicInteger threadNo = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, "replaybot-worker-" + poolNo + "-" + threadNo.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class Indexed {
        final int index;
        final FetchOutcome outcome;

        private Indexed(int index, FetchOutcome outcome) {
            this.index = index;
            this.outcome = outcome;
        }
    }
}
