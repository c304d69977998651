package com.replaybot.cn.runner;

import com.replaybot.cn.fetch.TargetFetcher;
import com.replaybot.cn.model.FetchOutcome;
import com.replaybot.cn.model.FetchTarget;
import com.replaybot.cn.model.RetryRound;
import com.replaybot.cn.model.ServerPool;
import com.replaybot.core.RunTelemetry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 多轮重试：第 0 轮处理全部股票，之后每轮只处理上一轮失败的股票，并发数减半但不低于下限。
 * 无数据不算故障，不参与重试；第 0 轮无数据占比达到阈值时视为整日无数据，直接结束。
 * {@code maxRetry = k} 表示第 0 轮之后最多再执行 k 轮。
 */
public final class RetryController {
    private static final Logger LOG = LogManager.getLogger(RetryController.class);

    private final WorkerPool workerPool;
    private final NoDataClassifier classifier;
    private final RunCancellation cancellation;
    private final int maxWorkers;
    private final int floorWorkers;
    private final int maxRetry;
    private final long retryPauseMs;
    private final int diagnosticSamples;

    public RetryController(
            WorkerPool workerPool,
            NoDataClassifier classifier,
            RunCancellation cancellation,
            int maxWorkers,
            int floorWorkers,
            int maxRetry,
            long retryPauseMs,
            int diagnosticSamples
    ) {
        this.workerPool = workerPool;
        this.classifier = classifier;
        this.cancellation = cancellation;
        this.maxWorkers = Math.max(1, maxWorkers);
        this.floorWorkers = Math.max(1, Math.min(floorWorkers, this.maxWorkers));
        this.maxRetry = Math.max(0, maxRetry);
        this.retryPauseMs = Math.max(0L, retryPauseMs);
        this.diagnosticSamples = Math.max(0, diagnosticSamples);
    }

    /**
     * Halves the concurrency for the next round without going under {@code floor}
     * and never above the current level.
     */
    public static int nextConcurrency(int current, int floor) {
        int cur = Math.max(1, current);
        return Math.max(Math.min(Math.max(1, floor), cur), cur / 2);
    }

    public RetryOutcome run(
            List<FetchTarget> universe,
            TargetFetcher fetcher,
            ServerPool pool,
            ProgressListener listener,
            RunTelemetry telemetry
    ) {
        Map<FetchTarget, FetchOutcome> latest = new LinkedHashMap<>();
        List<RetryRound> rounds = new ArrayList<>();
        boolean skippedForNoData = false;
        boolean cancelled = false;

        List<FetchTarget> pending = universe;
        int concurrency = maxWorkers;
        int roundNo = 0;
        while (!pending.isEmpty()) {
            RetryRound round = new RetryRound(roundNo, concurrency, pending);
            rounds.add(round);
            LOG.info("round {} ({}): targets={} concurrency={} servers={}",
                    round.number(), round.label(), round.targets().size(), round.concurrency(), pool);
            String step = RunTelemetry.roundStep(roundNo);
            if (telemetry != null) {
                telemetry.startStep(step);
            }

            List<FetchOutcome> outcomes = workerPool.run(round.targets(), round.concurrency(), fetcher, pool, listener);
            List<FetchTarget> failed = new ArrayList<>();
            int succeeded = 0;
            int noData = 0;
            for (FetchOutcome outcome : outcomes) {
                latest.put(outcome.target, outcome);
                if (outcome.isFailed()) {
                    failed.add(outcome.target);
                } else if (outcome.isNoData()) {
                    noData++;
                } else {
                    succeeded++;
                }
            }
            if (telemetry != null) {
                telemetry.endStep(step, outcomes.size(), succeeded, failed.size(),
                        "concurrency=" + round.concurrency() + " no_data=" + noData);
            }
            LOG.info("round {} done: success={} no_data={} failed={}", roundNo, succeeded, noData, failed.size());

            if (roundNo == 0) {
                logDiagnostics(outcomes);
                if (!failed.isEmpty() && classifier.isDateLevelNoData(outcomes)) {
                    skippedForNoData = true;
                    LOG.warn("{}% of targets returned no data; treating the date as having no data and skipping retries",
                            Math.round(NoDataClassifier.share(outcomes) * 100.0));
                    LOG.warn("hint: servers archive the current day's tick history only in the evening; "
                            + "for today's date rerun after the close archive is published, otherwise check for a holiday");
                    break;
                }
            }
            if (cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            if (failed.isEmpty() || roundNo >= maxRetry) {
                break;
            }
            int next = nextConcurrency(concurrency, floorWorkers);
            LOG.info("{} targets failed; retry round {}/{} in {} ms with concurrency {}",
                    failed.size(), roundNo + 1, maxRetry, retryPauseMs, next);
            if (!cancellation.pause(retryPauseMs)) {
                cancelled = true;
                break;
            }
            pending = failed;
            concurrency = next;
            roundNo++;
        }

        List<FetchOutcome> finalOutcomes = new ArrayList<>(universe.size());
        for (FetchTarget target : universe) {
            FetchOutcome outcome = latest.get(target);
            if (outcome != null) {
                finalOutcomes.add(outcome);
            }
        }
        return new RetryOutcome(finalOutcomes, rounds, skippedForNoData, cancelled || cancellation.isCancelled());
    }

    private void logDiagnostics(List<FetchOutcome> outcomes) {
        if (diagnosticSamples <= 0) {
            return;
        }
        int logged = 0;
        for (FetchOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                continue;
            }
            LOG.info("sample {} {}: {}", outcome.isNoData() ? "no-data" : "failure", outcome.target, outcome.reason);
            logged++;
            if (logged >= diagnosticSamples) {
                return;
            }
        }
    }

    public static final class RetryOutcome {
        public final List<FetchOutcome> outcomes;
        public final List<RetryRound> rounds;
        public final boolean retriesSkippedForNoData;
        public final boolean cancelled;

        RetryOutcome(List<FetchOutcome> outcomes, List<RetryRound> rounds, boolean retriesSkippedForNoData, boolean cancelled) {
            this.outcomes = List.copyOf(outcomes);
            this.rounds = List.copyOf(rounds);
            this.retriesSkippedForNoData = retriesSkippedForNoData;
            this.cancelled = cancelled;
        }

        public int roundsExecuted() {
            return rounds.size();
        }
    }
}
