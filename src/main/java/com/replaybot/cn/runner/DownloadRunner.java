package com.replaybot.cn.runner;

import com.replaybot.cn.config.Config;
import com.replaybot.cn.config.DownloadSettings;
import com.replaybot.cn.data.EastmoneyClient;
import com.replaybot.cn.data.EndpointProbe;
import com.replaybot.cn.data.QuoteSource;
import com.replaybot.cn.data.ServerProber;
import com.replaybot.cn.data.TdxClient;
import com.replaybot.cn.data.TickSource;
import com.replaybot.cn.fetch.PaginatedTickFetcher;
import com.replaybot.cn.fetch.PreCloseFetcher;
import com.replaybot.cn.fetch.ResumeGuard;
import com.replaybot.cn.fetch.TargetFetcher;
import com.replaybot.cn.model.DownloadMode;
import com.replaybot.cn.model.DownloadReport;
import com.replaybot.cn.model.FetchOutcome;
import com.replaybot.cn.model.FetchTarget;
import com.replaybot.cn.model.ServerCandidate;
import com.replaybot.cn.model.ServerPool;
import com.replaybot.cn.output.ArtifactStore;
import com.replaybot.cn.output.ReportBuilder;
import com.replaybot.cn.universe.UniverseLoader;
import com.replaybot.core.RunTelemetry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 一次下载运行的编排：加载清单、探测服务器、多轮抓取、生成并落盘报告。
 * 清单缺失或为空是唯一的致命错误；其余问题都体现在报告里。
 */
public final class DownloadRunner {
    private static final Logger LOG = LogManager.getLogger(DownloadRunner.class);
    private static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final DownloadSettings settings;
    private final TickSource tickSource;
    private final EndpointProbe tickProbe;
    private final QuoteSource quoteSource;
    private final EndpointProbe quoteProbe;
    private final RunCancellation cancellation;
    private final UniverseLoader universeLoader = new UniverseLoader();

    public DownloadRunner(
            DownloadSettings settings,
            TickSource tickSource,
            EndpointProbe tickProbe,
            QuoteSource quoteSource,
            EndpointProbe quoteProbe,
            RunCancellation cancellation
    ) {
        this.settings = settings;
        this.tickSource = tickSource;
        this.tickProbe = tickProbe;
        this.quoteSource = quoteSource;
        this.quoteProbe = quoteProbe;
        this.cancellation = cancellation == null ? new RunCancellation() : cancellation;
    }

    public static DownloadRunner create(Config config, RunCancellation cancellation) {
        DownloadSettings settings = DownloadSettings.from(config);
        TdxClient tdx = new TdxClient(settings);
        EastmoneyClient eastmoney = new EastmoneyClient(config);
        return new DownloadRunner(settings, tdx, tdx, eastmoney, eastmoney, cancellation);
    }

    public DownloadSettings settings() {
        return settings;
    }

    public DownloadReport runDate(int date, DownloadMode mode) throws IOException {
        long startedNanos = System.nanoTime();
        RunTelemetry telemetry = new RunTelemetry(date, mode.label(), Instant.now());
        ArtifactStore store = new ArtifactStore(settings.outputRoot, mode, date);
        LOG.info("=== {} download for {} -> {} ===", mode.label(), date, store.runDir());

        telemetry.startStep(RunTelemetry.STEP_UNIVERSE);
        List<FetchTarget> universe = loadUniverse(date, mode);
        telemetry.endStep(RunTelemetry.STEP_UNIVERSE, universe.size(), universe.size(), 0);

        telemetry.startStep(RunTelemetry.STEP_PROBE);
        List<ServerCandidate> configured = settings.serversFor(mode);
        ServerPool pool = new ServerProber(mode == DownloadMode.TICK ? tickProbe : quoteProbe).probe(configured);
        telemetry.endStep(RunTelemetry.STEP_PROBE, configured.size(), pool.size(), pool.degraded() ? 1 : 0,
                pool.degraded() ? "degraded" : "");

        TargetFetcher fetcher = new ResumeGuard(store, mode == DownloadMode.TICK
                ? new PaginatedTickFetcher(tickSource, store, date, settings.batchSize, settings.retryCount, settings.attemptDeadline)
                : new PreCloseFetcher(quoteSource, store, settings.retryCount));
        RetryController controller = new RetryController(
                new WorkerPool(cancellation),
                new NoDataClassifier(settings.noDataThreshold),
                cancellation,
                settings.maxWorkers,
                settings.floorWorkers,
                settings.maxRetry,
                settings.retryPauseMs,
                settings.diagnosticSamples
        );
        RetryController.RetryOutcome result = controller.run(
                universe,
                fetcher,
                pool,
                new ProgressLogger(settings.progressLogEvery),
                telemetry
        );

        telemetry.startStep(RunTelemetry.STEP_REPORT);
        long elapsedMs = Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        ReportBuilder builder = new ReportBuilder();
        DownloadReport report = builder.build(
                date,
                mode,
                universe.size(),
                result.outcomes,
                result.roundsExecuted(),
                result.retriesSkippedForNoData,
                pool.degraded(),
                result.cancelled,
                elapsedMs
        );
        builder.persist(report, store.runDir());
        telemetry.endStep(RunTelemetry.STEP_REPORT, report.total, report.successCount, report.failureCount());
        LOG.info(ReportBuilder.summary(report, settings.inlineFailureLimit));
        LOG.info("failure list: {}", store.runDir().resolve(ReportBuilder.FAILED_CSV));

        if (mode == DownloadMode.PRE_CLOSE) {
            telemetry.startStep(RunTelemetry.STEP_MERGE);
            Path merged = settings.outputRoot.resolve("stock_pre_close_" + date + ".csv");
            int rows = store.mergePreClose(merged);
            telemetry.endStep(RunTelemetry.STEP_MERGE, rows, rows, 0);
            LOG.info("merged {} pre-close rows into {}", rows, merged);
        }

        telemetry.finish();
        LOG.info("run telemetry:\n{}", telemetry.getSummary());
        return report;
    }

    /**
     * Runs every weekday in {@code [start, end]}; stops early when the run is cancelled.
     */
    public List<DownloadReport> runRange(int start, int end, DownloadMode mode) throws IOException {
        List<Integer> dates = weekdaysBetween(start, end);
        LOG.info("date range {}..{}: {} weekdays", start, end, dates.size());
        List<DownloadReport> reports = new ArrayList<>(dates.size());
        for (int date : dates) {
            if (cancellation.isCancelled()) {
                LOG.warn("cancelled; {} of {} dates not started", dates.size() - reports.size(), dates.size());
                break;
            }
            reports.add(runDate(date, mode));
        }
        return reports;
    }

    public List<ArtifactStore.RunDirectory> status() throws IOException {
        return ArtifactStore.scanRunDirectories(settings.outputRoot, DownloadMode.TICK);
    }

    public static List<Integer> weekdaysBetween(int start, int end) {
        LocalDate from = parseDate(start);
        LocalDate to = parseDate(end);
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("end date " + end + " is before start date " + start);
        }
        List<Integer> out = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            DayOfWeek dow = d.getDayOfWeek();
            if (dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY) {
                out.add(Integer.parseInt(d.format(BASIC_DATE)));
            }
        }
        return out;
    }

    public static LocalDate parseDate(int date) {
        return LocalDate.parse(String.format(Locale.ROOT, "%08d", date), BASIC_DATE);
    }

    private List<FetchTarget> loadUniverse(int date, DownloadMode mode) throws IOException {
        List<FetchTarget> universe = universeLoader.load(settings.universePath);
        if (mode != DownloadMode.PRE_CLOSE || !settings.preCloseFromTickDir) {
            return universe;
        }
        ArtifactStore tickStore = new ArtifactStore(settings.outputRoot, DownloadMode.TICK, date);
        List<String> tickCodes = tickStore.listCodes();
        if (tickCodes.isEmpty()) {
            LOG.warn("no tick artifacts under {}; using the full universe", tickStore.runDir());
            return universe;
        }
        List<FetchTarget> restricted = UniverseLoader.restrictTo(universe, tickCodes);
        if (restricted.isEmpty()) {
            throw new IllegalStateException("no universe entries match the codes in " + tickStore.runDir());
        }
        LOG.info("restricted universe to {} codes found in {}", restricted.size(), tickStore.runDir());
        return restricted;
    }

    /**
     * Periodic progress lines with success/failed counts and an ETA; the clock restarts each round.
     */
    static final class ProgressLogger implements ProgressListener {
        private final int logEvery;
        private long roundStartedNanos = System.nanoTime();
        private int lastCompleted;
        private int success;
        private int noData;
        private int failed;
        private FetchOutcome latest;

        ProgressLogger(int logEvery) {
            this.logEvery = Math.max(0, logEvery);
        }

        @Override
        public void onOutcome(FetchOutcome outcome) {
            latest = outcome;
        }

        @Override
        public void onProgress(int completed, int total) {
            if (completed <= lastCompleted) {
                roundStartedNanos = System.nanoTime();
                success = 0;
                noData = 0;
                failed = 0;
            }
            lastCompleted = completed;
            if (latest != null) {
                if (latest.isSuccess()) {
                    success++;
                } else if (latest.isNoData()) {
                    noData++;
                } else {
                    failed++;
                }
                latest = null;
            }
            if (!shouldLog(completed, total)) {
                return;
            }
            long elapsedSec = Math.max(0L, Math.round((System.nanoTime() - roundStartedNanos) / 1_000_000_000.0));
            int remaining = Math.max(0, total - completed);
            long etaSec = completed <= 0 ? 0L : Math.round(elapsedSec * (remaining / (double) completed));
            double pct = total <= 0 ? 100.0 : completed * 100.0 / total;
            LOG.info(String.format(
                    Locale.US,
                    "Progress done=%d/%d (%.1f%%) success=%d no_data=%d failed=%d elapsed=%s eta=%s",
                    completed,
                    total,
                    pct,
                    success,
                    noData,
                    failed,
                    formatSeconds(elapsedSec),
                    formatSeconds(etaSec)
            ));
        }

        private boolean shouldLog(int completed, int total) {
            if (completed >= total) {
                return true;
            }
            if (logEvery <= 0) {
                return false;
            }
            return completed % logEvery == 0;
        }

        static String formatSeconds(long seconds) {
            long s = Math.max(0L, seconds);
            long h = s / 3600L;
            long m = (s % 3600L) / 60L;
            long sec = s % 60L;
            if (h > 0L) {
                return String.format(Locale.US, "%dh%02dm%02ds", h, m, sec);
            }
            if (m > 0L) {
                return String.format(Locale.US, "%dm%02ds", m, sec);
            }
            return sec + "s";
        }
    }
}
