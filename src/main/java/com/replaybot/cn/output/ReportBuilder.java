package com.replaybot.cn.output;

import com.replaybot.cn.model.DownloadMode;
import com.replaybot.cn.model.DownloadReport;
import com.replaybot.cn.model.FetchOutcome;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns the final per-target outcomes of a run into a {@link DownloadReport} and persists it.
 * One builder serves one run: a second {@code build} or {@code persist} is rejected.
 */
public final class ReportBuilder {
    public static final String FAILED_CSV = "failed_stocks.csv";
    public static final String REPORT_JSON = "download_report.json";

    private DownloadReport built;
    private boolean persisted;

    public synchronized DownloadReport build(
            int date,
            DownloadMode mode,
            int total,
            List<FetchOutcome> finalOutcomes,
            int roundsExecuted,
            boolean retriesSkippedForNoData,
            boolean degradedServerPool,
            boolean cancelled,
            long elapsedMs
    ) {
        if (built != null) {
            throw new IllegalStateException("report already built for " + built.date);
        }
        int success = 0;
        int resumed = 0;
        int noData = 0;
        List<DownloadReport.FailureEntry> failures = new ArrayList<>();
        for (FetchOutcome outcome : finalOutcomes) {
            if (outcome.isSuccess()) {
                success++;
                if (outcome.resumed) {
                    resumed++;
                }
            } else if (outcome.isNoData()) {
                noData++;
                failures.add(new DownloadReport.FailureEntry(outcome.target.code, noDataReason(date)));
            } else {
                failures.add(new DownloadReport.FailureEntry(outcome.target.code, outcome.reason));
            }
        }
        if (success + failures.size() != total) {
            throw new IllegalStateException(String.format(
                    Locale.ROOT,
                    "report accounting broken: success=%d failures=%d total=%d",
                    success,
                    failures.size(),
                    total
            ));
        }
        built = new DownloadReport(
                date,
                mode,
                total,
                success,
                resumed,
                noData,
                failures,
                roundsExecuted,
                retriesSkippedForNoData,
                degradedServerPool,
                cancelled,
                elapsedMs
        );
        return built;
    }

    /**
     * Writes {@code failed_stocks.csv} (always, header only when nothing failed) and
     * {@code download_report.json} into {@code runDir}.
     */
    public synchronized void persist(DownloadReport report, Path runDir) throws IOException {
        if (persisted) {
            throw new IllegalStateException("report already persisted");
        }
        List<String> csv = new ArrayList<>(report.failures.size() + 1);
        csv.add("stock_code,reason");
        for (DownloadReport.FailureEntry entry : report.failures) {
            csv.add(CsvSupport.joinLine(List.of(entry.code(), entry.reason())));
        }
        ArtifactStore.writeLinesAtomically(runDir.resolve(FAILED_CSV), csv);
        ArtifactStore.writeLinesAtomically(runDir.resolve(REPORT_JSON), List.of(toJson(report).toString(2)));
        persisted = true;
    }

    public static JSONObject toJson(DownloadReport report) {
        JSONObject root = new JSONObject();
        root.put("date", report.date);
        root.put("mode", report.mode.label());
        root.put("total", report.total);
        root.put("success_count", report.successCount);
        root.put("resumed_count", report.resumedCount);
        root.put("no_data_count", report.noDataCount);
        root.put("failure_count", report.failureCount());
        root.put("success_pct", round2(report.successPct()));
        root.put("rounds_executed", report.roundsExecuted);
        root.put("retries_skipped_for_no_data", report.retriesSkippedForNoData);
        root.put("degraded_server_pool", report.degradedServerPool);
        root.put("cancelled", report.cancelled);
        root.put("elapsed_ms", report.elapsedMs);
        root.put("generated_at", Instant.now().toString());
        JSONArray failures = new JSONArray();
        for (DownloadReport.FailureEntry entry : report.failures) {
            JSONObject item = new JSONObject();
            item.put("stock_code", entry.code());
            item.put("reason", entry.reason());
            failures.put(item);
        }
        root.put("failures", failures);
        return root;
    }

    public static String summary(DownloadReport report, int inlineFailureLimit) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(
                Locale.US,
                "download %s %d finished: total=%d success=%d (%.1f%%, resumed=%d) failed=%d (%.1f%%, no_data=%d) rounds=%d elapsed=%.1fs",
                report.mode.label(),
                report.date,
                report.total,
                report.successCount,
                report.successPct(),
                report.resumedCount,
                report.failureCount(),
                report.failurePct(),
                report.noDataCount,
                report.roundsExecuted,
                report.elapsedMs / 1000.0
        ));
        if (report.retriesSkippedForNoData) {
            sb.append(System.lineSeparator()).append("retries skipped: date-level no-data condition");
        }
        if (report.degradedServerPool) {
            sb.append(System.lineSeparator()).append("WARNING: server pool was degraded (no server passed the probe)");
        }
        if (report.cancelled) {
            sb.append(System.lineSeparator()).append("run was cancelled before completion");
        }
        int failed = report.failureCount();
        if (failed > 0 && failed <= inlineFailureLimit) {
            List<String> codes = new ArrayList<>(failed);
            for (DownloadReport.FailureEntry entry : report.failures) {
                codes.add(entry.code());
            }
            sb.append(System.lineSeparator()).append("failed codes: ").append(String.join(", ", codes));
        } else if (failed > inlineFailureLimit) {
            sb.append(System.lineSeparator()).append("failed codes: see ").append(FAILED_CSV);
        }
        return sb.toString();
    }

    public static String noDataReason(int date) {
        return "no data for " + date;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
