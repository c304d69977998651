package com.replaybot.cn.output;

import com.replaybot.cn.model.DownloadMode;
import com.replaybot.cn.model.DownloadReport;
import com.replaybot.cn.model.FailureKind;
import com.replaybot.cn.model.FetchOutcome;
import com.replaybot.cn.model.FetchTarget;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportBuilderTest {
    private static final FetchTarget A = new FetchTarget("600000", "浦发银行", "上海", 1);
    private static final FetchTarget B = new FetchTarget("000001", "平安银行", "深圳", 0);
    private static final FetchTarget C = new FetchTarget("430047", "诺思兰德", "北交所", 2);

    @TempDir
    Path tempDir;

    @Test
    void build_shouldCountNoDataAsFailureWithReason() {
        DownloadReport report = new ReportBuilder().build(20251216, DownloadMode.TICK, 3, List.of(
                FetchOutcome.success(A, 4000, 1),
                FetchOutcome.resumed(B),
                FetchOutcome.noData(C, "no data for 20251216 (market=2)", 1)
        ), 1, false, false, false, 1500);

        assertEquals(2, report.successCount);
        assertEquals(1, report.resumedCount);
        assertEquals(1, report.noDataCount);
        assertEquals(1, report.failureCount());
        assertEquals(new DownloadReport.FailureEntry("430047", "no data for 20251216"), report.failures.get(0));
        assertEquals(report.total, report.successCount + report.failureCount());
    }

    @Test
    void build_shouldRejectBrokenAccountingAndSecondBuild() {
        ReportBuilder builder = new ReportBuilder();
        assertThrows(IllegalStateException.class, () -> builder.build(20251216, DownloadMode.TICK, 3,
                List.of(FetchOutcome.success(A, 1, 1)), 1, false, false, false, 0));

        builder.build(20251216, DownloadMode.TICK, 1, List.of(FetchOutcome.success(A, 1, 1)), 1, false, false, false, 0);
        assertThrows(IllegalStateException.class, () -> builder.build(20251216, DownloadMode.TICK, 1,
                List.of(FetchOutcome.success(A, 1, 1)), 1, false, false, false, 0));
    }

    @Test
    void persist_shouldWriteFailureCsvAndJson() throws Exception {
        ReportBuilder builder = new ReportBuilder();
        DownloadReport report = builder.build(20251216, DownloadMode.PRE_CLOSE, 2, List.of(
                FetchOutcome.success(A, 1, 1),
                FetchOutcome.failed(B, FailureKind.VALIDATION, "invalid value: placeholder, f60", 3)
        ), 4, false, true, false, 90);

        builder.persist(report, tempDir);

        assertEquals(
                List.of("stock_code,reason", "000001,\"invalid value: placeholder, f60\""),
                Files.readAllLines(tempDir.resolve(ReportBuilder.FAILED_CSV), StandardCharsets.UTF_8)
        );
        JSONObject json = new JSONObject(Files.readString(tempDir.resolve(ReportBuilder.REPORT_JSON), StandardCharsets.UTF_8));
        assertEquals("pre-close", json.getString("mode"));
        assertEquals(50.0, json.getDouble("success_pct"), 1e-9);
        assertTrue(json.getBoolean("degraded_server_pool"));
        assertEquals(4, json.getInt("rounds_executed"));
        assertThrows(IllegalStateException.class, () -> builder.persist(report, tempDir));
    }

    @Test
    void persist_shouldWriteHeaderOnlyWhenNothingFailed() throws Exception {
        ReportBuilder builder = new ReportBuilder();
        DownloadReport report = builder.build(20251216, DownloadMode.TICK, 1,
                List.of(FetchOutcome.success(A, 10, 1)), 1, false, false, false, 10);

        builder.persist(report, tempDir);

        assertEquals(List.of("stock_code,reason"), Files.readAllLines(tempDir.resolve(ReportBuilder.FAILED_CSV), StandardCharsets.UTF_8));
    }

    @Test
    void summary_shouldInlineFewFailuresAndPointToFileForMany() {
        DownloadReport few = new ReportBuilder().build(20251216, DownloadMode.TICK, 2, List.of(
                FetchOutcome.success(A, 1, 1),
                FetchOutcome.failed(B, FailureKind.PROTOCOL, "reset", 3)
        ), 4, false, false, false, 2000);
        String fewText = ReportBuilder.summary(few, 10);
        assertTrue(fewText.contains("failed codes: 000001"));
        assertTrue(fewText.contains("50.0%"));

        List<FetchOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            outcomes.add(FetchOutcome.failed(new FetchTarget(String.format("%06d", i + 1), "", "", 0), FailureKind.DEADLINE, "slow", 1));
        }
        DownloadReport many = new ReportBuilder().build(20251216, DownloadMode.TICK, 12, outcomes, 4, false, false, true, 0);
        String manyText = ReportBuilder.summary(many, 10);
        assertTrue(manyText.contains("see " + ReportBuilder.FAILED_CSV));
        assertTrue(manyText.contains("cancelled"));
        assertFalse(manyText.contains("000001,"));
    }
}
