package com.replaybot.cn.runner;

import com.replaybot.cn.config.Config;
import com.replaybot.cn.config.DownloadSettings;
import com.replaybot.cn.data.EndpointProbe;
import com.replaybot.cn.data.QuoteResult;
import com.replaybot.cn.data.QuoteSource;
import com.replaybot.cn.fetch.ScriptedTickSource;
import com.replaybot.cn.model.DownloadMode;
import com.replaybot.cn.model.DownloadReport;
import com.replaybot.cn.model.ServerCandidate;
import com.replaybot.cn.output.ArtifactStore;
import com.replaybot.cn.output.ReportBuilder;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DownloadRunnerTest {
    private static final int DATE = 20251216;
    private static final ServerCandidate T1 = new ServerCandidate("10.0.0.1", 7709);
    private static final ServerCandidate T2 = new ServerCandidate("10.0.0.2", 7709);
    private static final EndpointProbe ALWAYS_UP = server -> true;
    private static final QuoteSource NO_QUOTES = (server, code) -> QuoteResult.error("unused");

    @TempDir
    Path tempDir;

    private DownloadSettings settings(boolean fromTickDir) throws Exception {
        Files.writeString(tempDir.resolve("universe.csv"),
                "\uFEFFstock_code,stock_name,exchange\n"
                        + "600000,浦发银行,上海\n"
                        + "1,平安银行,深圳\n"
                        + "430047,诺思兰德,北交所\n",
                StandardCharsets.UTF_8);
        Config config = Config.fromConfigurationProperties(tempDir, Map.of(
                "download", Map.of(
                        "universe_path", "universe.csv",
                        "output_dir", "data",
                        "max_workers", 4,
                        "floor_workers", 1,
                        "retry_pause_ms", 0,
                        "pre_close", Map.of("from_tick_dir", fromTickDir)
                ),
                "tdx", Map.of("servers", "10.0.0.1:7709,10.0.0.2:7709"),
                "eastmoney", Map.of("servers", "em.local:80")
        ));
        return DownloadSettings.from(config);
    }

    private ScriptedTickSource tickSource() {
        return new ScriptedTickSource()
                .script(T1, "600000", ScriptedTickSource.page(2000), ScriptedTickSource.page(20))
                .script(T1, "000001", ScriptedTickSource.broken())
                .script(T2, "000001", ScriptedTickSource.page(5));
    }

    @Test
    void runDate_shouldDownloadTicksAndWriteReport() throws Exception {
        DownloadSettings settings = settings(false);
        ScriptedTickSource source = tickSource();
        DownloadRunner runner = new DownloadRunner(settings, source, ALWAYS_UP, NO_QUOTES, ALWAYS_UP, new RunCancellation());

        DownloadReport report = runner.runDate(DATE, DownloadMode.TICK);

        assertEquals(3, report.total);
        assertEquals(2, report.successCount);
        assertEquals(1, report.noDataCount);
        assertEquals(1, report.failureCount());
        assertEquals(1, report.roundsExecuted);
        assertFalse(report.degradedServerPool);
        Path runDir = tempDir.resolve("data").resolve("tick_" + DATE);
        assertEquals(2021, Files.readAllLines(runDir.resolve("600000.csv"), StandardCharsets.UTF_8).size());
        assertEquals(6, Files.readAllLines(runDir.resolve("000001.csv"), StandardCharsets.UTF_8).size());
        assertFalse(Files.exists(runDir.resolve("430047.csv")));
        assertEquals(
                List.of("stock_code,reason", "430047,no data for 20251216"),
                Files.readAllLines(runDir.resolve(ReportBuilder.FAILED_CSV), StandardCharsets.UTF_8)
        );
        JSONObject json = new JSONObject(Files.readString(runDir.resolve(ReportBuilder.REPORT_JSON), StandardCharsets.UTF_8));
        assertEquals(2, json.getInt("success_count"));
        assertEquals(1, json.getJSONArray("failures").length());
    }

    @Test
    void runDate_shouldResumeWithoutNetworkCalls() throws Exception {
        DownloadSettings settings = settings(false);
        ScriptedTickSource first = tickSource();
        new DownloadRunner(settings, first, ALWAYS_UP, NO_QUOTES, ALWAYS_UP, new RunCancellation())
                .runDate(DATE, DownloadMode.TICK);
        ScriptedTickSource second = new ScriptedTickSource();

        DownloadReport report = new DownloadRunner(settings, second, ALWAYS_UP, NO_QUOTES, ALWAYS_UP, new RunCancellation())
                .runDate(DATE, DownloadMode.TICK);

        assertEquals(2, report.resumedCount);
        assertEquals(2, report.successCount);
        assertEquals(1, second.opens());
    }

    @Test
    void runDate_shouldContinueWithDegradedPool() throws Exception {
        DownloadSettings settings = settings(false);
        EndpointProbe down = server -> {
            throw new ConnectException("refused");
        };

        DownloadReport report = new DownloadRunner(settings, tickSource(), down, NO_QUOTES, down, new RunCancellation())
                .runDate(DATE, DownloadMode.TICK);

        assertTrue(report.degradedServerPool);
        assertEquals(2, report.successCount);
    }

    @Test
    void runDate_shouldFailOnMissingUniverse() throws Exception {
        DownloadSettings settings = settings(false);
        Files.delete(settings.universePath);
        DownloadRunner runner = new DownloadRunner(settings, new ScriptedTickSource(), ALWAYS_UP, NO_QUOTES, ALWAYS_UP, null);

        assertThrows(IllegalStateException.class, () -> runner.runDate(DATE, DownloadMode.TICK));
    }

    @Test
    void runDate_shouldMergePreCloseArtifacts() throws Exception {
        DownloadSettings settings = settings(false);
        AtomicInteger calls = new AtomicInteger();
        QuoteSource quotes = (server, code) -> {
            calls.incrementAndGet();
            return code.equals("430047") ? QuoteResult.invalid("placeholder") : QuoteResult.ok(code.equals("600000") ? 10.5 : 11.25);
        };
        DownloadRunner runner = new DownloadRunner(settings, new ScriptedTickSource(), ALWAYS_UP, quotes, ALWAYS_UP, new RunCancellation());

        DownloadReport report = runner.runDate(DATE, DownloadMode.PRE_CLOSE);

        assertEquals(2, report.successCount);
        assertEquals(1, report.failureCount());
        assertEquals(4, report.roundsExecuted);
        List<String> merged = Files.readAllLines(settings.outputRoot.resolve("stock_pre_close_" + DATE + ".csv"), StandardCharsets.UTF_8);
        assertEquals(List.of(
                ArtifactStore.PRE_CLOSE_HEADER,
                "000001,11.25,深圳,20251216",
                "600000,10.5,上海,20251216"
        ), merged);
    }

    @Test
    void runDate_shouldRestrictPreCloseToTickDirectory() throws Exception {
        DownloadSettings settings = settings(true);
        Path tickDir = settings.outputRoot.resolve("tick_" + DATE);
        Files.createDirectories(tickDir);
        Files.writeString(tickDir.resolve("600000.csv"), ArtifactStore.TICK_HEADER + "\n");
        AtomicInteger calls = new AtomicInteger();
        QuoteSource quotes = (server, code) -> {
            calls.incrementAndGet();
            return QuoteResult.ok(9.9);
        };

        DownloadReport report = new DownloadRunner(settings, new ScriptedTickSource(), ALWAYS_UP, quotes, ALWAYS_UP, new RunCancellation())
                .runDate(DATE, DownloadMode.PRE_CLOSE);

        assertEquals(1, report.total);
        assertEquals(1, calls.get());
    }

    @Test
    void runRange_shouldRunWeekdaysOnlyAndStopWhenCancelled() throws Exception {
        DownloadSettings settings = settings(false);
        RunCancellation cancellation = new RunCancellation();
        DownloadRunner runner = new DownloadRunner(settings, tickSource(), ALWAYS_UP, NO_QUOTES, ALWAYS_UP, cancellation);

        List<DownloadReport> reports = runner.runRange(20251212, 20251214, DownloadMode.TICK);
        assertEquals(1, reports.size());
        assertEquals(20251212, reports.get(0).date);

        cancellation.cancel();
        assertTrue(runner.runRange(20251215, 20251216, DownloadMode.TICK).isEmpty());
    }

    @Test
    void status_shouldListTickDirectoriesNewestFirst() throws Exception {
        DownloadSettings settings = settings(false);
        Files.createDirectories(settings.outputRoot.resolve("tick_20251215"));
        Files.createDirectories(settings.outputRoot.resolve("tick_20251216"));
        Files.writeString(settings.outputRoot.resolve("tick_20251216").resolve("600000.csv"), "x\n");
        Files.createDirectories(settings.outputRoot.resolve("pre_close_20251216"));
        DownloadRunner runner = new DownloadRunner(settings, new ScriptedTickSource(), ALWAYS_UP, NO_QUOTES, ALWAYS_UP, null);

        List<ArtifactStore.RunDirectory> dirs = runner.status();

        assertEquals(2, dirs.size());
        assertEquals("tick_20251216", dirs.get(0).name());
        assertEquals(1, dirs.get(0).artifactCount());
    }

    @Test
    void weekdaysBetween_shouldSkipWeekends() {
        assertEquals(List.of(20251212, 20251215, 20251216), DownloadRunner.weekdaysBetween(20251212, 20251216));
        assertTrue(DownloadRunner.weekdaysBetween(20251213, 20251214).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> DownloadRunner.weekdaysBetween(20251216, 20251212));
    }

    @Test
    void formatSeconds_shouldUseCompactUnits() {
        assertEquals("5s", DownloadRunner.ProgressLogger.formatSeconds(5));
        assertEquals("1m05s", DownloadRunner.ProgressLogger.formatSeconds(65));
        assertEquals("1h02m05s", DownloadRunner.ProgressLogger.formatSeconds(3725));
    }
}
