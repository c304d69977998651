package com.replaybot.app;

import com.replaybot.cn.config.Config;
import com.replaybot.cn.config.DownloadSettings;
import com.replaybot.cn.model.DownloadMode;
import com.replaybot.cn.model.DownloadReport;
import com.replaybot.cn.output.ArtifactStore;
import com.replaybot.cn.runner.DownloadRunner;
import com.replaybot.cn.runner.RunCancellation;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class ReplayBotApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CANCELLED = 130;

    private static final DateTimeFormatter ARG_DATE = DateTimeFormatter.ofPattern("uuuuMMdd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final ZoneId MARKET_ZONE = ZoneId.of("Asia/Shanghai");
    private static final long SHUTDOWN_WAIT_SEC = 30L;
    private static final String[] SUMMARY_KEYS = {
            "download.mode",
            "download.universe_path",
            "download.output_dir",
            "download.max_workers",
            "download.floor_workers",
            "download.max_retry",
            "download.retry_count",
            "download.batch_size",
            "download.timeout_sec",
            "download.attempt_deadline_sec",
            "tdx.servers",
            "eastmoney.servers"
    };
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new ReplayBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("replaybot", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("replaybot", options);
            return EXIT_OK;
        }

        Map<String, String> overrides;
        int[] dates;
        try {
            overrides = overridesFrom(cmd);
            dates = cmd.hasOption("status") ? new int[0] : resolveDates(cmd);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir).withOverrides(overrides);
        installLogRoutingIfNeeded(config);
        Logger log = LogManager.getLogger(ReplayBotApplication.class);

        RunCancellation cancellation = new RunCancellation();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            if (finished.getCount() == 0L) {
                return;
            }
            log.warn("interrupt received; cancelling run and waiting for the report to be written");
            cancellation.cancel();
            try {
                finished.await(SHUTDOWN_WAIT_SEC, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "replaybot-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            logConfigSummary(log, config);
            DownloadRunner runner = DownloadRunner.create(config, cancellation);
            if (cmd.hasOption("status")) {
                printStatus(runner);
                return EXIT_OK;
            }
            DownloadMode mode = runner.settings().mode;
            boolean cancelled;
            if (dates.length == 1) {
                DownloadReport report = runner.runDate(dates[0], mode);
                cancelled = report.cancelled;
            } else {
                List<DownloadReport> reports = runner.runRange(dates[0], dates[1], mode);
                cancelled = cancellation.isCancelled() || reports.stream().anyMatch(r -> r.cancelled);
            }
            return cancelled ? EXIT_CANCELLED : EXIT_OK;
        } catch (IllegalArgumentException e) {
            log.error("invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalStateException | IOException e) {
            log.error("FATAL: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } finally {
            finished.countDown();
        }
    }

    /**
     * Parses a {@code yyyyMMdd} argument into the numeric run date.
     */
    static int parseDateArg(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (!value.matches("\\d{8}")) {
            throw new IllegalArgumentException("date must be yyyyMMdd: " + raw);
        }
        try {
            LocalDate.parse(value, ARG_DATE);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("not a calendar date: " + raw, e);
        }
        return Integer.parseInt(value);
    }

    /**
     * One element for a single date, two elements for an inclusive range.
     */
    static int[] resolveDates(CommandLine cmd) {
        boolean hasStart = cmd.hasOption("start-date");
        boolean hasEnd = cmd.hasOption("end-date");
        if (cmd.hasOption("date") && (hasStart || hasEnd)) {
            throw new IllegalArgumentException("--date cannot be combined with --start-date/--end-date");
        }
        if (hasStart != hasEnd) {
            throw new IllegalArgumentException("--start-date and --end-date must be given together");
        }
        if (hasStart) {
            int start = parseDateArg(cmd.getOptionValue("start-date"));
            int end = parseDateArg(cmd.getOptionValue("end-date"));
            if (end < start) {
                throw new IllegalArgumentException("--end-date is before --start-date");
            }
            return new int[]{start, end};
        }
        if (cmd.hasOption("date")) {
            return new int[]{parseDateArg(cmd.getOptionValue("date"))};
        }
        return new int[]{Integer.parseInt(LocalDate.now(MARKET_ZONE).format(DateTimeFormatter.BASIC_ISO_DATE))};
    }

    static Map<String, String> overridesFrom(CommandLine cmd) {
        Map<String, String> overrides = new LinkedHashMap<>();
        if (cmd.hasOption("mode")) {
            overrides.put("download.mode", DownloadMode.fromLabel(cmd.getOptionValue("mode")).label());
        }
        if (cmd.hasOption("workers")) {
            overrides.put("download.max_workers", Integer.toString(positiveInt("workers", cmd.getOptionValue("workers"))));
        }
        if (cmd.hasOption("max-retry")) {
            int value = parseInt("max-retry", cmd.getOptionValue("max-retry"));
            if (value < 0) {
                throw new IllegalArgumentException("--max-retry must be >= 0");
            }
            overrides.put("download.max_retry", Integer.toString(value));
        }
        if (cmd.hasOption("universe")) {
            overrides.put("download.universe_path", cmd.getOptionValue("universe"));
        }
        if (cmd.hasOption("output-dir")) {
            overrides.put("download.output_dir", cmd.getOptionValue("output-dir"));
        }
        if (cmd.hasOption("from-tick-dir")) {
            overrides.put("download.pre_close.from_tick_dir", "true");
        }
        return overrides;
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("date").hasArg().argName("yyyyMMdd").desc("trading date to download (default: today, Asia/Shanghai)").build());
        options.addOption(Option.builder().longOpt("start-date").hasArg().argName("yyyyMMdd").desc("first date of an inclusive range (weekdays only)").build());
        options.addOption(Option.builder().longOpt("end-date").hasArg().argName("yyyyMMdd").desc("last date of an inclusive range").build());
        options.addOption(Option.builder().longOpt("mode").hasArg().argName("tick|pre-close").desc("what to download").build());
        options.addOption(Option.builder().longOpt("workers").hasArg().argName("n").desc("initial concurrency (download.max_workers)").build());
        options.addOption(Option.builder().longOpt("max-retry").hasArg().argName("k").desc("retry rounds after the initial round").build());
        options.addOption(Option.builder().longOpt("universe").hasArg().argName("path").desc("universe CSV/XLS/XLSX file").build());
        options.addOption(Option.builder().longOpt("output-dir").hasArg().argName("path").desc("artifact root directory").build());
        options.addOption(Option.builder().longOpt("from-tick-dir").desc("pre-close: only codes that have a tick artifact for the date").build());
        options.addOption(Option.builder().longOpt("status").desc("list downloaded tick_<date> directories and exit").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private void printStatus(DownloadRunner runner) throws IOException {
        List<ArtifactStore.RunDirectory> dirs = runner.status();
        if (dirs.isEmpty()) {
            System.out.println("No tick data downloaded yet under " + runner.settings().outputRoot);
            return;
        }
        System.out.println("Downloaded tick data under " + runner.settings().outputRoot + ":");
        for (ArtifactStore.RunDirectory dir : dirs) {
            System.out.println("  " + dir.name() + "  stocks=" + dir.artifactCount());
        }
    }

    private void logConfigSummary(Logger log, Config config) {
        StringBuilder sb = new StringBuilder("effective config:");
        for (String key : SUMMARY_KEYS) {
            sb.append(System.lineSeparator())
                    .append("  ").append(key).append('=').append(config.getString(key))
                    .append(" (").append(config.sourceOf(key)).append(')');
        }
        log.info(sb.toString());
        DownloadSettings settings = DownloadSettings.from(config);
        log.info("universe={} output={}", settings.universePath, settings.outputRoot);
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (ReplayBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("replaybot.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(ReplayBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException | RuntimeException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private static int positiveInt(String name, String raw) {
        int value = parseInt(name, raw);
        if (value <= 0) {
            throw new IllegalArgumentException("--" + name + " must be > 0");
        }
        return value;
    }

    private static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw == null ? "" : raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer: " + raw, e);
        }
    }
}
