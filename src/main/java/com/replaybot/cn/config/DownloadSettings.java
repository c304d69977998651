package com.replaybot.cn.config;

import com.replaybot.cn.model.DownloadMode;
import com.replaybot.cn.model.ServerCandidate;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Typed, clamped view of the {@code download.*}, {@code tdx.*} and {@code eastmoney.*} keys.
 */
public final class DownloadSettings {
    public static final int TDX_DEFAULT_PORT = 7709;
    public static final int HTTP_DEFAULT_PORT = 80;

    public final DownloadMode mode;
    public final Path universePath;
    public final Path outputRoot;
    public final int maxWorkers;
    public final int floorWorkers;
    public final int maxRetry;
    public final int retryCount;
    public final int batchSize;
    public final Duration readTimeout;
    public final Duration attemptDeadline;
    public final long retryPauseMs;
    public final double noDataThreshold;
    public final int progressLogEvery;
    public final int inlineFailureLimit;
    public final int diagnosticSamples;
    public final boolean preCloseFromTickDir;
    public final List<ServerCandidate> tdxServers;
    public final Duration tdxProbeTimeout;
    public final Duration tdxConnectTimeout;
    public final List<ServerCandidate> eastmoneyServers;

    private DownloadSettings(Config config) {
        this.mode = DownloadMode.fromLabel(config.getString("download.mode", "tick"));
        this.universePath = config.getPath("download.universe_path");
        this.outputRoot = config.getPath("download.output_dir");
        this.maxWorkers = Math.max(1, config.getInt("download.max_workers", 15));
        this.floorWorkers = Math.max(1, config.getInt("download.floor_workers", 5));
        this.maxRetry = Math.max(0, config.getInt("download.max_retry", 3));
        this.retryCount = Math.max(1, config.getInt("download.retry_count", 3));
        this.batchSize = Math.max(1, config.getInt("download.batch_size", 2000));
        this.readTimeout = Duration.ofSeconds(Math.max(1, config.getInt("download.timeout_sec", 30)));
        this.attemptDeadline = Duration.ofSeconds(Math.max(1, config.getInt("download.attempt_deadline_sec", 120)));
        this.retryPauseMs = Math.max(0L, config.getLong("download.retry_pause_ms", 1000L));
        double threshold = config.getDouble("download.no_data_threshold", 0.9);
        this.noDataThreshold = threshold <= 0.0 || threshold > 1.0 ? 0.9 : threshold;
        this.progressLogEvery = Math.max(0, config.getInt("download.progress.log_every", 200));
        this.inlineFailureLimit = Math.max(0, config.getInt("download.report.inline_failure_limit", 10));
        this.diagnosticSamples = Math.max(0, config.getInt("download.report.diagnostic_samples", 5));
        this.preCloseFromTickDir = config.getBoolean("download.pre_close.from_tick_dir", false);
        this.tdxServers = config.getServers("tdx.servers", TDX_DEFAULT_PORT);
        this.tdxProbeTimeout = Duration.ofSeconds(Math.max(1, config.getInt("tdx.probe_timeout_sec", 2)));
        this.tdxConnectTimeout = Duration.ofSeconds(Math.max(1, config.getInt("tdx.connect_timeout_sec", 5)));
        this.eastmoneyServers = config.getServers("eastmoney.servers", HTTP_DEFAULT_PORT);
    }

    public static DownloadSettings from(Config config) {
        return new DownloadSettings(config);
    }

    public List<ServerCandidate> serversFor(DownloadMode downloadMode) {
        return downloadMode == DownloadMode.PRE_CLOSE ? eastmoneyServers : tdxServers;
    }
}
