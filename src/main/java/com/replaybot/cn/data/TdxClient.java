package com.replaybot.cn.data;

import com.replaybot.cn.config.DownloadSettings;
import com.replaybot.cn.model.ServerCandidate;

import java.io.IOException;

/**
 * 通达信分笔数据源：每次抓取打开独立会话；探活时以短超时连接并查询深圳市场证券数量。
 */
public final class TdxClient implements TickSource, EndpointProbe {
    private static final int PROBE_MARKET = 0;

    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final int probeTimeoutMs;

    public TdxClient(DownloadSettings settings) {
        this(
                (int) settings.tdxConnectTimeout.toMillis(),
                (int) settings.readTimeout.toMillis(),
                (int) settings.tdxProbeTimeout.toMillis()
        );
    }

    public TdxClient(int connectTimeoutMs, int readTimeoutMs, int probeTimeoutMs) {
        this.connectTimeoutMs = Math.max(1, connectTimeoutMs);
        this.readTimeoutMs = Math.max(1, readTimeoutMs);
        this.probeTimeoutMs = Math.max(1, probeTimeoutMs);
    }

    @Override
    public TickSession open(ServerCandidate server) throws IOException {
        return TdxSession.connect(server, connectTimeoutMs, readTimeoutMs);
    }

    @Override
    public boolean probe(ServerCandidate server) throws IOException {
        try (TdxSession session = TdxSession.connect(server, probeTimeoutMs, probeTimeoutMs)) {
            return session.securityCount(PROBE_MARKET) > 0;
        }
    }
}
