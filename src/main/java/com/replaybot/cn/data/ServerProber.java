package com.replaybot.cn.data;

import com.replaybot.cn.model.ServerCandidate;
import com.replaybot.cn.model.ServerPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 运行开始前逐个探测候选服务器，保留配置顺序。全部失败时退化为原始列表继续运行，并大声告警。
 */
public final class ServerProber {
    private static final Logger LOG = LogManager.getLogger(ServerProber.class);

    private final EndpointProbe probe;

    public ServerProber(EndpointProbe probe) {
        if (probe == null) {
            throw new IllegalArgumentException("probe is required");
        }
        this.probe = probe;
    }

    public ServerPool probe(List<ServerCandidate> configured) {
        if (configured == null || configured.isEmpty()) {
            throw new IllegalStateException("no servers configured");
        }
        List<ServerCandidate> healthy = new ArrayList<>();
        for (ServerCandidate server : configured) {
            try {
                if (probe.probe(server)) {
                    healthy.add(server);
                    LOG.info("server {} ok", server.label());
                } else {
                    LOG.warn("server {} connected but gave no response", server.label());
                }
            } catch (IOException e) {
                LOG.warn("server {} unreachable: {}", server.label(), e.getMessage());
            } catch (RuntimeException e) {
                LOG.warn("server {} probe error: {}", server.label(), e.toString());
            }
        }
        if (healthy.isEmpty()) {
            LOG.error("ALL {} configured servers failed the probe; continuing with the unfiltered list, expect failures",
                    configured.size());
            return ServerPool.degraded(configured);
        }
        LOG.info("server probe: {}/{} healthy", healthy.size(), configured.size());
        return ServerPool.healthy(healthy);
    }
}
