package com.replaybot.cn.model;

import java.util.List;

/**
 * Immutable snapshot of the servers a run may use, taken once after probing.
 * A degraded pool carries the unfiltered configured list because no candidate answered the probe.
 */
public final class ServerPool {
    private final List<ServerCandidate> servers;
    private final boolean degraded;

    private ServerPool(List<ServerCandidate> servers, boolean degraded) {
        this.servers = servers == null ? List.of() : List.copyOf(servers);
        this.degraded = degraded;
    }

    public static ServerPool healthy(List<ServerCandidate> servers) {
        return new ServerPool(servers, false);
    }

    public static ServerPool degraded(List<ServerCandidate> configured) {
        return new ServerPool(configured, true);
    }

    public List<ServerCandidate> servers() {
        return servers;
    }

    /**
     * First {@code retryCount} servers in pool order; one attempt walks them sequentially.
     */
    public List<ServerCandidate> candidates(int retryCount) {
        int limit = Math.max(1, retryCount);
        if (servers.size() <= limit) {
            return servers;
        }
        return servers.subList(0, limit);
    }

    public boolean degraded() {
        return degraded;
    }

    public int size() {
        return servers.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (ServerCandidate server : servers) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(server.label());
        }
        return (degraded ? "degraded[" : "healthy[") + sb + "]";
    }
}
