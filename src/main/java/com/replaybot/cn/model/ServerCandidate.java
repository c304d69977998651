package com.replaybot.cn.model;

import java.util.Locale;

public record ServerCandidate(String host, int port) {
    public ServerCandidate {
        host = host == null ? "" : host.trim();
        if (host.isEmpty()) {
            throw new IllegalArgumentException("server host is blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("server port out of range: " + port);
        }
    }

    /**
     * Parses {@code host:port}; a bare host gets {@code defaultPort}.
     */
    public static ServerCandidate parse(String raw, int defaultPort) {
        String text = raw == null ? "" : raw.trim();
        int idx = text.lastIndexOf(':');
        if (idx < 0) {
            return new ServerCandidate(text, defaultPort);
        }
        String host = text.substring(0, idx);
        String port = text.substring(idx + 1).trim();
        try {
            return new ServerCandidate(host, Integer.parseInt(port));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid server port in '" + raw + "'", e);
        }
    }

    public String label() {
        return String.format(Locale.ROOT, "%s:%d", host, port);
    }
}
