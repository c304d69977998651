package com.replaybot.cn.model;

import java.util.Locale;

public enum DownloadMode {
    TICK("tick", "tick"),
    PRE_CLOSE("pre-close", "pre_close");

    private final String label;
    private final String dirPrefix;

    DownloadMode(String label, String dirPrefix) {
        this.label = label;
        this.dirPrefix = dirPrefix;
    }

    public String label() {
        return label;
    }

    public String dirPrefix() {
        return dirPrefix;
    }

    public static DownloadMode fromLabel(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (DownloadMode mode : values()) {
            if (mode.label.equals(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown download mode: " + raw + " (expected tick or pre-close)");
    }
}
