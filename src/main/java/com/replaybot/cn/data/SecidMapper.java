package com.replaybot.cn.data;

import java.util.Map;

/**
 * Maps a 6-digit A-share code to the Eastmoney {@code secid} namespace by its leading digit.
 * The table is fixed: 6 is Shanghai (1), 0/3 are Shenzhen (0), 4/8 are Beijing (0), anything else 0.
 */
public final class SecidMapper {
    private static final int DEFAULT_NAMESPACE = 0;
    private static final Map<Character, Integer> PREFIX_NAMESPACES = Map.of(
            '6', 1,
            '0', 0,
            '3', 0,
            '4', 0,
            '8', 0
    );

    private SecidMapper() {
    }

    public static int namespaceOf(String code) {
        String value = code == null ? "" : code.trim();
        if (value.isEmpty()) {
            return DEFAULT_NAMESPACE;
        }
        return PREFIX_NAMESPACES.getOrDefault(value.charAt(0), DEFAULT_NAMESPACE);
    }

    public static String secid(String code) {
        String value = code == null ? "" : code.trim();
        return namespaceOf(value) + "." + value;
    }
}
