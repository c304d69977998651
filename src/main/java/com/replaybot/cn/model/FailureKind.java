package com.replaybot.cn.model;

public enum FailureKind {
    NONE("none"),
    CONNECTIVITY("connectivity"),
    PROTOCOL("protocol"),
    VALIDATION("validation"),
    DEADLINE("deadline"),
    STORAGE("storage"),
    CANCELLED("cancelled"),
    OTHER("other");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
