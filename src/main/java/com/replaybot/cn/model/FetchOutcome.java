package com.replaybot.cn.model;

/**
 * 单只证券在一轮中的最终结果。工作线程只返回该不可变对象，由汇总方统一计数。
 */
public final class FetchOutcome {
    public enum Status {
        SUCCESS,
        NO_DATA,
        FAILED
    }

    public final FetchTarget target;
    public final Status status;
    public final int recordCount;
    public final boolean resumed;
    public final FailureKind failureKind;
    public final String reason;
    public final int serverTries;

    private FetchOutcome(
            FetchTarget target,
            Status status,
            int recordCount,
            boolean resumed,
            FailureKind failureKind,
            String reason,
            int serverTries
    ) {
        if (target == null) {
            throw new IllegalArgumentException("outcome target is required");
        }
        this.target = target;
        this.status = status == null ? Status.FAILED : status;
        this.recordCount = Math.max(0, recordCount);
        this.resumed = resumed;
        this.failureKind = failureKind == null ? FailureKind.NONE : failureKind;
        this.reason = reason == null ? "" : reason;
        this.serverTries = Math.max(0, serverTries);
    }

    public static FetchOutcome success(FetchTarget target, int recordCount, int serverTries) {
        return new FetchOutcome(target, Status.SUCCESS, recordCount, false, FailureKind.NONE, "", serverTries);
    }

    public static FetchOutcome resumed(FetchTarget target) {
        return new FetchOutcome(target, Status.SUCCESS, 0, true, FailureKind.NONE, "artifact exists, skipped", 0);
    }

    public static FetchOutcome noData(FetchTarget target, String reason, int serverTries) {
        return new FetchOutcome(target, Status.NO_DATA, 0, false, FailureKind.NONE, reason, serverTries);
    }

    public static FetchOutcome failed(FetchTarget target, FailureKind kind, String reason, int serverTries) {
        FailureKind normalized = kind == null || kind == FailureKind.NONE ? FailureKind.OTHER : kind;
        String message = reason == null || reason.trim().isEmpty() ? normalized.label() : reason.trim();
        return new FetchOutcome(target, Status.FAILED, 0, false, normalized, message, serverTries);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isNoData() {
        return status == Status.NO_DATA;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    @Override
    public String toString() {
        switch (status) {
            case SUCCESS:
                return target.code + " SUCCESS(" + (resumed ? "resumed" : recordCount) + ")";
            case NO_DATA:
                return target.code + " NO_DATA";
            default:
                return target.code + " FAILED[" + failureKind.label() + "](" + reason + ")";
        }
    }
}
