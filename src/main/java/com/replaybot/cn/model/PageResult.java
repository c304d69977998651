package com.replaybot.cn.model;

import java.util.List;

/**
 * One response of a paginated request. A broken or missing response is a
 * {@link Kind#TRANSIENT_FAILURE}, never an empty page; a zero-length page is {@link Kind#END_OF_DATA}.
 */
public final class PageResult {
    public enum Kind {
        PAGE,
        END_OF_DATA,
        TRANSIENT_FAILURE
    }

    public final Kind kind;
    public final List<TickRecord> records;
    public final String error;

    private PageResult(Kind kind, List<TickRecord> records, String error) {
        this.kind = kind;
        this.records = records == null ? List.of() : List.copyOf(records);
        this.error = error == null ? "" : error;
    }

    public static PageResult of(List<TickRecord> records) {
        if (records == null || records.isEmpty()) {
            return endOfData();
        }
        return new PageResult(Kind.PAGE, records, "");
    }

    public static PageResult endOfData() {
        return new PageResult(Kind.END_OF_DATA, List.of(), "");
    }

    public static PageResult transientFailure(String error) {
        String message = error == null || error.trim().isEmpty() ? "empty response" : error.trim();
        return new PageResult(Kind.TRANSIENT_FAILURE, List.of(), message);
    }

    public int size() {
        return records.size();
    }
}
