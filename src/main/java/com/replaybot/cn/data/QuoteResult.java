package com.replaybot.cn.data;

/**
 * 单次昨收价查询结果：成功、无效值（占位符/字段缺失）或请求错误。
 */
public final class QuoteResult {
    public enum Kind {
        OK,
        INVALID,
        ERROR
    }

    public final Kind kind;
    public final double value;
    public final String error;

    private QuoteResult(Kind kind, double value, String error) {
        this.kind = kind;
        this.value = value;
        this.error = error == null ? "" : error;
    }

    public static QuoteResult ok(double value) {
        return new QuoteResult(Kind.OK, value, "");
    }

    public static QuoteResult invalid(String error) {
        return new QuoteResult(Kind.INVALID, Double.NaN, error);
    }

    public static QuoteResult error(String error) {
        return new QuoteResult(Kind.ERROR, Double.NaN, error);
    }

    public boolean ok() {
        return kind == Kind.OK;
    }
}
