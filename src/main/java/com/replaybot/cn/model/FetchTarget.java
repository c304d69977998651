package com.replaybot.cn.model;

import java.util.Objects;

/**
 * 单只证券的抓取目标：6 位代码、名称、交易所标签以及通达信市场代码
 * （深圳=0，上海=1，北交所=2）。一次运行内不可变。
 */
public final class FetchTarget {
    public final String code;
    public final String name;
    public final String exchange;
    public final int market;

    public FetchTarget(String code, String name, String exchange, int market) {
        this.code = code == null ? "" : code.trim();
        this.name = name == null ? "" : name.trim();
        this.exchange = exchange == null ? "" : exchange.trim();
        this.market = market;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FetchTarget)) {
            return false;
        }
        FetchTarget that = (FetchTarget) other;
        return market == that.market && code.equals(that.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, market);
    }

    @Override
    public String toString() {
        return code + "(" + name + ")";
    }
}
