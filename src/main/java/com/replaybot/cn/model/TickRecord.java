package com.replaybot.cn.model;

/**
 * 一笔历史分时成交。
 */
public final class TickRecord {
    public final String time;
    public final double price;
    public final long vol;
    public final int buyOrSell;

    public TickRecord(String time, double price, long vol, int buyOrSell) {
        this.time = time == null ? "" : time;
        this.price = price;
        this.vol = vol;
        this.buyOrSell = buyOrSell;
    }
}
