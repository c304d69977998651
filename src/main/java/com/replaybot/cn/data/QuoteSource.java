package com.replaybot.cn.data;

import com.replaybot.cn.model.ServerCandidate;

@FunctionalInterface
public interface QuoteSource {
    QuoteResult fetchPreClose(ServerCandidate server, String code);
}
