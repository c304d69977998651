package com.replaybot.cn.data;

import com.replaybot.cn.model.ServerCandidate;

import java.io.IOException;

/**
 * Opens a fresh session against one server. Sessions are never shared between attempts.
 */
@FunctionalInterface
public interface TickSource {
    TickSession open(ServerCandidate server) throws IOException;
}
