package com.replaybot.cn.data;

import com.replaybot.cn.model.ServerCandidate;

import java.io.IOException;

@FunctionalInterface
public interface EndpointProbe {

    /**
     * @return true when the server answered a minimal request; false when it connected but gave no usable answer
     * @throws IOException when the server is unreachable
     */
    boolean probe(ServerCandidate server) throws IOException;
}
