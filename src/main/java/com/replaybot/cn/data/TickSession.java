package com.replaybot.cn.data;

import com.replaybot.cn.model.PageResult;

import java.io.IOException;

public interface TickSession extends AutoCloseable {

    int securityCount(int market) throws IOException;

    /**
     * Requests one page of historical transactions. I/O or decoding problems come back as
     * {@link PageResult.Kind#TRANSIENT_FAILURE}, never as an empty page.
     */
    PageResult fetchPage(int market, String code, int offset, int count, int date);

    @Override
    void close();
}
