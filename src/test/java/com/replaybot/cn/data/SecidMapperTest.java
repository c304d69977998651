package com.replaybot.cn.data;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SecidMapperTest {

    @Test
    void secid_shouldMapShanghaiToNamespaceOne() {
        assertEquals("1.600000", SecidMapper.secid("600000"));
        assertEquals("1.688981", SecidMapper.secid("688981"));
    }

    @Test
    void secid_shouldMapShenzhenAndBeijingToNamespaceZero() {
        assertEquals("0.000001", SecidMapper.secid("000001"));
        assertEquals("0.300750", SecidMapper.secid("300750"));
        assertEquals("0.430047", SecidMapper.secid("430047"));
        assertEquals("0.830799", SecidMapper.secid("830799"));
    }

    @Test
    void namespaceOf_shouldDefaultToZeroForUnknownPrefix() {
        assertEquals(0, SecidMapper.namespaceOf("900901"));
        assertEquals(0, SecidMapper.namespaceOf(""));
        assertEquals(0, SecidMapper.namespaceOf(null));
    }
}
