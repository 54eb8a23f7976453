package com.llmbridge.api.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProxyRelayConfigTest {

    @Test
    void originsAreSplitAndTrimmed() {
        assertEquals(List.of("https://a.example", "https://b.example"),
            ProxyRelayConfig.parseOrigins(" https://a.example , https://b.example,"));
    }

    @Test
    void emptyOriginListFallsBackToWildcard() {
        assertEquals(List.of("*"), ProxyRelayConfig.parseOrigins(" , "));
    }
}
