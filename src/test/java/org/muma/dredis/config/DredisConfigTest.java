package org.muma.dredis.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DredisConfigTest {

    @Test
    void testDefaults() {
        DredisConfig config = new DredisConfig();
        config.loadConfig("does-not-exist.properties");

        assertEquals("0.0.0.0", config.getHost());
        assertEquals(7379, config.getPort());
        assertEquals(0, config.getWorkerThreads());
        assertEquals(10, config.getSlowLogMillis());
    }

    @Test
    void testLoadFromClasspath() {
        DredisConfig config = new DredisConfig();
        config.loadConfig("dredis-test.properties");

        assertEquals("127.0.0.1", config.getHost());
        assertEquals(7380, config.getPort());
        assertEquals(4, config.getWorkerThreads());
        // 非法值保留默认
        assertEquals(10, config.getSlowLogMillis());
    }

    @Test
    void testPrecedence() {
        DredisConfig config = new DredisConfig();
        config.loadConfig("dredis-test.properties");

        config.applyEnvOverrides(Map.of("DREDIS_PORT", "9000", "DREDIS_HOST", "10.0.0.1"));
        assertEquals(9000, config.getPort());
        assertEquals("10.0.0.1", config.getHost());

        config.parseArgs(new String[]{"--config", "x.properties", "--port", "9100", "--workers", "2"});
        assertEquals(9100, config.getPort());
        assertEquals(2, config.getWorkerThreads());
        assertEquals("10.0.0.1", config.getHost());
    }

    @Test
    void testInvalidPortArgumentKeepsPreviousValue() {
        DredisConfig config = new DredisConfig();
        config.parseArgs(new String[]{"--port", "abc"});
        assertEquals(7379, config.getPort());
    }
}
