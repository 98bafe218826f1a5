package org.muma.respkv.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ServerConfigTest {

    private static final String[] NO_ARGS = new String[0];

    @Test
    void testDefaults() {
        ServerConfig config = ServerConfig.load(new String[]{"--config", "does-not-exist.properties"}, Map.of());

        assertEquals(6379, config.getPort());
        assertEquals("0.0.0.0", config.getBindAddress());
        assertEquals(0, config.getWorkerThreads());
        assertEquals(511, config.getBacklog());
        assertEquals(100, config.getSweepIntervalMs());
        assertEquals(1024, config.getLockStripes());
    }

    @Test
    void testLoadFromClasspathFile() {
        ServerConfig config = ServerConfig.load(new String[]{"--config", "config-test.properties"}, Map.of());

        assertEquals(7001, config.getPort());
        assertEquals("127.0.0.1", config.getBindAddress());
        assertEquals(2, config.getWorkerThreads());
        assertEquals(250, config.getSweepIntervalMs());
        // 非法数值保留默认值
        assertEquals(1024, config.getLockStripes());
    }

    @Test
    void testEnvOverridesFile() {
        ServerConfig config = ServerConfig.load(new String[]{"--config", "config-test.properties"},
                Map.of("KV_PORT", "7100", "KV_BIND", "localhost", "KV_SWEEP_INTERVAL_MS", "0"));

        assertEquals(7100, config.getPort());
        assertEquals("localhost", config.getBindAddress());
        assertEquals(0, config.getSweepIntervalMs());
    }

    @Test
    void testArgsOverrideEnv() {
        ServerConfig config = ServerConfig.load(
                new String[]{"--config", "config-test.properties", "--port", "7200", "--sweep-interval", "50"},
                Map.of("KV_PORT", "7100"));

        assertEquals(7200, config.getPort());
        assertEquals(50, config.getSweepIntervalMs());
    }

    @Test
    void testInvalidValuesAreIgnored() {
        ServerConfig config = new ServerConfig();
        config.applyEnvOverrides(Map.of("KV_PORT", "abc"));
        config.parseArgs(new String[]{"--worker-threads", "x", "--unknown", "1", "--port"});

        assertEquals(6379, config.getPort());
        assertEquals(0, config.getWorkerThreads());

        config.parseArgs(NO_ARGS);
        assertEquals(6379, config.getPort());
    }
}
