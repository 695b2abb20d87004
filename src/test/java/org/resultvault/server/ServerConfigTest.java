package org.resultvault.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.resultvault.obs.LogLevel;

class ServerConfigTest {
    @Test
    void defaultsKeepEverythingInMemoryOnLoopback() {
        final ServerConfig config = ServerConfig.parse();

        assertEquals("127.0.0.1", config.host());
        assertEquals(0, config.port());
        assertNull(config.dataDirectory());
        assertEquals(0, config.maxRuns());
        assertEquals(Duration.ofSeconds(30), config.runLockTimeout());
        assertEquals(Duration.ofMinutes(30), config.sessionTimeout());
        assertEquals(LogLevel.INFO, config.logLevel());
        assertEquals("codechecker", config.suppressionPrefix());
    }

    @Test
    void parsesEveryOption() {
        final ServerConfig config = ServerConfig.parse(
                "--host=0.0.0.0",
                "--port=27018",
                "--data-dir=/var/lib/resultvault",
                "--max-runs=12",
                "--run-lock-timeout-ms=250",
                "--session-timeout-ms=60000",
                "--log-level=debug",
                "--suppression-prefix=lintguard",
                "");

        assertEquals("0.0.0.0", config.host());
        assertEquals(27018, config.port());
        assertEquals(Path.of("/var/lib/resultvault"), config.dataDirectory());
        assertEquals(12, config.maxRuns());
        assertEquals(Duration.ofMillis(250), config.ingestionSettings().lockTimeout());
        assertEquals(Duration.ofMinutes(1), config.ingestionSettings().sessionTimeout());
        assertEquals(LogLevel.DEBUG, config.logLevel());
        assertEquals("lintguard", config.suppressionPrefix());
    }

    @Test
    void rejectsUnknownAndMalformedArguments() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse("--verbose"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse("--port=abc"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse("--port=70000"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse("--max-runs=-1"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse("--run-lock-timeout-ms=-5"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse("--data-dir="));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse("--log-level=chatty"));
    }
}
