package org.resultvault.server;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.resultvault.ingest.IngestionCoordinator;
import org.resultvault.obs.LogLevel;
import org.resultvault.suppress.SourceCodeCommentParser;

/**
 * Server settings, read from {@code --key=value} arguments.
 *
 * @param dataDirectory directory holding {@code state.json} and the blob store, or {@code null} to keep
 *     everything in memory
 * @param maxRuns maximum number of stored runs, {@code 0} for no limit
 */
public record ServerConfig(
        String host,
        int port,
        Path dataDirectory,
        int maxRuns,
        Duration runLockTimeout,
        Duration sessionTimeout,
        LogLevel logLevel,
        String suppressionPrefix) {
    public static final String DEFAULT_HOST = "127.0.0.1";

    public ServerConfig {
        host = host == null || host.isBlank() ? DEFAULT_HOST : host.trim();
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535: " + port);
        }
        if (maxRuns < 0) {
            throw new IllegalArgumentException("max runs must not be negative: " + maxRuns);
        }
        Objects.requireNonNull(runLockTimeout, "runLockTimeout");
        Objects.requireNonNull(sessionTimeout, "sessionTimeout");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(suppressionPrefix, "suppressionPrefix");
    }

    public static ServerConfig defaults() {
        return new ServerConfig(
                DEFAULT_HOST,
                0,
                null,
                0,
                IngestionCoordinator.Settings.DEFAULT.lockTimeout(),
                IngestionCoordinator.Settings.DEFAULT.sessionTimeout(),
                LogLevel.INFO,
                SourceCodeCommentParser.DEFAULT_PREFIX);
    }

    public IngestionCoordinator.Settings ingestionSettings() {
        return new IngestionCoordinator.Settings(runLockTimeout, sessionTimeout);
    }

    public static ServerConfig parse(final String... args) {
        final ServerConfig defaults = defaults();
        String host = defaults.host();
        int port = defaults.port();
        Path dataDirectory = null;
        int maxRuns = defaults.maxRuns();
        Duration runLockTimeout = defaults.runLockTimeout();
        Duration sessionTimeout = defaults.sessionTimeout();
        LogLevel logLevel = defaults.logLevel();
        String suppressionPrefix = defaults.suppressionPrefix();

        for (final String arg : args) {
            if (arg == null || arg.isBlank()) {
                continue;
            }
            if (arg.startsWith("--host=")) {
                host = requireValue(arg, "--host=");
                continue;
            }
            if (arg.startsWith("--port=")) {
                port = parseInt(requireValue(arg, "--port="), "--port");
                continue;
            }
            if (arg.startsWith("--data-dir=")) {
                dataDirectory = Path.of(requireValue(arg, "--data-dir="));
                continue;
            }
            if (arg.startsWith("--max-runs=")) {
                maxRuns = parseInt(requireValue(arg, "--max-runs="), "--max-runs");
                continue;
            }
            if (arg.startsWith("--run-lock-timeout-ms=")) {
                runLockTimeout = parseMillis(requireValue(arg, "--run-lock-timeout-ms="), "--run-lock-timeout-ms");
                continue;
            }
            if (arg.startsWith("--session-timeout-ms=")) {
                sessionTimeout = parseMillis(requireValue(arg, "--session-timeout-ms="), "--session-timeout-ms");
                continue;
            }
            if (arg.startsWith("--log-level=")) {
                logLevel = LogLevel.parse(requireValue(arg, "--log-level="));
                continue;
            }
            if (arg.startsWith("--suppression-prefix=")) {
                suppressionPrefix = requireValue(arg, "--suppression-prefix=");
                continue;
            }
            throw new IllegalArgumentException("unsupported argument: " + arg);
        }

        return new ServerConfig(
                host, port, dataDirectory, maxRuns, runLockTimeout, sessionTimeout, logLevel, suppressionPrefix);
    }

    private static String requireValue(final String arg, final String prefix) {
        final String value = arg.substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("argument value is empty for " + prefix);
        }
        return value;
    }

    private static int parseInt(final String value, final String name) {
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException numberFormatException) {
            throw new IllegalArgumentException("invalid " + name + ": " + value, numberFormatException);
        }
    }

    private static Duration parseMillis(final String value, final String name) {
        final long millis;
        try {
            millis = Long.parseLong(value);
        } catch (final NumberFormatException numberFormatException) {
            throw new IllegalArgumentException("invalid " + name + ": " + value, numberFormatException);
        }
        if (millis < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return Duration.ofMillis(millis);
    }
}
