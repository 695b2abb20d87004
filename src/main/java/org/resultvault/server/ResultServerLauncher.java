package org.resultvault.server;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import org.resultvault.obs.JsonLinesLogger;
import org.resultvault.obs.StructuredJsonLinesLogger;

/**
 * Command-line entry point.
 *
 * <p>Ready signal is a single stdout line: {@code RESULTVAULT_URI=<mongodb-uri>}. Startup failures print
 * {@code RESULTVAULT_START_FAILURE=<message>} on stderr and exit with status 1. Log events go to stderr.
 */
public final class ResultServerLauncher {
    static final String READY_PREFIX = "RESULTVAULT_URI=";
    static final String FAILURE_PREFIX = "RESULTVAULT_START_FAILURE=";

    private ResultServerLauncher() {}

    public static void main(final String[] args) {
        final CountDownLatch stopLatch = new CountDownLatch(1);
        final ResultServer server;
        try {
            server = start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                try {
                    server.close();
                } finally {
                    stopLatch.countDown();
                }
            }, "resultvault-shutdown"));
        } catch (final RuntimeException exception) {
            System.err.println(FAILURE_PREFIX + exception.getMessage());
            exception.printStackTrace(System.err);
            System.exit(1);
            return;
        }

        System.out.println(READY_PREFIX + server.connectionString());
        System.out.flush();

        try {
            stopLatch.await();
        } catch (final InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    static ResultServer start(final String... args) {
        final ServerConfig config = ServerConfig.parse(args);
        final JsonLinesLogger logger =
                new StructuredJsonLinesLogger(System.err, Clock.systemUTC(), true, config.logLevel());
        final ResultServer server = ResultServer.create(config, logger);
        server.start();
        return server;
    }
}
