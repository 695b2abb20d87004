package org.resultvault.server;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.resultvault.ingest.IngestionCoordinator;
import org.resultvault.obs.CorrelationContext;
import org.resultvault.obs.JsonLinesLogger;
import org.resultvault.wire.MessageHeader;
import org.resultvault.wire.WireProtocolException;

/**
 * TCP front end speaking the MongoDB wire protocol.
 *
 * <p>One daemon thread accepts connections and one daemon thread serves each connection, request after request.
 * When a connection ends, every incomplete submission it started is discarded. A request that fails with an
 * unexpected runtime exception is logged at ERROR and closes its connection.
 */
public final class ResultServer implements AutoCloseable {
    static final int MAX_MESSAGE_SIZE_BYTES = 48_000_000;

    private final WireCommandIngress ingress;
    private final IngestionCoordinator coordinator;
    private final JsonLinesLogger logger;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong connectionIds = new AtomicLong();
    private final ServerSocket serverSocket;
    private final List<Socket> clientSockets = new CopyOnWriteArrayList<>();
    private final Thread acceptThread;
    private final String host;

    public ResultServer(
            final WireCommandIngress ingress,
            final IngestionCoordinator coordinator,
            final String host,
            final int port,
            final JsonLinesLogger logger) {
        this.ingress = Objects.requireNonNull(ingress, "ingress");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.host = host == null || host.isBlank() ? ServerConfig.DEFAULT_HOST : host.trim();
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535: " + port);
        }
        this.serverSocket = newServerSocket(this.host, port);
        this.acceptThread = new Thread(this::acceptLoop, "resultvault-accept");
        this.acceptThread.setDaemon(true);
    }

    public static ResultServer create(final ServerConfig config, final JsonLinesLogger logger) {
        final ResultVault vault = ResultVault.create(config, Clock.systemUTC(), logger);
        return new ResultServer(
                new WireCommandIngress(vault.dispatcher(), logger),
                vault.coordinator(),
                config.host(),
                config.port(),
                logger);
    }

    public static ResultServer inMemory() {
        return create(ServerConfig.defaults(), JsonLinesLogger.noop());
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            acceptThread.start();
            logger.info("server.start", CorrelationContext.of("startup", "start"), Map.of(
                    "host", host,
                    "port", port()));
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public String host() {
        return host;
    }

    public int port() {
        return serverSocket.getLocalPort();
    }

    public String connectionString() {
        return "mongodb://" + host + ":" + port();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            closeQuietly(serverSocket);
            return;
        }

        closeQuietly(serverSocket);
        for (final Socket socket : clientSockets) {
            closeQuietly(socket);
        }
        try {
            acceptThread.join(1000L);
        } catch (final InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        logger.info("server.stop", CorrelationContext.of("shutdown", "stop"), Map.of("port", port()));
    }

    private static ServerSocket newServerSocket(final String host, final int port) {
        try {
            return new ServerSocket(port, 50, InetAddress.getByName(host));
        } catch (final IOException ioException) {
            throw new IllegalStateException(
                    "failed to allocate TCP server socket host=" + host + " port=" + port, ioException);
        }
    }

    private void closeQuietly(final AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (final Exception failure) {
            logger.debug("server.close_failed", CorrelationContext.of("shutdown", "close"), Map.of(
                    "error", String.valueOf(failure.getMessage())));
        }
    }

    private void acceptLoop() {
        while (running.get()) {
            final Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (final IOException ioException) {
                if (running.get()) {
                    logger.error("server.accept_failed", CorrelationContext.of("accept", "accept"), Map.of(
                            "error", String.valueOf(ioException.getMessage())));
                }
                return;
            }

            final String connectionId = Long.toString(connectionIds.incrementAndGet());
            clientSockets.add(socket);
            final Thread worker = new Thread(
                    () -> handleClient(socket, connectionId),
                    "resultvault-connection-" + connectionId);
            worker.setDaemon(true);
            worker.start();
        }
    }

    private void handleClient(final Socket socket, final String connectionId) {
        final CorrelationContext correlation =
                CorrelationContext.of(connectionId, "connection").withConnection(connectionId);
        try (Socket client = socket;
                BufferedInputStream input = new BufferedInputStream(client.getInputStream());
                BufferedOutputStream output = new BufferedOutputStream(client.getOutputStream())) {
            client.setTcpNoDelay(true);

            while (running.get()) {
                final byte[] request = readMessage(input);
                if (request == null) {
                    break;
                }

                final byte[] response;
                try {
                    response = ingress.handle(request, connectionId);
                } catch (final RuntimeException failure) {
                    logger.error("connection.request_failed", correlation, Map.of(
                            "exception", failure.getClass().getName(),
                            "error", String.valueOf(failure.getMessage())));
                    break;
                }
                if (response != null) {
                    output.write(response);
                    output.flush();
                }
            }
        } catch (final IOException | WireProtocolException failure) {
            if (running.get()) {
                logger.warn("connection.io_failed", correlation, Map.of(
                        "error", String.valueOf(failure.getMessage())));
            }
        } finally {
            clientSockets.remove(socket);
            final int discarded = coordinator.discardConnection(connectionId);
            logger.debug("connection.closed", correlation, Map.of("discardedSubmissions", discarded));
        }
    }

    /**
     * @return the next complete message, or {@code null} when the peer closed the connection between or inside
     *     messages
     */
    private static byte[] readMessage(final InputStream input) throws IOException {
        final byte[] prefix = input.readNBytes(Integer.BYTES);
        if (prefix.length < Integer.BYTES) {
            return null;
        }
        final int messageLength = ByteBuffer.wrap(prefix).order(ByteOrder.LITTLE_ENDIAN).getInt();
        if (messageLength < MessageHeader.LENGTH || messageLength > MAX_MESSAGE_SIZE_BYTES) {
            throw new WireProtocolException("invalid message length: " + messageLength);
        }

        final byte[] message = Arrays.copyOf(prefix, messageLength);
        final int remaining = messageLength - Integer.BYTES;
        if (input.readNBytes(message, Integer.BYTES, remaining) < remaining) {
            return null;
        }
        return message;
    }
}
