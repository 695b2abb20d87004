package org.resultvault.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.mongodb.MongoCommandException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.bson.BsonBinaryWriter;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.RawBsonDocument;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.resultvault.obs.JsonLinesLogger;

final class ResultServerTest {
    private static final String SOURCE = "int divide(int a, int b) {\n    return a / b;\n}\n";

    @Test
    void supportsMongoClientPingAndIngestionThroughTcpUri() {
        try (ResultServer server = ResultServer.inMemory()) {
            server.start();
            assertEquals("mongodb://" + server.host() + ":" + server.port(), server.connectionString());

            try (MongoClient client = MongoClients.create(server.connectionString())) {
                final MongoDatabase admin = client.getDatabase("admin");
                assertEquals(1.0, admin.runCommand(new Document("ping", 1)).get("ok", Number.class).doubleValue());

                final String sessionId = admin.runCommand(new Document("openIngestion", "app").append("tag", "v1"))
                        .getString("sessionId");
                final Document receipt = admin.runCommand(new Document("submitResults", sessionId)
                        .append("submissionId", "producer-1")
                        .append("findings", List.of(new Document("checkerId", "core.DivideZero")
                                .append("file", "src/math.cpp")
                                .append("line", 2)
                                .append("column", 14)
                                .append("severity", "high")
                                .append("message", "Division by zero")))
                        .append("sources", List.of(new Document("path", "src/math.cpp").append("content", SOURCE))));
                assertEquals(1, receipt.getInteger("staged"));

                final Document committed = admin.runCommand(new Document("finalizeIngestion", sessionId));
                assertEquals(1L, committed.getLong("generation"));
                assertEquals(1, committed.getInteger("reportCount"));

                final Document listed = admin.runCommand(new Document("listReports", "app"));
                assertEquals(1, listed.getInteger("count"));
                final Document report = listed.getList("reports", Document.class).get(0);
                assertEquals("core.DivideZero", report.getString("checkerId"));
                assertEquals("new", report.getString("detectionStatus"));
            }
        }
    }

    @Test
    void commandErrorsReachDriverAsCommandExceptions() {
        try (ResultServer server = ResultServer.inMemory()) {
            server.start();

            try (MongoClient client = MongoClients.create(server.connectionString())) {
                final MongoCommandException missing = assertThrows(
                        MongoCommandException.class,
                        () -> client.getDatabase("admin").runCommand(new Document("getRun", "absent")));
                assertEquals(26, missing.getErrorCode());
                assertEquals("NoSuchRun", missing.getErrorCodeName());
            }
        }
    }

    @Test
    void durableServerKeepsRunsAcrossRestart(@TempDir Path dataDirectory) {
        final ServerConfig config = ServerConfig.parse("--data-dir=" + dataDirectory);
        try (ResultServer server = ResultServer.create(config, JsonLinesLogger.noop())) {
            server.start();
            try (MongoClient client = MongoClients.create(server.connectionString())) {
                final MongoDatabase admin = client.getDatabase("admin");
                final String sessionId =
                        admin.runCommand(new Document("openIngestion", "nightly")).getString("sessionId");
                admin.runCommand(new Document("finalizeIngestion", sessionId));
            }
        }

        try (ResultServer server = ResultServer.create(config, JsonLinesLogger.noop())) {
            server.start();
            try (MongoClient client = MongoClients.create(server.connectionString())) {
                final Document run = client.getDatabase("admin").runCommand(new Document("getRun", "nightly"))
                        .get("run", Document.class);
                assertEquals("nightly", run.getString("name"));
                assertEquals(1L, run.getLong("generation"));
            }
        }
    }

    @Test
    void supportsLegacyOpQueryCommandPath() throws IOException {
        try (ResultServer server = ResultServer.inMemory()) {
            server.start();

            try (Socket socket = new Socket(server.host(), server.port());
                    BufferedOutputStream output = new BufferedOutputStream(socket.getOutputStream());
                    BufferedInputStream input = new BufferedInputStream(socket.getInputStream())) {
                output.write(encodeOpQueryCommand(42, "admin.$cmd", BsonDocument.parse("{\"isMaster\": 1}")));
                output.flush();

                final byte[] response = readMessage(input);
                assertNotNull(response);
                assertEquals(1, readIntLE(response, 12)); // OP_REPLY
                assertEquals(42, readIntLE(response, 8));
                final BsonDocument responseDoc = new RawBsonDocument(response, 36, response.length - 36);
                assertEquals(1.0, responseDoc.getNumber("ok").doubleValue(), 0.0);
                assertTrue(responseDoc.getBoolean("ismaster").getValue());
                assertEquals(48_000_000, responseDoc.getInt32("maxMessageSizeBytes").getValue());
            }
        }
    }

    @Test
    void launcherStartsServerFromArguments() {
        try (ResultServer server = ResultServerLauncher.start("--port=0", "--log-level=warn")) {
            assertTrue(server.isRunning());
            assertTrue(server.port() > 0);
        }
        assertThrows(IllegalArgumentException.class, () -> ResultServerLauncher.start("--bogus"));
    }

    private static byte[] encodeOpQueryCommand(
            final int requestId, final String namespace, final BsonDocument command) {
        final byte[] namespaceBytes = namespace.getBytes(StandardCharsets.UTF_8);
        final byte[] commandBytes = encodeBson(command);
        final int messageLength = 16 + 4 + namespaceBytes.length + 1 + 4 + 4 + commandBytes.length;

        return ByteBuffer.allocate(messageLength)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt(messageLength)
                .putInt(requestId)
                .putInt(0)
                .putInt(2004)
                .putInt(0)
                .put(namespaceBytes)
                .put((byte) 0)
                .putInt(0)
                .putInt(-1)
                .put(commandBytes)
                .array();
    }

    private static byte[] encodeBson(final BsonDocument document) {
        final BasicOutputBuffer outputBuffer = new BasicOutputBuffer();
        try (BsonBinaryWriter writer = new BsonBinaryWriter(outputBuffer)) {
            new BsonDocumentCodec()
                    .encode(writer, document, EncoderContext.builder().isEncodingCollectibleDocument(true).build());
            return outputBuffer.toByteArray();
        }
    }

    private static byte[] readMessage(final InputStream input) throws IOException {
        final byte[] header = input.readNBytes(4);
        if (header.length < 4) {
            return null;
        }
        final int length = readIntLE(header, 0);
        final byte[] message = new byte[length];
        System.arraycopy(header, 0, message, 0, 4);
        final int read = input.readNBytes(message, 4, length - 4);
        return read == length - 4 ? message : null;
    }

    private static int readIntLE(final byte[] bytes, final int offset) {
        return ByteBuffer.wrap(bytes, offset, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
    }
}
