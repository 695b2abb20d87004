package org.resultvault.obs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class StructuredJsonLinesLoggerSmokeTest {
    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void emitsCorrelationAndCustomFieldsAsJsonLines() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, FIXED_CLOCK, true, LogLevel.INFO);

        CorrelationContext context = CorrelationContext.of("req-1", "finalizeingestion")
            .withConnection("3")
            .withRun("app")
            .withSession("session-42");
        logger.info("ingestion.commit", context, Map.of("generation", 4L, "transitions", Map.of("new", 2)));

        logger.info("health check", CorrelationContext.of("req-2", "ping"));
        logger.close();

        String[] lines = output.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(2, lines.length);

        Document first = Document.parse(lines[0]);
        assertEquals("2026-03-01T12:00:00Z", first.getString("timestamp"));
        assertEquals("INFO", first.getString("level"));
        assertEquals("ingestion.commit", first.getString("message"));
        assertEquals("req-1", first.getString("requestId"));
        assertEquals("finalizeingestion", first.getString("commandName"));
        assertEquals("3", first.getString("connectionId"));
        assertEquals("app", first.getString("runName"));
        assertEquals("session-42", first.getString("sessionId"));
        assertEquals(4, ((Number) first.get("generation")).intValue());
        assertEquals(2, ((Number) first.get("transitions", Document.class).get("new")).intValue());

        Document second = Document.parse(lines[1]);
        assertEquals("health check", second.getString("message"));
        assertEquals("ping", second.getString("commandName"));
        assertNull(second.get("runName"));
        assertNull(second.get("sessionId"));
        assertFalse(second.containsKey("generation"));
    }

    @Test
    void dropsEventsBelowThresholdAndKeepsStandardFields() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, FIXED_CLOCK, true, LogLevel.WARN);

        CorrelationContext context = CorrelationContext.of("req-1", "submitresults");
        logger.debug("ingestion.buffered", context, Map.of());
        logger.info("command.start", context);
        logger.warn("ingestion.incomplete", context, Map.of("level", "overridden", "missing", List.of("p2")));
        logger.close();

        String[] lines = output.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(1, lines.length);
        Document event = Document.parse(lines[0]);
        assertEquals("WARN", event.getString("level"));
        assertEquals("ingestion.incomplete", event.getString("message"));
        assertEquals(List.of("p2"), event.getList("missing", String.class));
    }

    @Test
    void escapesControlCharactersAndRejectsUseAfterClose() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, FIXED_CLOCK, true, LogLevel.DEBUG);

        logger.error("blob.write_failed", CorrelationContext.of("req-1", "submitresults"),
            Map.of("error", "line one\nline \"two\"\t\u0001"));
        logger.close();

        String[] lines = output.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(1, lines.length);
        assertEquals("line one\nline \"two\"\t\u0001", Document.parse(lines[0]).getString("error"));
        assertThrows(IllegalStateException.class, () -> logger.info("late", CorrelationContext.of("req-2", "ping")));
    }

    @Test
    void parsesLevelNames() {
        assertEquals(LogLevel.WARN, LogLevel.parse("warning"));
        assertEquals(LogLevel.DEBUG, LogLevel.parse(" debug "));
        assertEquals(LogLevel.INFO, LogLevel.parse(null));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.parse("verbose"));
    }
}
