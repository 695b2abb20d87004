package org.resultvault.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriter;
import org.bson.json.JsonWriterSettings;

/**
 * Writes one relaxed-JSON object per line, keys sorted.
 *
 * <p>Every event carries {@code timestamp}, {@code level}, {@code message} and the correlation fields. Custom
 * fields with one of those names are dropped. Events below the threshold are discarded before encoding.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private static final JsonWriterSettings JSON_SETTINGS =
            JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

    private final Writer out;
    private final Clock clock;
    private final boolean flushEachEvent;
    private final LogLevel threshold;
    private boolean closed;

    public StructuredJsonLinesLogger(final OutputStream outputStream) {
        this(outputStream, Clock.systemUTC(), true, LogLevel.INFO);
    }

    public StructuredJsonLinesLogger(
            final OutputStream outputStream, final Clock clock, final boolean autoFlush, final LogLevel threshold) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, autoFlush, threshold);
    }

    public StructuredJsonLinesLogger(
            final Writer writer, final Clock clock, final boolean autoFlush, final LogLevel threshold) {
        this.out = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.flushEachEvent = autoFlush;
    }

    @Override
    public synchronized void log(
            final LogLevel level,
            final String message,
            final CorrelationContext correlationContext,
            final Map<String, ?> fields) {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
        final LogLevel eventLevel = level == null ? LogLevel.INFO : level;
        if (!threshold.enables(eventLevel)) {
            return;
        }
        Objects.requireNonNull(correlationContext, "correlationContext");

        final Map<String, Object> event = new TreeMap<>();
        if (fields != null) {
            fields.forEach((key, value) -> {
                if (key != null && !key.isBlank()) {
                    event.put(key, value);
                }
            });
        }
        event.put("timestamp", clock.instant().toString());
        event.put("level", eventLevel.name());
        event.put("message", message == null ? "" : message);
        correlationContext.appendTo(event);

        try {
            out.write(encode(event));
            out.write('\n');
            if (flushEachEvent) {
                out.flush();
            }
        } catch (final IOException writeFailure) {
            throw new UncheckedIOException("failed to write log event", writeFailure);
        }
    }

    public LogLevel threshold() {
        return threshold;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.close();
        } catch (final IOException closeFailure) {
            throw new UncheckedIOException("failed to close log writer", closeFailure);
        }
    }

    static String encode(final Map<String, ?> event) {
        final StringWriter buffer = new StringWriter();
        final JsonWriter json = new JsonWriter(buffer, JSON_SETTINGS);
        writeDocument(json, event);
        json.flush();
        return buffer.toString();
    }

    private static void writeDocument(final JsonWriter json, final Map<?, ?> document) {
        final Map<String, Object> sorted = new TreeMap<>();
        document.forEach((key, value) -> sorted.put(String.valueOf(key), value));
        json.writeStartDocument();
        for (final Map.Entry<String, Object> entry : sorted.entrySet()) {
            json.writeName(entry.getKey());
            writeValue(json, entry.getValue());
        }
        json.writeEndDocument();
    }

    private static void writeValue(final JsonWriter json, final Object value) {
        if (value == null) {
            json.writeNull();
        } else if (value instanceof Boolean flag) {
            json.writeBoolean(flag);
        } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            json.writeInt32(((Number) value).intValue());
        } else if (value instanceof Long number) {
            json.writeInt64(number);
        } else if (value instanceof Number number) {
            json.writeDouble(number.doubleValue());
        } else if (value instanceof Map<?, ?> map) {
            writeDocument(json, map);
        } else if (value instanceof Iterable<?> items) {
            json.writeStartArray();
            for (final Object item : items) {
                writeValue(json, item);
            }
            json.writeEndArray();
        } else {
            json.writeString(String.valueOf(value));
        }
    }
}
