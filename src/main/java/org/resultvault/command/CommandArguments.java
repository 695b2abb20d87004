package org.resultvault.command;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;

/**
 * Typed readers for command fields. Wrong types raise {@link CommandArgumentException}, which maps to
 * {@code TypeMismatch}; bad values raise plain {@link IllegalArgumentException}.
 */
final class CommandArguments {
    private CommandArguments() {}

    static String commandValueText(final BsonDocument command) {
        final String name = command.getFirstKey();
        final BsonValue value = command.get(name);
        if (!value.isString()) {
            throw new CommandArgumentException(name + " must be a string");
        }
        final String text = value.asString().getValue().trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return text;
    }

    static String requireString(final BsonDocument document, final String field) {
        final String value = optionalString(document, field);
        if (value == null) {
            throw new CommandArgumentException(field + " must be a string");
        }
        return value;
    }

    static String optionalString(final BsonDocument document, final String field) {
        final BsonValue value = document.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isString()) {
            throw new CommandArgumentException(field + " must be a string");
        }
        return value.asString().getValue();
    }

    static Integer optionalInt(final BsonDocument document, final String field) {
        final BsonValue value = document.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isInt32()) {
            return value.asInt32().getValue();
        }
        if (value.isInt64() || value.isDouble()) {
            final double number = value.asNumber().doubleValue();
            if (number != Math.rint(number) || number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(field + " must be an integer");
            }
            return (int) number;
        }
        throw new CommandArgumentException(field + " must be an integer");
    }

    static int intOrDefault(final BsonDocument document, final String field, final int defaultValue) {
        final Integer value = optionalInt(document, field);
        return value == null ? defaultValue : value;
    }

    static boolean optionalBoolean(final BsonDocument document, final String field, final boolean defaultValue) {
        final BsonValue value = document.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new CommandArgumentException(field + " must be a boolean");
        }
        return value.asBoolean().getValue();
    }

    static BsonDocument optionalDocument(final BsonDocument document, final String field) {
        final BsonValue value = document.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isDocument()) {
            throw new CommandArgumentException(field + " must be a document");
        }
        return value.asDocument();
    }

    static List<BsonDocument> documentList(final BsonDocument document, final String field) {
        final BsonValue value = document.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new CommandArgumentException(field + " must be an array");
        }
        final List<BsonDocument> documents = new ArrayList<>();
        for (final BsonValue item : value.asArray()) {
            if (!item.isDocument()) {
                throw new CommandArgumentException(field + " entries must be documents");
            }
            documents.add(item.asDocument());
        }
        return documents;
    }

    /**
     * @return the strings of an array field, or {@code null} when the field is absent
     */
    static Set<String> optionalStringSet(final BsonDocument document, final String field) {
        final List<String> values = optionalStringList(document, field);
        return values == null ? null : new LinkedHashSet<>(values);
    }

    static List<String> optionalStringList(final BsonDocument document, final String field) {
        final BsonValue value = document.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            throw new CommandArgumentException(field + " must be an array of strings");
        }
        final BsonArray array = value.asArray();
        final List<String> values = new ArrayList<>(array.size());
        for (final BsonValue item : array) {
            if (!item.isString()) {
                throw new CommandArgumentException(field + " must be an array of strings");
            }
            values.add(item.asString().getValue());
        }
        return values;
    }

    static Map<String, String> stringMap(final BsonDocument document, final String field) {
        final BsonDocument map = optionalDocument(document, field);
        if (map == null) {
            return Map.of();
        }
        final Map<String, String> values = new LinkedHashMap<>();
        for (final Map.Entry<String, BsonValue> entry : map.entrySet()) {
            if (!entry.getValue().isString()) {
                throw new CommandArgumentException(field + "." + entry.getKey() + " must be a string");
            }
            values.put(entry.getKey(), entry.getValue().asString().getValue());
        }
        return values;
    }

    /**
     * Source content may be sent as a UTF-8 string or as binary data.
     */
    static byte[] content(final BsonDocument document, final String field) {
        final BsonValue value = document.get(field);
        if (value != null && value.isString()) {
            return value.asString().getValue().getBytes(StandardCharsets.UTF_8);
        }
        if (value != null && value.isBinary()) {
            return value.asBinary().getData();
        }
        throw new CommandArgumentException(field + " must be a string or binary data");
    }
}
