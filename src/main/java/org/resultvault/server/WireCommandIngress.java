package org.resultvault.server;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.resultvault.command.CommandDispatcher;
import org.resultvault.obs.CorrelationContext;
import org.resultvault.obs.JsonLinesLogger;
import org.resultvault.wire.MessageHeader;
import org.resultvault.wire.OpMsg;
import org.resultvault.wire.OpMsgCodec;
import org.resultvault.wire.OpQuery;
import org.resultvault.wire.OpQueryCodec;
import org.resultvault.wire.WireProtocolException;

/**
 * Turns one wire request into one wire reply: decode, dispatch, encode, with {@code command.start} and
 * {@code command.complete} log events around the dispatch.
 */
public final class WireCommandIngress {
    private static final Set<String> RUN_COMMANDS = Set.of("openingestion", "getrun", "deleterun", "listreports");
    private static final Set<String> SESSION_COMMANDS =
            Set.of("submitresults", "finalizeingestion", "abortingestion");

    private final CommandDispatcher dispatcher;
    private final OpMsgCodec opMsgCodec;
    private final OpQueryCodec opQueryCodec;
    private final AtomicInteger responseRequestId;
    private final JsonLinesLogger logger;

    public WireCommandIngress(final CommandDispatcher dispatcher) {
        this(dispatcher, JsonLinesLogger.noop());
    }

    public WireCommandIngress(final CommandDispatcher dispatcher, final JsonLinesLogger logger) {
        this(dispatcher, new OpMsgCodec(), new OpQueryCodec(), 1, logger);
    }

    public WireCommandIngress(
            final CommandDispatcher dispatcher,
            final OpMsgCodec opMsgCodec,
            final OpQueryCodec opQueryCodec,
            final int initialResponseRequestId,
            final JsonLinesLogger logger) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.opMsgCodec = Objects.requireNonNull(opMsgCodec, "opMsgCodec");
        this.opQueryCodec = Objects.requireNonNull(opQueryCodec, "opQueryCodec");
        this.responseRequestId = new AtomicInteger(initialResponseRequestId);
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public byte[] handle(final byte[] requestBytes) {
        return handle(requestBytes, null);
    }

    /**
     * @return the encoded reply, or {@code null} when the request asked for none
     * @throws WireProtocolException when the bytes are not an OP_MSG or OP_QUERY command
     */
    public byte[] handle(final byte[] requestBytes, final String connectionId) {
        final MessageHeader header = MessageHeader.read(requestBytes);
        if (header.opCode() == OpMsg.OP_CODE) {
            final OpMsg request = opMsgCodec.decode(requestBytes);
            final BsonDocument response = dispatch(request.requestId(), request.body(), connectionId);
            if (request.moreToCome()) {
                return null;
            }
            return opMsgCodec.encode(OpMsg.reply(responseRequestId.getAndIncrement(), request.requestId(), response));
        }
        if (header.opCode() == OpQuery.OP_CODE) {
            final OpQuery request = opQueryCodec.decode(requestBytes);
            final BsonDocument response = dispatch(request.requestId(), unwrapQuery(request.query()), connectionId);
            return opQueryCodec.encodeReply(responseRequestId.getAndIncrement(), request.requestId(), response);
        }
        throw new WireProtocolException("unsupported opCode: " + header.opCode());
    }

    private BsonDocument dispatch(final int requestId, final BsonDocument command, final String connectionId) {
        final String commandName = readCommandName(command);
        final CorrelationContext correlation = buildCorrelation(requestId, command, commandName, connectionId);
        final long startedAt = System.nanoTime();

        logger.info("command.start", correlation);
        BsonDocument responseBody = null;
        String error = null;
        try {
            responseBody = dispatcher.dispatch(command, connectionId);
            error = readError(responseBody);
            return responseBody;
        } catch (final RuntimeException exception) {
            error = summarizeException(exception);
            throw exception;
        } finally {
            final Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("ok", error == null);
            fields.put("durationMicros", (System.nanoTime() - startedAt) / 1_000L);
            if (error != null) {
                fields.put("error", error);
            }
            logger.info("command.complete", correlation, fields);
        }
    }

    /**
     * OP_QUERY commands may wrap the command as {@code {$query: {...}, $readPreference: ...}}.
     */
    private static BsonDocument unwrapQuery(final BsonDocument query) {
        final BsonValue wrapped = query.get("$query");
        if (wrapped != null && wrapped.isDocument()) {
            return wrapped.asDocument();
        }
        return query;
    }

    private static CorrelationContext buildCorrelation(
            final int requestId, final BsonDocument command, final String commandName, final String connectionId) {
        final CorrelationContext correlation =
                CorrelationContext.of(Integer.toString(requestId), commandName).withConnection(connectionId);
        final String target = readCommandTarget(command);
        if (RUN_COMMANDS.contains(commandName)) {
            return correlation.withRun(target);
        }
        if (SESSION_COMMANDS.contains(commandName)) {
            return correlation.withSession(target);
        }
        return correlation;
    }

    private static String readCommandTarget(final BsonDocument command) {
        if (command == null || command.isEmpty()) {
            return null;
        }
        final BsonValue value = command.get(command.getFirstKey());
        return value.isString() ? value.asString().getValue() : null;
    }

    private static String readError(final BsonDocument responseBody) {
        if (responseBody == null) {
            return "command response was null";
        }
        final BsonValue okValue = responseBody.get("ok");
        if (okValue == null || !okValue.isNumber()) {
            return "response missing numeric ok";
        }
        if (okValue.asNumber().doubleValue() == 1.0d) {
            return null;
        }

        final BsonValue codeName = responseBody.get("codeName");
        final BsonValue errorMessage = responseBody.get("errmsg");
        if (errorMessage != null && errorMessage.isString()) {
            final String prefix = codeName != null && codeName.isString() ? codeName.asString().getValue() + ": " : "";
            return prefix + errorMessage.asString().getValue();
        }
        return "command failed with ok=" + okValue.asNumber().doubleValue();
    }

    private static String summarizeException(final RuntimeException exception) {
        final String message = exception.getMessage();
        if (message == null || message.isBlank()) {
            return exception.getClass().getSimpleName();
        }
        return exception.getClass().getSimpleName() + ": " + message;
    }

    private static String readCommandName(final BsonDocument command) {
        if (command == null || command.isEmpty()) {
            return "unknown";
        }
        return command.getFirstKey().toLowerCase(Locale.ROOT);
    }
}
