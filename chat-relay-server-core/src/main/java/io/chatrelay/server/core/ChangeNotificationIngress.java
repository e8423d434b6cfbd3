package io.chatrelay.server.core;

import io.chatrelay.core.ChangeEvent;
import io.chatrelay.core.Envelope;
import io.chatrelay.core.MessageRecord;
import io.chatrelay.json.spi.JsonCodec;
import io.chatrelay.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Ingress for row-change notifications pushed by the database.
 *
 * <p>Notifications are acknowledged before they are processed. Only inserts into the messages table
 * are announced; every processing error is logged and goes no further.
 */
public final class ChangeNotificationIngress {
    private static final Logger log = LoggerFactory.getLogger(ChangeNotificationIngress.class);

    private final BroadcastDispatcher dispatcher;
    private final JsonCodec codec;
    private final String messagesTable;
    private final Executor executor;

    public ChangeNotificationIngress(BroadcastDispatcher dispatcher, JsonCodec codec, String messagesTable,
                                     Executor executor) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.messagesTable = Objects.requireNonNull(messagesTable, "messagesTable");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /** Schedule processing of a raw notification body and return at once. */
    public void accept(byte[] body) {
        try {
            executor.execute(() -> processRaw(body));
        } catch (RejectedExecutionException e) {
            log.error("Webhook dropped, notification executor is not accepting work: {}", e.getMessage());
        }
    }

    /**
     * @return whether a broadcast was dispatched
     */
    public boolean process(ChangeEvent event) {
        log.info("Webhook received: type={} table={}", event.type(), event.table());
        if (!event.isInsertInto(messagesTable)) {
            log.debug("Ignoring {} on table {}", event.type(), event.table());
            return false;
        }

        MessageRecord record;
        try {
            record = codec.convertValue(event.record(), MessageRecord.class);
        } catch (JsonException e) {
            log.error("Error processing webhook: unreadable record: {}", e.getMessage());
            return false;
        }
        if (record.sessionId() == null || record.sessionId().isEmpty()) {
            log.warn("Webhook insert without session_id ignored: id={}", record.id());
            return false;
        }

        String sessionId = record.sessionId();
        dispatcher.broadcast(sessionId, Envelope.newMessage(record)).whenComplete((report, err) -> {
            if (err != null) {
                log.error("Error processing webhook: broadcast to session {} failed", sessionId, err);
            }
        });
        return true;
    }

    private void processRaw(byte[] body) {
        try {
            ChangeEvent event = codec.readValue(body, ChangeEvent.class);
            process(event);
        } catch (JsonException e) {
            log.error("Error processing webhook: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing webhook", e);
        }
    }
}
