package io.chatrelay.server.core;

import io.chatrelay.core.Envelope;
import io.chatrelay.core.MessageRecord;
import io.chatrelay.core.MessageSubmission;
import io.chatrelay.core.Protocol;
import io.chatrelay.server.spi.MessageStore;
import io.chatrelay.server.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Direct-write ingress plus the read operations behind the message routes.
 *
 * <p>A submission is persisted first and broadcast afterwards, so a message is never announced to
 * subscribers before it is durable. Broadcast outcome does not affect the caller.
 */
public final class MessageService {
    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    private final MessageStore store;
    private final BroadcastDispatcher dispatcher;
    private final Clock clock;

    public MessageService(MessageStore store, BroadcastDispatcher dispatcher, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Validate, persist and announce a message.
     *
     * @return the stored record, including its store-assigned id
     * @throws ValidationException if session, sender or a non-blank text is missing
     * @throws StoreException if the store rejects or cannot be reached; nothing is broadcast then
     */
    public MessageRecord submit(MessageSubmission submission) throws StoreException {
        Objects.requireNonNull(submission, "submission");
        requirePresent(submission.sessionId(), Protocol.F_SESSION_ID);
        requirePresent(submission.senderId(), Protocol.F_SENDER_ID);
        if (submission.messageText() == null || submission.messageText().trim().isEmpty()) {
            throw new ValidationException(Protocol.F_MESSAGE_TEXT, Protocol.REQUIRED_SUBMISSION_FIELDS);
        }

        String recipient = submission.recipientId();
        if (recipient == null || recipient.isBlank()) {
            recipient = Protocol.DEFAULT_RECIPIENT;
        }
        MessageRecord draft = MessageRecord.builder()
                .sessionId(submission.sessionId())
                .senderId(submission.senderId())
                .recipientId(recipient)
                .messageText(submission.messageText())
                .messageType(Protocol.MESSAGE_TYPE_TEXT)
                .status(Protocol.STATUS_SENT)
                .timestamp(clock.instant())
                .build();

        MessageRecord saved = store.insert(draft);
        log.info("Message saved: id={} session={} sender={}", saved.id(), draft.sessionId(), draft.senderId());
        announce(saved.sessionId() != null ? saved.sessionId() : draft.sessionId(), saved);
        return saved;
    }

    public List<MessageRecord> messagesFor(String sessionId) throws StoreException {
        return store.findBySession(sessionId);
    }

    public Optional<MessageRecord> find(String messageId) throws StoreException {
        return store.findById(messageId);
    }

    public SortedSet<String> sessions() throws StoreException {
        return store.listDistinctSessionIds();
    }

    public long count() throws StoreException {
        return store.count();
    }

    public String storeDescription() {
        return store.describe();
    }

    private void announce(String sessionId, MessageRecord saved) {
        try {
            dispatcher.broadcast(sessionId, Envelope.newMessage(saved)).whenComplete((report, err) -> {
                if (err != null) {
                    log.error("Broadcast of message {} to session {} failed", saved.id(), sessionId, err);
                }
            });
        } catch (RuntimeException e) {
            log.error("Broadcast of message {} to session {} failed", saved.id(), sessionId, e);
        }
    }

    private static void requirePresent(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new ValidationException(field, Protocol.REQUIRED_SUBMISSION_FIELDS);
        }
    }
}
