package io.chatrelay.server.spi;

import io.chatrelay.core.MessageRecord;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Durable message store used by the relay.
 *
 * <p>This SPI is intentionally minimal and blocking. Hosts run these calls on request threads;
 * the relay never holds a lock across a store call.
 */
public interface MessageStore {

    /**
     * Persist a new message.
     *
     * @param message record without an id; the timestamp is already assigned by the caller
     * @return the persisted record, carrying the store-assigned id
     */
    MessageRecord insert(MessageRecord message) throws StoreException;

    /**
     * All messages of a session, ascending by timestamp (ties in insertion order).
     */
    List<MessageRecord> findBySession(String sessionId) throws StoreException;

    /**
     * Look up one message.
     *
     * @return empty if no message carries that id; lookup failures are reported as {@link StoreException}
     */
    Optional<MessageRecord> findById(String messageId) throws StoreException;

    /**
     * Every session id that has at least one stored message, in natural order.
     */
    SortedSet<String> listDistinctSessionIds() throws StoreException;

    /**
     * Total number of stored messages; doubles as the connectivity probe.
     */
    long count() throws StoreException;

    /**
     * Short human-readable description of the backing store for diagnostics (never contains credentials).
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
