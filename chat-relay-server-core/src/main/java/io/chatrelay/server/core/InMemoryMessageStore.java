package io.chatrelay.server.core;

import io.chatrelay.core.MessageRecord;
import io.chatrelay.server.spi.MessageStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link MessageStore} for development and tests. Ids are sequential decimal strings.
 */
public final class InMemoryMessageStore implements MessageStore {
    private static final Comparator<Entry> BY_TIMESTAMP = Comparator
            .comparing((Entry e) -> e.record.timestamp(), Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(e -> e.sequence);

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentHashMap<String, Entry> byId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentSkipListMap<Long, Entry>> bySession = new ConcurrentHashMap<>();

    private record Entry(long sequence, MessageRecord record) {}

    @Override
    public MessageRecord insert(MessageRecord message) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(message.sessionId(), "sessionId");
        long seq = sequence.incrementAndGet();
        MessageRecord stored = message.withId(Long.toString(seq));
        Entry entry = new Entry(seq, stored);
        bySession.computeIfAbsent(stored.sessionId(), k -> new ConcurrentSkipListMap<>()).put(seq, entry);
        byId.put(stored.id(), entry);
        return stored;
    }

    @Override
    public List<MessageRecord> findBySession(String sessionId) {
        Map<Long, Entry> entries = bySession.get(sessionId);
        if (entries == null) {
            return List.of();
        }
        List<Entry> sorted = new ArrayList<>(entries.values());
        sorted.sort(BY_TIMESTAMP);
        List<MessageRecord> out = new ArrayList<>(sorted.size());
        for (Entry e : sorted) {
            out.add(e.record);
        }
        return out;
    }

    @Override
    public Optional<MessageRecord> findById(String messageId) {
        Entry e = messageId == null ? null : byId.get(messageId);
        return e == null ? Optional.empty() : Optional.of(e.record);
    }

    @Override
    public SortedSet<String> listDistinctSessionIds() {
        return new TreeSet<>(bySession.keySet());
    }

    @Override
    public long count() {
        return byId.size();
    }

    @Override
    public String describe() {
        return "in-memory";
    }
}
