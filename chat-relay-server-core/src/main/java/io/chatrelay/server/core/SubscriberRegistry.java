package io.chatrelay.server.core;

import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live subscribers grouped by session id.
 *
 * <p>Each session maps to an immutable set that is replaced atomically on every change, so
 * {@link #snapshot(String)} is a consistent copy that later registrations cannot disturb. A session
 * whose last subscriber leaves is removed, so {@link #listActiveSessions()} never reports an empty one.
 */
public final class SubscriberRegistry {
    private final ConcurrentHashMap<String, Set<SessionSubscriber>> bySession = new ConcurrentHashMap<>();

    public void register(SessionSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        bySession.compute(subscriber.sessionId(), (id, current) -> {
            if (current == null) {
                return Set.of(subscriber);
            }
            Set<SessionSubscriber> next = new HashSet<>(current);
            next.add(subscriber);
            return Collections.unmodifiableSet(next);
        });
    }

    /**
     * Remove one subscriber. Unknown subscribers and sessions are ignored.
     *
     * @return whether the subscriber was registered
     */
    public boolean unregister(SessionSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        boolean[] removed = {false};
        bySession.computeIfPresent(subscriber.sessionId(), (id, current) -> {
            if (!current.contains(subscriber)) {
                return current;
            }
            removed[0] = true;
            if (current.size() == 1) {
                return null;
            }
            Set<SessionSubscriber> next = new HashSet<>(current);
            next.remove(subscriber);
            return Collections.unmodifiableSet(next);
        });
        return removed[0];
    }

    public Set<SessionSubscriber> snapshot(String sessionId) {
        return bySession.getOrDefault(sessionId, Set.of());
    }

    /** Sessions with at least one live subscriber, in no particular order. */
    public Set<String> listActiveSessions() {
        return Set.copyOf(bySession.keySet());
    }

    public int size(String sessionId) {
        return snapshot(sessionId).size();
    }

    public int subscriberCount() {
        int total = 0;
        for (Set<SessionSubscriber> set : bySession.values()) {
            total += set.size();
        }
        return total;
    }
}
