package io.chatrelay.core;

import java.util.Locale;

/**
 * Kind of table mutation reported by a change feed.
 */
public enum ChangeType {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Parses a feed's type tag, ignoring case.
     *
     * @throws IllegalArgumentException if the tag is not a known mutation type
     */
    public static ChangeType parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("missing change type");
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
