package io.chatrelay.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A table mutation pushed by the durable store's change feed.
 *
 * <p>Rows are kept as raw column maps because the feed reports mutations for every table it watches;
 * only inserts into the messages table are interpreted as {@link MessageRecord}s.
 */
public final class ChangeEvent {
    private final ChangeType type;
    private final String table;
    private final Map<String, Object> record;
    private final Map<String, Object> oldRecord;

    public ChangeEvent(ChangeType type, String table, Map<String, Object> record, Map<String, Object> oldRecord) {
        this.type = Objects.requireNonNull(type, "type");
        this.table = table;
        this.record = copyOrEmpty(record);
        this.oldRecord = copyOrEmpty(oldRecord);
    }

    public ChangeType type() {
        return type;
    }

    public String table() {
        return table;
    }

    /** Row after the mutation; empty for deletes. */
    public Map<String, Object> record() {
        return record;
    }

    /** Row before the mutation; empty for inserts. */
    public Map<String, Object> oldRecord() {
        return oldRecord;
    }

    public boolean isInsertInto(String tableName) {
        return type == ChangeType.INSERT && Objects.equals(table, tableName);
    }

    private static Map<String, Object> copyOrEmpty(Map<String, Object> row) {
        if (row == null || row.isEmpty()) return Map.of();
        // LinkedHashMap keeps column order and tolerates null column values
        return Collections.unmodifiableMap(new LinkedHashMap<>(row));
    }

    @Override
    public String toString() {
        return "ChangeEvent{" + type + " " + table + "}";
    }
}
