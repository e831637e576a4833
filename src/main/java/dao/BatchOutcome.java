package dao;

import lombok.Value;
import model.EntityKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Value
public class BatchOutcome {

    int batchIndex;
    Map<EntityKind, Long> inserted;
    Map<EntityKind, Long> skipped;

    public BatchOutcome(int batchIndex, Map<EntityKind, Long> inserted, Map<EntityKind, Long> skipped) {
        this.batchIndex = batchIndex;
        this.inserted = Collections.unmodifiableMap(copy(inserted));
        this.skipped = Collections.unmodifiableMap(copy(skipped));
    }

    public long insertedTotal() {
        return inserted.values().stream().mapToLong(Long::longValue).sum();
    }

    public long skippedTotal() {
        return skipped.values().stream().mapToLong(Long::longValue).sum();
    }

    public long inserted(EntityKind kind) {
        return inserted.getOrDefault(kind, 0L);
    }

    public long skipped(EntityKind kind) {
        return skipped.getOrDefault(kind, 0L);
    }

    private static Map<EntityKind, Long> copy(Map<EntityKind, Long> source) {
        Map<EntityKind, Long> copy = new EnumMap<>(EntityKind.class);
        if (source != null) copy.putAll(source);
        return copy;
    }
}
