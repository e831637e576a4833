package dao;

import lombok.Value;
import model.EntityKind;
import model.Identified;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entities written together in one transaction, in emission order.
 */
@Value
public class Batch {

    int index;
    List<Identified> entities;

    public Batch(int index, List<? extends Identified> entities) {
        this.index = index;
        this.entities = Collections.unmodifiableList(new ArrayList<>(entities));
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public List<String> sampleIds(int limit) {
        List<String> ids = new ArrayList<>();
        for (Identified entity : entities) {
            if (ids.size() >= limit) break;
            ids.add(rowOf(entity));
        }
        return ids;
    }

    /** "kind/id", as failed rows are reported. */
    public static String rowOf(Identified entity) {
        return entity.kind().label() + "/" + entity.getId();
    }

    public Map<EntityKind, Long> countByKind() {
        Map<EntityKind, Long> counts = new EnumMap<>(EntityKind.class);
        for (Identified entity : entities) {
            counts.merge(entity.kind(), 1L, Long::sum);
        }
        return counts;
    }
}
