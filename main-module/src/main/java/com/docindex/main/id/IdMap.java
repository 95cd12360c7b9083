package com.docindex.main.id;

import com.docindex.common.model.IdMapSnapshot;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bijection between internal vector ids and external document keys, plus the
 * monotonic allocator for new ids. Ids are never handed out twice, even after removal.
 * <p>
 * Not thread-safe; guarded by the index manager's lock.
 */
public class IdMap {

    private final Map<Long, String> keysById = new LinkedHashMap<>();
    private final Map<String, Long> idsByKey = new HashMap<>();
    private long nextId = 1L;

    /**
     * Reserve the next internal id.
     */
    public long allocate() {
        return nextId++;
    }

    public void put(long id, String key) {
        if (keysById.containsKey(id)) {
            throw new IllegalArgumentException("Internal id already mapped: " + id);
        }
        if (idsByKey.containsKey(key)) {
            throw new IllegalArgumentException("Key already mapped: " + key);
        }
        keysById.put(id, key);
        idsByKey.put(key, id);
        if (id >= nextId) {
            nextId = id + 1;
        }
    }

    public Optional<String> removeById(long id) {
        String key = keysById.remove(id);
        if (key != null) {
            idsByKey.remove(key);
        }
        return Optional.ofNullable(key);
    }

    public Optional<Long> removeByKey(String key) {
        Long id = idsByKey.remove(key);
        if (id != null) {
            keysById.remove(id);
        }
        return Optional.ofNullable(id);
    }

    public Optional<Long> idOf(String key) {
        return Optional.ofNullable(idsByKey.get(key));
    }

    public Optional<String> keyOf(long id) {
        return Optional.ofNullable(keysById.get(id));
    }

    public boolean containsKey(String key) {
        return idsByKey.containsKey(key);
    }

    public Set<Long> ids() {
        return Set.copyOf(keysById.keySet());
    }

    public Set<String> keys() {
        return Set.copyOf(idsByKey.keySet());
    }

    public int size() {
        return keysById.size();
    }

    public long nextId() {
        return nextId;
    }

    public IdMapSnapshot snapshot() {
        return new IdMapSnapshot(nextId, keysById);
    }

    /**
     * Rebuild from a snapshot. The reverse direction is derived from the forward map and
     * the allocator resumes at max(persisted counter, largest id + 1).
     */
    public static IdMap restore(IdMapSnapshot snapshot) {
        IdMap idMap = new IdMap();
        snapshot.keysById().forEach(idMap::put);
        idMap.nextId = Math.max(idMap.nextId, snapshot.nextId());
        return idMap;
    }
}
