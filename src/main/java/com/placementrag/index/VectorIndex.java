package com.placementrag.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.placementrag.runtime.ConfigurationException;

/**
 * The process-wide vector index: a {@link VectorStore} plus the slot map, per-record metadata and the
 * tombstone set, guarded by one read-write lock. Mutations ({@code addRecord}, {@code tombstone},
 * {@code replaceWith}) take the write lock; {@code search} and the read accessors take the read lock, so a
 * reader never sees a half-applied append.
 *
 * <p>Removal is logical. A tombstoned record loses its slot-map and metadata entries but its vectors stay
 * in the store and keep showing up in {@link #search} as non-live hits until the next rebuild swaps in a
 * compacted snapshot. {@link #size()} therefore counts physical vectors, live or not.
 */
public class VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(VectorIndex.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final int dimension;
    private VectorStore store;
    private final Map<Integer, String> slotMap = new HashMap<>();
    private final Map<String, RecordMetadata> metadata = new LinkedHashMap<>();
    private final Set<String> tombstones = new LinkedHashSet<>();

    private VectorIndex(int dimension) {
        this.dimension = dimension;
        this.store = new VectorStore(dimension);
    }

    public static VectorIndex create(int dimension) {
        return new VectorIndex(dimension);
    }

    public static VectorIndex fromSnapshot(IndexSnapshot snapshot) {
        VectorIndex index = new VectorIndex(snapshot.dimension());
        index.install(snapshot);
        return index;
    }

    public List<Integer> addRecord(String recordId, RecordMetadata recordMetadata, List<float[]> vectors) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Record " + recordId + " has no vectors to index");
        }
        lock.writeLock().lock();
        try {
            if (metadata.containsKey(recordId)) {
                removeMappings(recordId);
            }
            int first = store.add(vectors);
            List<Integer> slots = new ArrayList<>(vectors.size());
            for (int i = 0; i < vectors.size(); i++) {
                slotMap.put(first + i, recordId);
                slots.add(first + i);
            }
            metadata.put(recordId, recordMetadata);
            tombstones.remove(recordId);
            return slots;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean tombstone(String recordId) {
        lock.writeLock().lock();
        try {
            if (!metadata.containsKey(recordId)) {
                return false;
            }
            removeMappings(recordId);
            tombstones.add(recordId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<SearchHit> search(float[] query, int k) {
        lock.readLock().lock();
        try {
            List<ScoredSlot> ranked = store.search(query, k);
            List<SearchHit> hits = new ArrayList<>(ranked.size());
            for (ScoredSlot scored : ranked) {
                String recordId = slotMap.get(scored.slot());
                RecordMetadata recordMetadata = recordId == null ? null : metadata.get(recordId);
                hits.add(new SearchHit(scored.slot(), scored.score(), recordId, recordMetadata));
            }
            return hits;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void replaceWith(IndexSnapshot snapshot) {
        if (snapshot.dimension() != dimension) {
            throw new ConfigurationException("Replacement index has dimension " + snapshot.dimension()
                    + " but this index has " + dimension);
        }
        VectorStore replacement = VectorStore.of(snapshot.dimension(), snapshot.vectors(), snapshot.slotCount());
        lock.writeLock().lock();
        try {
            store = replacement;
            slotMap.clear();
            slotMap.putAll(snapshot.slotMap());
            metadata.clear();
            metadata.putAll(snapshot.metadata());
            tombstones.clear();
            tombstones.addAll(snapshot.tombstones());
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Swapped in index with {} vectors for {} records", snapshot.slotCount(), snapshot.metadata().size());
    }

    public IndexSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new IndexSnapshot(dimension, store.size(), store.raw(), slotMap, metadata, tombstones);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return store.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int liveRecordCount() {
        lock.readLock().lock();
        try {
            return metadata.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> tombstones() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(tombstones));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String recordId) {
        lock.readLock().lock();
        try {
            return metadata.containsKey(recordId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<RecordMetadata> metadata(String recordId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(metadata.get(recordId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, RecordMetadata> metadataSnapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Integer> slotsOf(String recordId) {
        lock.readLock().lock();
        try {
            return slotMap.entrySet().stream()
                    .filter(entry -> entry.getValue().equals(recordId))
                    .map(Map.Entry::getKey)
                    .sorted()
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public float[] vector(int slot) {
        lock.readLock().lock();
        try {
            return store.vector(slot);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int dimension() {
        return dimension;
    }

    private void install(IndexSnapshot snapshot) {
        store = VectorStore.of(snapshot.dimension(), snapshot.vectors(), snapshot.slotCount());
        slotMap.putAll(snapshot.slotMap());
        metadata.putAll(snapshot.metadata());
        tombstones.addAll(snapshot.tombstones());
    }

    private void removeMappings(String recordId) {
        slotMap.values().removeIf(recordId::equals);
        metadata.remove(recordId);
    }
}
