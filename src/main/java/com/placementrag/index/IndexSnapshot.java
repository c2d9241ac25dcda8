package com.placementrag.index;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public record IndexSnapshot(
        int dimension,
        int slotCount,
        float[] vectors,
        Map<Integer, String> slotMap,
        Map<String, RecordMetadata> metadata,
        Set<String> tombstones) {

    public IndexSnapshot {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        if (slotCount < 0 || vectors.length != (long) slotCount * dimension) {
            throw new IllegalArgumentException("Vector payload of " + vectors.length + " floats does not match "
                    + slotCount + " slots of dimension " + dimension);
        }
        Set<String> mappedRecords = new HashSet<>();
        for (Map.Entry<Integer, String> entry : slotMap.entrySet()) {
            int slot = entry.getKey();
            if (slot < 0 || slot >= slotCount) {
                throw new IllegalArgumentException("Slot " + slot + " outside [0, " + slotCount + ")");
            }
            if (!metadata.containsKey(entry.getValue())) {
                throw new IllegalArgumentException("Slot " + slot + " maps to record " + entry.getValue()
                        + " which has no metadata");
            }
            mappedRecords.add(entry.getValue());
        }
        for (String recordId : metadata.keySet()) {
            if (!mappedRecords.contains(recordId)) {
                throw new IllegalArgumentException("Record " + recordId + " has metadata but no slots");
            }
        }
        vectors = vectors.clone();
        slotMap = Map.copyOf(slotMap);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        tombstones = Collections.unmodifiableSet(new LinkedHashSet<>(tombstones));
    }

    @Override
    public float[] vectors() {
        return vectors.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof IndexSnapshot)) {
            return false;
        }
        IndexSnapshot that = (IndexSnapshot) other;
        return dimension == that.dimension
                && slotCount == that.slotCount
                && Arrays.equals(vectors, that.vectors)
                && slotMap.equals(that.slotMap)
                && metadata.equals(that.metadata)
                && tombstones.equals(that.tombstones);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, slotCount, Arrays.hashCode(vectors), slotMap, metadata, tombstones);
    }

    @Override
    public String toString() {
        return "IndexSnapshot[dimension=" + dimension + ", slotCount=" + slotCount + ", records="
                + metadata.size() + ", tombstones=" + tombstones.size() + "]";
    }

    public static IndexSnapshot empty(int dimension) {
        return new IndexSnapshot(dimension, 0, new float[0], Map.of(), Map.of(), Set.of());
    }

    public List<String> liveRecordIds() {
        return List.copyOf(metadata.keySet());
    }
}
