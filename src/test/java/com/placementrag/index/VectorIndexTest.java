package com.placementrag.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import com.placementrag.runtime.ConfigurationException;

class VectorIndexTest {

    @Test
    void shouldGiveEveryConcurrentWriterItsOwnContiguousSlots() throws Exception {
        VectorIndex index = VectorIndex.create(4);
        int writers = 8;
        int recordsPerWriter = 25;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            int writer = w;
            futures.add(pool.submit(() -> {
                start.await();
                for (int r = 0; r < recordsPerWriter; r++) {
                    String id = "w" + writer + "-r" + r;
                    index.addRecord(id, metadata("Acme"), List.of(unit(0), unit(1), unit(2)));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get();
        }
        pool.shutdown();

        assertEquals(writers * recordsPerWriter * 3, index.size());
        assertEquals(writers * recordsPerWriter, index.liveRecordCount());
        Set<Integer> seen = new HashSet<>();
        for (String id : index.metadataSnapshot().keySet()) {
            List<Integer> slots = index.slotsOf(id);
            assertEquals(3, slots.size());
            assertEquals(slots.get(0) + 2, slots.get(2));
            slots.forEach(slot -> assertTrue(seen.add(slot), "slot " + slot + " assigned twice"));
        }
    }

    @Test
    void shouldKeepTombstonedVectorsButHideTheirRecord() {
        VectorIndex index = VectorIndex.create(2);
        index.addRecord("a", metadata("Acme"), List.of(new float[] { 1f, 0f }));
        index.addRecord("b", metadata("Globex"), List.of(new float[] { 0.9f, 0.1f }));

        assertTrue(index.tombstone("a"));
        assertFalse(index.tombstone("a"));
        assertFalse(index.tombstone("never-added"));

        List<SearchHit> hits = index.search(new float[] { 1f, 0f }, 2);
        assertEquals(0, hits.get(0).slot());
        assertFalse(hits.get(0).isLive());
        assertNull(hits.get(0).recordId());
        assertEquals("b", hits.get(1).recordId());

        assertEquals(2, index.size());
        assertEquals(1, index.liveRecordCount());
        assertEquals(Set.of("a"), index.tombstones());
        assertFalse(index.contains("a"));
        assertTrue(index.metadata("a").isEmpty());
    }

    @Test
    void shouldReplacePreviousSlotsWhenRecordIsReAdded() {
        VectorIndex index = VectorIndex.create(2);
        index.addRecord("a", metadata("Acme"), List.of(new float[] { 1f, 0f }, new float[] { 0f, 1f }));
        index.tombstone("a");

        List<Integer> slots = index.addRecord("a", metadata("Acme Corp"), List.of(new float[] { 1f, 0f }));

        assertEquals(List.of(2), slots);
        assertEquals(List.of(2), index.slotsOf("a"));
        assertEquals("Acme Corp", index.metadata("a").orElseThrow().company());
        assertTrue(index.tombstones().isEmpty());
    }

    @Test
    void shouldCompactWhenReplacedWithFreshSnapshot() {
        VectorIndex index = VectorIndex.create(2);
        index.addRecord("a", metadata("Acme"), List.of(new float[] { 1f, 0f }));
        index.addRecord("b", metadata("Globex"), List.of(new float[] { 0f, 1f }));
        index.tombstone("a");

        VectorIndex fresh = VectorIndex.create(2);
        fresh.addRecord("b", metadata("Globex"), List.of(new float[] { 0f, 1f }));
        index.replaceWith(fresh.snapshot());

        assertEquals(1, index.size());
        assertTrue(index.tombstones().isEmpty());
        assertEquals(List.of(0), index.slotsOf("b"));
        assertTrue(index.search(new float[] { 1f, 0f }, 5).stream().allMatch(SearchHit::isLive));
    }

    @Test
    void shouldRejectReplacementWithOtherDimension() {
        VectorIndex index = VectorIndex.create(2);

        assertThrows(ConfigurationException.class, () -> index.replaceWith(IndexSnapshot.empty(3)));
    }

    @Test
    void shouldRoundTripThroughSnapshot() {
        VectorIndex index = VectorIndex.create(2);
        index.addRecord("a", metadata("Acme"), List.of(new float[] { 1f, 0f }));
        index.addRecord("b", metadata("Globex"), List.of(new float[] { 0f, 1f }));
        index.tombstone("a");

        VectorIndex copy = VectorIndex.fromSnapshot(index.snapshot());

        assertEquals(index.size(), copy.size());
        assertEquals(index.metadataSnapshot(), copy.metadataSnapshot());
        assertEquals(index.tombstones(), copy.tombstones());
        assertEquals(index.slotsOf("b"), copy.slotsOf("b"));
    }

    @Test
    void shouldRejectSnapshotWithSlotOutsideStore() {
        assertThrows(IllegalArgumentException.class, () -> new IndexSnapshot(
                2, 1, new float[] { 1f, 0f },
                Map.of(0, "a", 5, "a"),
                Map.of("a", metadata("Acme")),
                Set.of()));
    }

    private static RecordMetadata metadata(String company) {
        return RecordMetadata.of(company, "SDE", 2024, "Company: " + company);
    }

    private static float[] unit(int axis) {
        float[] vector = new float[4];
        vector[axis] = 1f;
        return vector;
    }
}
