package com.placementrag.index;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexPersistenceTest {

    @TempDir
    Path tempDir;

    private Path vectors;
    private Path idMap;
    private IndexPersistence persistence;

    @BeforeEach
    void setUp() {
        vectors = tempDir.resolve("data/vectors.bin");
        idMap = tempDir.resolve("data/id_map.json");
        persistence = new IndexPersistence(vectors, idMap);
    }

    @Test
    void shouldRoundTripVectorsSideTablesAndTombstones() throws Exception {
        IndexSnapshot saved = sampleIndex().snapshot();

        persistence.save(saved, "model-v1");
        IndexSnapshot loaded = persistence.load(3, "model-v1").orElseThrow();

        assertEquals(saved.slotCount(), loaded.slotCount());
        assertArrayEquals(saved.vectors(), loaded.vectors());
        assertEquals(saved.slotMap(), loaded.slotMap());
        assertEquals(saved.metadata(), loaded.metadata());
        assertEquals(saved.tombstones(), loaded.tombstones());
        float[] query = { 0.6f, 0.8f, 0f };
        List<SearchHit> before = VectorIndex.fromSnapshot(saved).search(query, 4);
        assertEquals(4, before.size());
        assertEquals(before, VectorIndex.fromSnapshot(loaded).search(query, 4));
        assertEquals(saved, loaded);
        assertTrue(Files.exists(vectors));
        assertTrue(Files.exists(idMap));
        assertTrue(Files.list(tempDir.resolve("data")).noneMatch(path -> path.toString().endsWith(".tmp")));
    }

    @Test
    void shouldOverwritePreviousSave() throws Exception {
        VectorIndex index = sampleIndex();
        persistence.save(index.snapshot(), "model-v1");
        index.addRecord("c", RecordMetadata.of("Initech", "QA", 2022, "Company: Initech"),
                List.of(new float[] { 0f, 0f, 1f }));

        persistence.save(index.snapshot(), "model-v1");

        IndexSnapshot loaded = persistence.load(3, "model-v1").orElseThrow();
        assertEquals(4, loaded.slotCount());
        assertTrue(loaded.metadata().containsKey("c"));
    }

    @Test
    void shouldTreatMissingFilesAsAbsent() throws Exception {
        assertTrue(persistence.load(3, "model-v1").isEmpty());

        persistence.save(sampleIndex().snapshot(), "model-v1");
        Files.delete(idMap);

        assertTrue(persistence.load(3, "model-v1").isEmpty());
    }

    @Test
    void shouldFailClosedOnFlippedVectorByte() throws Exception {
        persistence.save(sampleIndex().snapshot(), "model-v1");
        byte[] bytes = Files.readAllBytes(vectors);
        bytes[20] ^= 0x01;
        Files.write(vectors, bytes);

        assertThrows(IndexCorruptedException.class, () -> persistence.read(3, "model-v1"));
        assertTrue(persistence.load(3, "model-v1").isEmpty());
    }

    @Test
    void shouldFailClosedOnTruncatedVectors() throws Exception {
        persistence.save(sampleIndex().snapshot(), "model-v1");
        byte[] bytes = Files.readAllBytes(vectors);
        Files.write(vectors, Arrays.copyOf(bytes, bytes.length - 5));

        assertThrows(IndexCorruptedException.class, () -> persistence.read(3, "model-v1"));
    }

    @Test
    void shouldFailClosedWhenOnlyOneFileWasReplaced() throws Exception {
        VectorIndex index = sampleIndex();
        persistence.save(index.snapshot(), "model-v1");
        byte[] oldVectors = Files.readAllBytes(vectors);
        index.addRecord("c", RecordMetadata.of("Initech", "QA", 2022, "Company: Initech"),
                List.of(new float[] { 0f, 0f, 1f }));
        persistence.save(index.snapshot(), "model-v1");
        Files.write(vectors, oldVectors);

        assertThrows(IndexCorruptedException.class, () -> persistence.read(3, "model-v1"));
    }

    @Test
    void shouldFailClosedOnGarbageSideTable() throws Exception {
        persistence.save(sampleIndex().snapshot(), "model-v1");
        Files.writeString(idMap, "{not json");

        assertThrows(IndexCorruptedException.class, () -> persistence.read(3, "model-v1"));
        assertTrue(persistence.load(3, "model-v1").isEmpty());
    }

    @Test
    void shouldRejectDimensionOrModelChange() throws Exception {
        persistence.save(sampleIndex().snapshot(), "model-v1");

        assertThrows(IndexCorruptedException.class, () -> persistence.read(4, "model-v1"));
        assertThrows(IndexCorruptedException.class, () -> persistence.read(3, "model-v2"));
        assertTrue(persistence.load(4, "model-v1").isEmpty());
    }

    @Test
    void shouldRejectBadMagic() throws Exception {
        persistence.save(sampleIndex().snapshot(), "model-v1");
        byte[] bytes = Files.readAllBytes(vectors);
        bytes[0] = 0;
        Files.write(vectors, bytes);

        assertThrows(IndexCorruptedException.class, () -> persistence.read(3, "model-v1"));
    }

    private static VectorIndex sampleIndex() {
        VectorIndex index = VectorIndex.create(3);
        index.addRecord("a", RecordMetadata.of("Acme", "SDE", 2024, "Company: Acme\nRole: SDE"),
                List.of(new float[] { 1f, 0f, 0f }, new float[] { 0.5f, 0.5f, 0f }));
        index.addRecord("b", RecordMetadata.of("Globex", null, null, "Company: Globex"),
                List.of(new float[] { 0f, 1f, 0f }));
        index.addRecord("gone", RecordMetadata.of("Hooli", "PM", 2021, "Company: Hooli"),
                List.of(new float[] { 0f, 0f, 1f }));
        index.tombstone("gone");
        return index;
    }
}
