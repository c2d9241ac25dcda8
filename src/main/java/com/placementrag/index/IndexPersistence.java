package com.placementrag.index;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Stores an {@link IndexSnapshot} as two files: the raw vectors in a small binary format and a JSON side
 * table holding the slot map, record metadata and tombstones.
 *
 * <p>The side table records the slot count and the SHA-256 of the vectors file it was written with, so a
 * pair where only one file got replaced (crash between the two moves, manual copying) is detected on load.
 * Loading fails closed: any inconsistency yields {@link Optional#empty()} and the caller rebuilds from the
 * source of truth.
 */
public class IndexPersistence {
    private static final Logger log = LoggerFactory.getLogger(IndexPersistence.class);

    static final int MAGIC = 0x50524147;
    static final int FORMAT_VERSION = 1;

    private final Path vectorsPath;
    private final Path sideTablePath;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public IndexPersistence(Path vectorsPath, Path sideTablePath) {
        this.vectorsPath = Objects.requireNonNull(vectorsPath, "vectorsPath");
        this.sideTablePath = Objects.requireNonNull(sideTablePath, "sideTablePath");
    }

    public synchronized void save(IndexSnapshot snapshot, String modelVersion) throws IOException {
        createParent(vectorsPath);
        createParent(sideTablePath);

        Path vectorsTmp = vectorsPath.resolveSibling(vectorsPath.getFileName() + ".tmp");
        MessageDigest digest = sha256();
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(
                new DigestOutputStream(Files.newOutputStream(vectorsTmp), digest)))) {
            out.writeInt(MAGIC);
            out.writeInt(FORMAT_VERSION);
            out.writeInt(snapshot.dimension());
            out.writeInt(snapshot.slotCount());
            for (float value : snapshot.vectors()) {
                out.writeFloat(value);
            }
        }

        SideTable sideTable = new SideTable(
                FORMAT_VERSION,
                snapshot.dimension(),
                snapshot.slotCount(),
                HexFormat.of().formatHex(digest.digest()),
                Instant.now(),
                modelVersion,
                snapshot.slotMap(),
                snapshot.metadata(),
                List.copyOf(snapshot.tombstones()));
        Path sideTableTmp = sideTablePath.resolveSibling(sideTablePath.getFileName() + ".tmp");
        mapper.writeValue(sideTableTmp.toFile(), sideTable);

        move(vectorsTmp, vectorsPath);
        move(sideTableTmp, sideTablePath);
        log.info("Index saved: {} vectors, {} records", snapshot.slotCount(), snapshot.metadata().size());
    }

    public synchronized Optional<IndexSnapshot> load(int expectedDimension, String expectedModelVersion) {
        if (!Files.exists(vectorsPath) || !Files.exists(sideTablePath)) {
            log.info("No persisted index at {} / {}", vectorsPath, sideTablePath);
            return Optional.empty();
        }
        try {
            return Optional.of(read(expectedDimension, expectedModelVersion));
        } catch (IndexCorruptedException e) {
            log.warn("Discarding persisted index: {}", e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unable to read persisted index, treating it as absent", e);
            return Optional.empty();
        }
    }

    IndexSnapshot read(int expectedDimension, String expectedModelVersion) throws IOException {
        SideTable sideTable;
        try {
            sideTable = mapper.readValue(sideTablePath.toFile(), SideTable.class);
        } catch (JacksonException e) {
            throw new IndexCorruptedException("Side table " + sideTablePath + " is not valid: " + e.getOriginalMessage(), e);
        }
        if (sideTable.formatVersion() != FORMAT_VERSION) {
            throw new IndexCorruptedException("Unsupported side table format " + sideTable.formatVersion());
        }
        if (sideTable.dimension() != expectedDimension) {
            throw new IndexCorruptedException("Persisted dimension " + sideTable.dimension()
                    + " differs from configured " + expectedDimension);
        }
        if (expectedModelVersion != null && !expectedModelVersion.equals(sideTable.modelVersion())) {
            throw new IndexCorruptedException("Persisted index was built with " + sideTable.modelVersion()
                    + ", current model is " + expectedModelVersion);
        }

        MessageDigest digest = sha256();
        float[] vectors;
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(
                new DigestInputStream(Files.newInputStream(vectorsPath), digest)))) {
            if (in.readInt() != MAGIC) {
                throw new IndexCorruptedException("Bad magic in " + vectorsPath);
            }
            int format = in.readInt();
            int dimension = in.readInt();
            int count = in.readInt();
            if (format != FORMAT_VERSION || dimension != sideTable.dimension() || count != sideTable.slotCount()) {
                throw new IndexCorruptedException("Vectors header (format=" + format + ", dimension=" + dimension
                        + ", count=" + count + ") disagrees with side table (dimension=" + sideTable.dimension()
                        + ", count=" + sideTable.slotCount() + ")");
            }
            if (count < 0 || (long) count * dimension > Integer.MAX_VALUE - 8) {
                throw new IndexCorruptedException("Implausible vector count " + count);
            }
            vectors = new float[count * dimension];
            for (int i = 0; i < vectors.length; i++) {
                vectors[i] = in.readFloat();
            }
            if (in.read() != -1) {
                throw new IndexCorruptedException("Trailing bytes after " + count + " vectors in " + vectorsPath);
            }
        } catch (EOFException e) {
            throw new IndexCorruptedException("Vectors file " + vectorsPath + " is truncated", e);
        }

        String checksum = HexFormat.of().formatHex(digest.digest());
        if (!checksum.equals(sideTable.vectorsSha256())) {
            throw new IndexCorruptedException("Vectors checksum mismatch: side table expects "
                    + sideTable.vectorsSha256() + " but file hashes to " + checksum);
        }

        try {
            IndexSnapshot snapshot = new IndexSnapshot(
                    sideTable.dimension(),
                    sideTable.slotCount(),
                    vectors,
                    sideTable.slotMap() == null ? Map.of() : sideTable.slotMap(),
                    sideTable.metadata() == null ? Map.of() : sideTable.metadata(),
                    sideTable.tombstones() == null ? Set.of() : Set.copyOf(sideTable.tombstones()));
            log.info("Loaded index saved at {}: {} vectors, {} records",
                    sideTable.savedAt(), snapshot.slotCount(), snapshot.metadata().size());
            return snapshot;
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IndexCorruptedException("Inconsistent side table: " + e.getMessage(), e);
        }
    }

    public Path vectorsPath() {
        return vectorsPath;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void createParent(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SideTable(
            @JsonProperty("format_version") int formatVersion,
            @JsonProperty("dimension") int dimension,
            @JsonProperty("slot_count") int slotCount,
            @JsonProperty("vectors_sha256") String vectorsSha256,
            @JsonProperty("saved_at") Instant savedAt,
            @JsonProperty("model_version") String modelVersion,
            @JsonProperty("slot_map") Map<Integer, String> slotMap,
            @JsonProperty("metadata") Map<String, RecordMetadata> metadata,
            @JsonProperty("tombstones") List<String> tombstones) {
    }
}
