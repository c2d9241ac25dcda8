package com.placementrag.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JsonSourceRecordStore implements SourceRecordStore {
    private static final Logger log = LoggerFactory.getLogger(JsonSourceRecordStore.class);

    private final Path recordsPath;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public JsonSourceRecordStore(Path recordsPath) {
        this.recordsPath = recordsPath;
    }

    @Override
    public Optional<SourceRecord> fetchRecord(String id) {
        return readAll().stream()
                .filter(record -> record.id().equals(id))
                .findFirst();
    }

    @Override
    public List<SourceRecord> fetchAllApprovedRecords() {
        return readAll().stream()
                .filter(SourceRecord::isApproved)
                .toList();
    }

    private List<SourceRecord> readAll() {
        if (!Files.exists(recordsPath)) {
            log.warn("Records file {} does not exist", recordsPath);
            return List.of();
        }
        try {
            if (Files.size(recordsPath) == 0L) {
                return List.of();
            }
            return mapper.readValue(recordsPath.toFile(), new TypeReference<List<SourceRecord>>() {
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read records from " + recordsPath, e);
        }
    }
}
