package com.placementrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonSourceRecordStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadSnakeCaseRecordsAndFilterUnapproved() throws Exception {
        Path file = tempDir.resolve("experiences.json");
        Files.writeString(file, """
                [
                  {
                    "id": "exp-1",
                    "company_name": "Acme",
                    "role": "SDE",
                    "interview_year": 2024,
                    "offer_status": "Selected",
                    "difficulty_level": 3,
                    "tips": "Revise graphs",
                    "status": "approved",
                    "rounds": [{"round_number": 1, "round_type": "OA", "description": "Two problems"}],
                    "questions": [{"question_text": "Reverse a list", "question_type": "DSA", "topic": "Lists", "answer_approach": "Iterate"}],
                    "created_by": "someone"
                  },
                  {"id": "exp-2", "company_name": "Globex", "status": "pending"},
                  {"id": "exp-3", "company_name": "Initech"}
                ]
                """);
        JsonSourceRecordStore store = new JsonSourceRecordStore(file);

        List<SourceRecord> approved = store.fetchAllApprovedRecords();
        assertEquals(List.of("exp-1", "exp-3"), approved.stream().map(SourceRecord::id).toList());

        SourceRecord first = approved.get(0);
        assertEquals(2024, first.interviewYear());
        assertEquals("OA", first.rounds().get(0).roundType());
        assertEquals("Iterate", first.questions().get(0).answerApproach());
        assertTrue(approved.get(1).rounds().isEmpty());

        assertEquals("Globex", store.fetchRecord("exp-2").orElseThrow().companyName());
        assertTrue(store.fetchRecord("missing").isEmpty());
    }

    @Test
    void shouldTreatMissingFileAsEmpty() {
        JsonSourceRecordStore store = new JsonSourceRecordStore(tempDir.resolve("absent.json"));

        assertTrue(store.fetchAllApprovedRecords().isEmpty());
    }

    @Test
    void shouldFailOnMalformedFile() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "[{\"id\": ");

        JsonSourceRecordStore store = new JsonSourceRecordStore(file);

        assertThrows(UncheckedIOException.class, store::fetchAllApprovedRecords);
    }
}
