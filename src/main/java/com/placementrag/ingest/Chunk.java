package com.placementrag.ingest;

public record Chunk(String text, String recordId, int chunkIndex) {
}
