package com.placementrag.retrieval;

/**
 * {@code indexSize} counts physical vectors and keeps counting vectors of removed records until the next
 * full reindex, so it drifts from {@code liveRecords} after removals.
 */
public record EngineStats(int indexSize, int liveRecords, int tombstonedRecords, int dimension, String modelVersion) {
}
