package com.placementrag.ingest;

import java.util.ArrayList;
import java.util.List;

import com.placementrag.runtime.ConfigurationException;

public class Chunker {
    private final int maxSize;
    private final int overlap;

    public Chunker(int maxSize, int overlap) {
        if (maxSize <= 0) {
            throw new ConfigurationException("Chunk size must be positive: " + maxSize);
        }
        if (overlap < 0 || overlap >= maxSize) {
            throw new ConfigurationException("Chunk overlap must be in [0, " + maxSize + "): " + overlap);
        }
        this.maxSize = maxSize;
        this.overlap = overlap;
    }

    public List<Chunk> chunk(String document, String recordId) {
        List<Chunk> chunks = new ArrayList<>();
        if (document == null || document.isBlank()) {
            return chunks;
        }
        int length = document.length();
        if (length <= maxSize) {
            chunks.add(new Chunk(document.strip(), recordId, 0));
            return chunks;
        }

        int start = 0;
        int chunkIndex = 0;
        while (start < length) {
            int end = Math.min(start + maxSize, length);
            if (end < length) {
                int lastPeriod = document.lastIndexOf('.', end - 1);
                if (lastPeriod > start + maxSize / 2) {
                    end = lastPeriod + 1;
                }
            }

            String text = document.substring(start, end).strip();
            if (!text.isEmpty()) {
                chunks.add(new Chunk(text, recordId, chunkIndex));
                chunkIndex++;
            }
            if (end == length) {
                break;
            }
            // a snapped window can be shorter than the overlap; always move forward
            start = Math.max(end - overlap, start + 1);
        }
        return chunks;
    }
}
