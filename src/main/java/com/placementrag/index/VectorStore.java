package com.placementrag.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import com.placementrag.runtime.ConfigurationException;

public class VectorStore {
    private static final Comparator<ScoredSlot> RANKING = Comparator
            .comparingDouble(ScoredSlot::score).reversed()
            .thenComparingInt(ScoredSlot::slot);

    private final int dimension;
    private float[] data;
    private int count;

    public VectorStore(int dimension) {
        if (dimension <= 0) {
            throw new ConfigurationException("Vector dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
        this.data = new float[dimension * 16];
    }

    static VectorStore of(int dimension, float[] vectors, int count) {
        if (vectors.length != count * dimension) {
            throw new IllegalArgumentException("Expected " + count * dimension + " floats but got " + vectors.length);
        }
        VectorStore store = new VectorStore(dimension);
        store.data = Arrays.copyOf(vectors, Math.max(vectors.length, dimension * 16));
        store.count = count;
        return store;
    }

    public int add(List<float[]> vectors) {
        for (float[] vector : vectors) {
            checkDimension(vector);
        }
        int first = count;
        ensureCapacity(count + vectors.size());
        for (float[] vector : vectors) {
            System.arraycopy(vector, 0, data, count * dimension, dimension);
            count++;
        }
        return first;
    }

    // Highest score first, lower slot first on equal scores.
    public List<ScoredSlot> search(float[] query, int k) {
        checkDimension(query);
        if (count == 0 || k <= 0) {
            return List.of();
        }
        int limit = Math.min(k, count);
        // head is the weakest of the current best
        PriorityQueue<ScoredSlot> best = new PriorityQueue<>(limit + 1, RANKING.reversed());
        for (int slot = 0; slot < count; slot++) {
            best.offer(new ScoredSlot(slot, dot(query, slot)));
            if (best.size() > limit) {
                best.poll();
            }
        }
        List<ScoredSlot> ranked = new ArrayList<>(best);
        ranked.sort(RANKING);
        return ranked;
    }

    public float[] vector(int slot) {
        if (slot < 0 || slot >= count) {
            throw new IndexOutOfBoundsException("Slot " + slot + " outside [0, " + count + ")");
        }
        return Arrays.copyOfRange(data, slot * dimension, (slot + 1) * dimension);
    }

    public int size() {
        return count;
    }

    public int dimension() {
        return dimension;
    }

    float[] raw() {
        return Arrays.copyOf(data, count * dimension);
    }

    private float dot(float[] query, int slot) {
        int offset = slot * dimension;
        float sum = 0f;
        for (int i = 0; i < dimension; i++) {
            sum += query[i] * data[offset + i];
        }
        return sum;
    }

    private void checkDimension(float[] vector) {
        if (vector.length != dimension) {
            throw new ConfigurationException("Vector dimension mismatch: expected " + dimension + " but got " + vector.length);
        }
    }

    private void ensureCapacity(int slots) {
        long required = (long) slots * dimension;
        if (required <= data.length) {
            return;
        }
        if (required > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("Vector store full at " + count + " slots");
        }
        long grown = Math.max(required, (long) data.length * 2);
        data = Arrays.copyOf(data, (int) Math.min(grown, Integer.MAX_VALUE - 8));
    }
}
