package com.bsl.bankcode.index;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Brute-force exact nearest neighbour index over float vectors.
 *
 * <p>Not thread-safe for writes. Instances are filled by a single builder thread
 * and only read after being published through an {@link IndexSnapshot}.
 */
public class InMemoryVectorIndex implements VectorIndex {
    private static final Comparator<VectorHit> FARTHEST_FIRST = Comparator
        .comparingDouble(VectorHit::getDistance)
        .thenComparingLong(VectorHit::getRecordId)
        .reversed();

    private final List<Long> ids = new ArrayList<>();
    private final List<float[]> vectors = new ArrayList<>();
    private final List<VectorMetadata> metadata = new ArrayList<>();
    private final Map<Long, Integer> slotById = new HashMap<>();
    private int dimension;

    @Override
    public void upsert(long recordId, List<Double> embedding, VectorMetadata entryMetadata) {
        if (embedding == null || embedding.isEmpty()) {
            throw new IllegalArgumentException("embedding must not be empty for record " + recordId);
        }
        if (dimension == 0) {
            dimension = embedding.size();
        } else if (embedding.size() != dimension) {
            throw new IllegalArgumentException(
                "embedding dimension " + embedding.size() + " does not match index dimension " + dimension
            );
        }
        float[] values = toFloats(embedding);
        Integer slot = slotById.get(recordId);
        if (slot != null) {
            vectors.set(slot, values);
            metadata.set(slot, entryMetadata);
            return;
        }
        slotById.put(recordId, ids.size());
        ids.add(recordId);
        vectors.add(values);
        metadata.add(entryMetadata);
    }

    @Override
    public List<VectorHit> query(List<Double> vector, int k) {
        if (k <= 0 || ids.isEmpty() || vector == null) {
            return List.of();
        }
        if (vector.size() != dimension) {
            throw new IllegalArgumentException(
                "query dimension " + vector.size() + " does not match index dimension " + dimension
            );
        }
        float[] query = toFloats(vector);
        PriorityQueue<VectorHit> heap = new PriorityQueue<>(k + 1, FARTHEST_FIRST);
        for (int slot = 0; slot < vectors.size(); slot++) {
            double distance = squaredL2(query, vectors.get(slot));
            VectorHit hit = new VectorHit(ids.get(slot), distance, metadata.get(slot));
            if (heap.size() < k) {
                heap.add(hit);
            } else if (FARTHEST_FIRST.compare(hit, heap.peek()) > 0) {
                heap.poll();
                heap.add(hit);
            }
        }
        List<VectorHit> hits = new ArrayList<>(heap);
        hits.sort(FARTHEST_FIRST.reversed());
        return hits;
    }

    @Override
    public Optional<VectorMetadata> metadata(long recordId) {
        Integer slot = slotById.get(recordId);
        return slot == null ? Optional.empty() : Optional.ofNullable(metadata.get(slot));
    }

    @Override
    public int count() {
        return ids.size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private static double squaredL2(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    private static float[] toFloats(List<Double> values) {
        float[] out = new float[values.size()];
        for (int i = 0; i < out.length; i++) {
            Double value = values.get(i);
            out[i] = value == null ? 0f : value.floatValue();
        }
        return out;
    }
}
