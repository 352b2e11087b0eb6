package com.bsl.bankcode.index;

import java.util.List;
import java.util.Optional;

public interface VectorIndex {
    /**
     * Adds or replaces the entry stored under {@code recordId}.
     */
    void upsert(long recordId, List<Double> embedding, VectorMetadata metadata);

    /**
     * Up to {@code k} nearest entries by squared L2 distance, closest first.
     */
    List<VectorHit> query(List<Double> vector, int k);

    Optional<VectorMetadata> metadata(long recordId);

    int count();

    /**
     * Dimension of stored vectors, 0 while empty.
     */
    int dimension();
}
