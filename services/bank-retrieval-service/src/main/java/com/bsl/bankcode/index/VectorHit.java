package com.bsl.bankcode.index;

public final class VectorHit {
    private final long recordId;
    private final double distance;
    private final VectorMetadata metadata;

    public VectorHit(long recordId, double distance, VectorMetadata metadata) {
        this.recordId = recordId;
        this.distance = distance;
        this.metadata = metadata;
    }

    public long getRecordId() {
        return recordId;
    }

    /**
     * Squared Euclidean distance to the query vector.
     */
    public double getDistance() {
        return distance;
    }

    public VectorMetadata getMetadata() {
        return metadata;
    }
}
