package com.bsl.bankcode.embed;

import com.bsl.bankcode.query.QueryText;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic local embedder: character uni/bi/tri-grams of the compact text are
 * hashed into signed buckets and the result is L2-normalised. Texts sharing
 * substrings end up close together, which is enough for branch names.
 */
public class ToyEmbedder {
    public static final int DEFAULT_DIMENSION = 384;

    private static final double UNIGRAM_WEIGHT = 0.5;
    private static final double BIGRAM_WEIGHT = 1.0;
    private static final double TRIGRAM_WEIGHT = 0.75;

    private final int dimension;

    public ToyEmbedder() {
        this(DEFAULT_DIMENSION);
    }

    public ToyEmbedder(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    public int getDimension() {
        return dimension;
    }

    public List<Double> embed(String text) {
        double[] values = new double[dimension];
        int[] codePoints = QueryText.compact(text).codePoints().toArray();
        addGrams(values, codePoints, 1, UNIGRAM_WEIGHT);
        addGrams(values, codePoints, 2, BIGRAM_WEIGHT);
        addGrams(values, codePoints, 3, TRIGRAM_WEIGHT);

        double sumSquares = 0.0;
        for (double value : values) {
            sumSquares += value * value;
        }
        double norm = Math.sqrt(sumSquares);
        if (norm == 0.0) {
            norm = 1.0;
        }
        List<Double> vector = new ArrayList<>(dimension);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }

    private void addGrams(double[] values, int[] codePoints, int n, double weight) {
        for (int start = 0; start + n <= codePoints.length; start++) {
            int hash = n;
            for (int i = start; i < start + n; i++) {
                hash = 31 * hash + codePoints[i];
            }
            int mixed = mix(hash);
            int bucket = (mixed >>> 1) % dimension;
            double sign = (mixed & 1) == 0 ? 1.0 : -1.0;
            values[bucket] += sign * weight;
        }
    }

    private static int mix(int value) {
        int h = value;
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
