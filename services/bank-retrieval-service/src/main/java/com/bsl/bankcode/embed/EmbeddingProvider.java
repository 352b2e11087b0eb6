package com.bsl.bankcode.embed;

import java.util.ArrayList;
import java.util.List;

public interface EmbeddingProvider {
    /**
     * Query-side embedding.
     *
     * @throws EmbeddingUnavailableException when no vector can be produced
     */
    List<Double> embed(String text);

    /**
     * Document-side embedding, one vector per input text in input order.
     */
    default List<List<Double>> embedBatch(List<String> texts) {
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }
}
