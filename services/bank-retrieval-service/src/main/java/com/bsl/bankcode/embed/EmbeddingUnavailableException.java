package com.bsl.bankcode.embed;

/**
 * No vector could be produced. The message is a stable reason code such as
 * {@code embed_timeout} or {@code embed_circuit_open}.
 */
public class EmbeddingUnavailableException extends RuntimeException {
    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
