package com.bsl.bankcode.embed;

public enum EmbeddingMode {
    TOY,
    HTTP
}
