package com.bsl.bankcode.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum RetrievalMethod {
    EXACT_FULL_NAME,
    VECTOR,
    KEYWORD,
    HYBRID;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
