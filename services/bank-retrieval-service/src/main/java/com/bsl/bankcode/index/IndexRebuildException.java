package com.bsl.bankcode.index;

public class IndexRebuildException extends RuntimeException {
    public IndexRebuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
