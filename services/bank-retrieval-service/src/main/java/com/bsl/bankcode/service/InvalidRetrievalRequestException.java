package com.bsl.bankcode.service;

public class InvalidRetrievalRequestException extends RuntimeException {
    public InvalidRetrievalRequestException(String message) {
        super(message);
    }
}
