package com.bsl.bankcode.model;

public class InvalidBankRecordException extends RuntimeException {
    private final String reason;

    public InvalidBankRecordException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
