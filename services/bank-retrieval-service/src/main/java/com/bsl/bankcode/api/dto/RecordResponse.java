package com.bsl.bankcode.api.dto;

import com.bsl.bankcode.model.BankRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

public class RecordResponse {
    @JsonProperty("record_id")
    private long recordId;

    @JsonProperty("bank_name")
    private String bankName;

    @JsonProperty("bank_code")
    private String bankCode;

    @JsonProperty("clearing_code")
    private String clearingCode;

    public static RecordResponse from(BankRecord record) {
        RecordResponse response = new RecordResponse();
        response.recordId = record.getId();
        response.bankName = record.getBankName();
        response.bankCode = record.getBankCode();
        response.clearingCode = record.getClearingCode();
        return response;
    }

    public long getRecordId() {
        return recordId;
    }

    public String getBankName() {
        return bankName;
    }

    public String getBankCode() {
        return bankCode;
    }

    public String getClearingCode() {
        return clearingCode;
    }
}
