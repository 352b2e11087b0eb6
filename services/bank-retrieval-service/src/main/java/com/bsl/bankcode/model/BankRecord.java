package com.bsl.bankcode.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single bank branch from the source-of-truth store.
 *
 * <p>Both codes are fixed-length numeric identifiers. Instances can only be created
 * through {@link #of(long, String, String, String)}, which rejects anything that
 * violates that shape, so the retrieval path never has to re-check it.
 */
public final class BankRecord {
    public static final int CODE_LENGTH = 12;
    private static final Pattern CODE_PATTERN = Pattern.compile("\\d{" + CODE_LENGTH + "}");

    private final long id;
    private final String bankName;
    private final String bankCode;
    private final String clearingCode;

    private BankRecord(long id, String bankName, String bankCode, String clearingCode) {
        this.id = id;
        this.bankName = bankName;
        this.bankCode = bankCode;
        this.clearingCode = clearingCode;
    }

    public static BankRecord of(long id, String bankName, String bankCode, String clearingCode) {
        String name = bankName == null ? null : bankName.trim();
        if (name == null || name.isEmpty()) {
            throw new InvalidBankRecordException("bank_name_blank", "bank name must not be blank");
        }
        String code = bankCode == null ? null : bankCode.trim();
        if (!isValidCode(code)) {
            throw new InvalidBankRecordException(
                "bank_code_invalid",
                "bank code '" + bankCode + "' must be exactly " + CODE_LENGTH + " digits"
            );
        }
        String clearing = clearingCode == null ? null : clearingCode.trim();
        if (!isValidCode(clearing)) {
            throw new InvalidBankRecordException(
                "clearing_code_invalid",
                "clearing code '" + clearingCode + "' must be exactly " + CODE_LENGTH + " digits"
            );
        }
        return new BankRecord(id, name, code, clearing);
    }

    public static boolean isValidCode(String value) {
        return value != null && CODE_PATTERN.matcher(value).matches();
    }

    public long getId() {
        return id;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BankRecord)) {
            return false;
        }
        BankRecord that = (BankRecord) o;
        return id == that.id
            && bankName.equals(that.bankName)
            && bankCode.equals(that.bankCode)
            && clearingCode.equals(that.clearingCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, bankName, bankCode, clearingCode);
    }

    @Override
    public String toString() {
        return "BankRecord{id=" + id + ", bankName='" + bankName + "', bankCode='" + bankCode + "'}";
    }
}
