package com.bsl.bankcode.store;

import com.bsl.bankcode.model.BankRecord;
import java.util.List;
import java.util.Optional;

public interface BankRecordStore {
    List<BankRecord> getAll();

    /**
     * Looks a record up by its bank name, ignoring whitespace, punctuation and case.
     */
    Optional<BankRecord> findByExactName(String bankName);

    Optional<BankRecord> findByCode(String bankCode);

    /**
     * The first {@code limit} records in id order.
     */
    List<BankRecord> head(int limit);

    int count();

    /**
     * Count and checksum read from one view of the records, so the pair never
     * straddles a concurrent reload.
     */
    default StoreFingerprint fingerprint() {
        List<BankRecord> records = getAll();
        return new StoreFingerprint(records.size(), BankRecordChecksum.of(records));
    }
}
