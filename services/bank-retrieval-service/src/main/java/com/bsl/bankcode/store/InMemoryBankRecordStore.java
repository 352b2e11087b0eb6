package com.bsl.bankcode.store;

import com.bsl.bankcode.model.BankRecord;
import com.bsl.bankcode.query.QueryText;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Heap-resident record store. Readers see one consistent {@link Contents}
 * instance; {@link #replaceAll(Collection)} publishes a new one.
 */
public class InMemoryBankRecordStore implements BankRecordStore {
    private final AtomicReference<Contents> contents = new AtomicReference<>(Contents.of(List.of()));

    public InMemoryBankRecordStore() {
    }

    public InMemoryBankRecordStore(Collection<BankRecord> records) {
        replaceAll(records);
    }

    public void replaceAll(Collection<BankRecord> records) {
        contents.set(Contents.of(records == null ? List.of() : records));
    }

    @Override
    public List<BankRecord> getAll() {
        return contents.get().records;
    }

    @Override
    public Optional<BankRecord> findByExactName(String bankName) {
        String key = QueryText.compact(bankName);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(contents.get().byCompactName.get(key));
    }

    @Override
    public Optional<BankRecord> findByCode(String bankCode) {
        if (bankCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(contents.get().byCode.get(bankCode.trim()));
    }

    @Override
    public List<BankRecord> head(int limit) {
        List<BankRecord> records = contents.get().records;
        if (limit <= 0) {
            return List.of();
        }
        return records.size() <= limit ? records : records.subList(0, limit);
    }

    @Override
    public int count() {
        return contents.get().records.size();
    }

    @Override
    public StoreFingerprint fingerprint() {
        Contents snapshot = contents.get();
        return new StoreFingerprint(snapshot.records.size(), snapshot.checksum);
    }

    private static final class Contents {
        private final List<BankRecord> records;
        private final Map<String, BankRecord> byCompactName;
        private final Map<String, BankRecord> byCode;
        private final String checksum;

        private Contents(List<BankRecord> records, Map<String, BankRecord> byCompactName,
                         Map<String, BankRecord> byCode, String checksum) {
            this.records = records;
            this.byCompactName = byCompactName;
            this.byCode = byCode;
            this.checksum = checksum;
        }

        static Contents of(Collection<BankRecord> source) {
            List<BankRecord> records = new ArrayList<>(source);
            records.sort(Comparator.comparingLong(BankRecord::getId));
            Map<String, BankRecord> byName = new HashMap<>();
            Map<String, BankRecord> byCode = new HashMap<>();
            for (BankRecord record : records) {
                byName.putIfAbsent(QueryText.compact(record.getBankName()), record);
                byCode.putIfAbsent(record.getBankCode(), record);
            }
            return new Contents(
                Collections.unmodifiableList(records),
                byName,
                byCode,
                BankRecordChecksum.of(records)
            );
        }
    }
}
