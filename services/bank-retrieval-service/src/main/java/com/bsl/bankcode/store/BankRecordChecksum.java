package com.bsl.bankcode.store;

import com.bsl.bankcode.cache.CacheKeyUtil;
import com.bsl.bankcode.model.BankRecord;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Order-independent content digest of a record set.
 */
public final class BankRecordChecksum {
    public static final String EMPTY = "";

    private BankRecordChecksum() {
    }

    public static String of(Collection<BankRecord> records) {
        if (records == null || records.isEmpty()) {
            return EMPTY;
        }
        List<BankRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(BankRecord::getBankCode).thenComparingLong(BankRecord::getId));
        MessageDigest digest = CacheKeyUtil.newDigest();
        for (BankRecord record : sorted) {
            String line = record.getId() + "|" + record.getBankName() + "|"
                + record.getBankCode() + "|" + record.getClearingCode() + "\n";
            digest.update(line.getBytes(StandardCharsets.UTF_8));
        }
        return CacheKeyUtil.hex(digest.digest());
    }
}
