package com.bsl.bankcode.store;

/**
 * Record count and content checksum taken from the same store contents.
 */
public final class StoreFingerprint {
    private final int count;
    private final String checksum;

    public StoreFingerprint(int count, String checksum) {
        this.count = count;
        this.checksum = checksum == null ? "" : checksum;
    }

    public int getCount() {
        return count;
    }

    public String getChecksum() {
        return checksum;
    }
}
