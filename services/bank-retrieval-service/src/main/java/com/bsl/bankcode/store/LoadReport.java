package com.bsl.bankcode.store;

import com.bsl.bankcode.model.BankRecord;
import java.util.List;

public class LoadReport {
    private final String source;
    private final int totalLines;
    private final int blankLines;
    private final int invalidLines;
    private final int duplicateLines;
    private final List<BankRecord> records;

    public LoadReport(String source, int totalLines, int blankLines, int invalidLines, int duplicateLines,
                      List<BankRecord> records) {
        this.source = source;
        this.totalLines = totalLines;
        this.blankLines = blankLines;
        this.invalidLines = invalidLines;
        this.duplicateLines = duplicateLines;
        this.records = List.copyOf(records);
    }

    public String getSource() {
        return source;
    }

    public int getTotalLines() {
        return totalLines;
    }

    public int getBlankLines() {
        return blankLines;
    }

    public int getInvalidLines() {
        return invalidLines;
    }

    public int getDuplicateLines() {
        return duplicateLines;
    }

    public int getLoadedCount() {
        return records.size();
    }

    public List<BankRecord> getRecords() {
        return records;
    }
}
