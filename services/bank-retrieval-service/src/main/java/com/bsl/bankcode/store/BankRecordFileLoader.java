package com.bsl.bankcode.store;

import com.bsl.bankcode.model.BankRecord;
import com.bsl.bankcode.model.InvalidBankRecordException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads delimiter separated bank line files. Two column layouts are accepted:
 * {@code code|name|clearing} (detected when the first column is a 12-digit code)
 * and {@code name|code|clearing}. Invalid and duplicate-code lines are skipped and counted.
 */
public class BankRecordFileLoader {
    private static final Logger logger = LoggerFactory.getLogger(BankRecordFileLoader.class);

    private final String delimiter;

    public BankRecordFileLoader(String delimiter) {
        this.delimiter = delimiter == null || delimiter.isEmpty() ? "|" : delimiter;
    }

    public LoadReport load(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read bank data file " + path, e);
        }
    }

    public LoadReport load(Reader source, String sourceName) {
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        List<BankRecord> records = new ArrayList<>();
        Set<String> seenCodes = new HashSet<>();
        int total = 0;
        int blank = 0;
        int invalid = 0;
        int duplicates = 0;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                total++;
                if (line.isBlank()) {
                    blank++;
                    continue;
                }
                String[] parts = line.split(Pattern.quote(delimiter), -1);
                if (parts.length < 3) {
                    invalid++;
                    logger.debug("bank_data_line_skipped line={} reason=too_few_fields", total);
                    continue;
                }
                String first = parts[0].trim();
                String name = BankRecord.isValidCode(first) ? parts[1] : parts[0];
                String code = BankRecord.isValidCode(first) ? first : parts[1];
                String clearing = parts[2];
                BankRecord record;
                try {
                    record = BankRecord.of(records.size() + 1L, name, code, clearing);
                } catch (InvalidBankRecordException e) {
                    invalid++;
                    logger.debug("bank_data_line_skipped line={} reason={}", total, e.getReason());
                    continue;
                }
                if (!seenCodes.add(record.getBankCode())) {
                    duplicates++;
                    continue;
                }
                records.add(record);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read bank data from " + sourceName, e);
        }
        logger.info(
            "bank_data_loaded source={} total_lines={} loaded={} invalid={} duplicates={} blank={}",
            sourceName, total, records.size(), invalid, duplicates, blank
        );
        return new LoadReport(sourceName, total, blank, invalid, duplicates, records);
    }
}
