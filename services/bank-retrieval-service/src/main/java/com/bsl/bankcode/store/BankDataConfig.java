package com.bsl.bankcode.store;

import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BankDataProperties.class)
public class BankDataConfig {
    private static final Logger logger = LoggerFactory.getLogger(BankDataConfig.class);

    @Bean
    public BankRecordFileLoader bankRecordFileLoader(BankDataProperties properties) {
        return new BankRecordFileLoader(properties.getDelimiter());
    }

    @Bean
    public InMemoryBankRecordStore bankRecordStore(BankDataProperties properties, BankRecordFileLoader loader) {
        InMemoryBankRecordStore store = new InMemoryBankRecordStore();
        String filePath = properties.getFilePath();
        if (filePath == null || filePath.isBlank()) {
            logger.warn("bank_data_file_not_configured store=empty");
            return store;
        }
        Path path = Path.of(filePath);
        if (!Files.isRegularFile(path)) {
            logger.warn("bank_data_file_missing path={} store=empty", path);
            return store;
        }
        store.replaceAll(loader.load(path).getRecords());
        return store;
    }
}
