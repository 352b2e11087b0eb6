package com.bsl.bankcode.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.bsl.bankcode.model.BankRecord;
import java.io.StringReader;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class BankRecordFileLoaderTest {
    private final BankRecordFileLoader loader = new BankRecordFileLoader("|");

    @Test
    void loadsFixtureFileAndCountsRejects() {
        LoadReport report = loader.load(Path.of("src/test/resources/data/bank_records.unl"));

        assertThat(report.getLoadedCount()).isEqualTo(14);
        assertThat(report.getInvalidLines()).isEqualTo(1);
        assertThat(report.getDuplicateLines()).isEqualTo(1);
        assertThat(report.getBlankLines()).isEqualTo(1);
        assertThat(report.getRecords().get(0).getBankName()).isEqualTo("中国工商银行股份有限公司北京西单支行");
        assertThat(report.getRecords()).extracting(BankRecord::getId).startsWith(1L, 2L, 3L);
    }

    @Test
    void detectsNameFirstColumnOrder() {
        String data = "中国银行股份有限公司北京市分行|104100000004|104100000004\n"
            + "104100000012|中国银行股份有限公司北京西单支行|104100000012\n";

        LoadReport report = loader.load(new StringReader(data), "inline");

        assertThat(report.getRecords()).extracting(BankRecord::getBankCode)
            .containsExactly("104100000004", "104100000012");
        assertThat(report.getRecords()).extracting(BankRecord::getBankName)
            .containsExactly("中国银行股份有限公司北京市分行", "中国银行股份有限公司北京西单支行");
    }

    @Test
    void skipsLinesWithTooFewFields() {
        LoadReport report = loader.load(new StringReader("104100000004|只有两列\n"), "inline");

        assertThat(report.getLoadedCount()).isZero();
        assertThat(report.getInvalidLines()).isEqualTo(1);
    }
}
