package com.bsl.bankcode.index;

import static org.assertj.core.api.Assertions.assertThat;

import com.bsl.bankcode.BankRecordFixtures;
import com.bsl.bankcode.model.BankRecord;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeywordInvertedIndexTest {
    private KeywordInvertedIndex index;

    @BeforeEach
    void setUp() {
        KeywordInvertedIndex.Builder builder = KeywordInvertedIndex.builder();
        for (BankRecord record : BankRecordFixtures.records()) {
            builder.add(record.getId(), VectorMetadata.of(record, BankKeywordExtractor.extract(record.getBankName())));
        }
        index = builder.build();
    }

    @Test
    void substringLookupIsExact() {
        assertThat(index.lookup("西单")).containsExactly(1L, 2L, 12L);
        assertThat(index.lookup("陆家嘴支行")).containsExactly(10L, 11L);
        assertThat(index.lookup("西单北")).isEmpty();
    }

    @Test
    void aliasKeywordsResolveThroughRecordKeywords() {
        assertThat(index.lookup("工行")).containsExactlyInAnyOrder(1L, 3L, 4L, 9L, 11L, 14L);
        assertThat(index.lookup("icbc")).containsExactlyInAnyOrder(1L, 3L, 4L, 9L, 11L, 14L);
    }

    @Test
    void singleCharacterAndBlankKeywords() {
        assertThat(index.lookup("招")).containsExactly(7L);
        assertThat(index.lookup(" ")).isEmpty();
        assertThat(KeywordInvertedIndex.empty().lookup("西单")).isEmpty();
    }

    @Test
    void postingSizeBoundsTheWalkWithoutVerifying() {
        assertThat(index.postingSize("西单")).isEqualTo(3);
        assertThat(index.postingSize("银行")).isEqualTo(14);
        assertThat(index.postingSize("农商")).isZero();
        assertThat(index.postingSize("")).isZero();
    }

    @Test
    void genericWordPostingSizeTracksCorpusSize() {
        KeywordInvertedIndex.Builder builder = KeywordInvertedIndex.builder();
        for (int i = 1; i <= 6000; i++) {
            BankRecord record = BankRecord.of(i, "测试银行第" + i + "支行", String.format("9%011d", i), String.format("9%011d", i));
            builder.add(record.getId(), VectorMetadata.of(record, List.of()));
        }
        KeywordInvertedIndex large = builder.build();

        assertThat(large.postingSize("银行")).isEqualTo(6000);
        assertThat(large.postingSize("第5999支")).isLessThan(6000);
        assertThat(large.lookup("第5999支行")).containsExactly(5999L);
    }
}
