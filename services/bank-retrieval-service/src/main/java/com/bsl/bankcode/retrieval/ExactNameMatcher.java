package com.bsl.bankcode.retrieval;

import com.bsl.bankcode.model.BankRecord;
import com.bsl.bankcode.model.RetrievalMethod;
import com.bsl.bankcode.model.RetrievalResult;
import com.bsl.bankcode.query.QueryEntities;
import com.bsl.bankcode.query.QueryText;
import com.bsl.bankcode.store.BankRecordStore;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Full-name shortcut: a record whose name equals the query (ignoring spacing,
 * punctuation and case) is returned with perfect scores.
 */
@Component
public class ExactNameMatcher {
    private static final Logger logger = LoggerFactory.getLogger(ExactNameMatcher.class);

    private final BankRecordStore recordStore;

    public ExactNameMatcher(BankRecordStore recordStore) {
        this.recordStore = recordStore;
    }

    public Optional<RetrievalResult> match(QueryEntities entities, String question) {
        String key = entities.getFullName().orElseGet(() -> QueryText.normalize(question));
        if (key.isEmpty()) {
            return Optional.empty();
        }
        Optional<BankRecord> record;
        try {
            record = recordStore.findByExactName(key);
        } catch (RuntimeException e) {
            logger.warn("exact_match_lookup_failed reason={}", e.getMessage(), e);
            return Optional.empty();
        }
        return record.map(hit -> new RetrievalResult(
            hit.getId(),
            hit.getBankName(),
            hit.getBankCode(),
            hit.getClearingCode(),
            1.0,
            1.0,
            1.0,
            RetrievalMethod.EXACT_FULL_NAME,
            List.of(hit.getBankName())
        ));
    }
}
