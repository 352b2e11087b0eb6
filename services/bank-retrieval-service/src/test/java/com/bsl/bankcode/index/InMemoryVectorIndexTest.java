package com.bsl.bankcode.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryVectorIndexTest {

    private static VectorMetadata meta(String name, String code) {
        return new VectorMetadata(name, code, code, List.of());
    }

    @Test
    void returnsNearestBySquaredDistance() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.upsert(1L, List.of(1.0, 0.0), meta("甲银行", "100000000001"));
        index.upsert(2L, List.of(0.0, 1.0), meta("乙银行", "100000000002"));
        index.upsert(3L, List.of(0.6, 0.8), meta("丙银行", "100000000003"));

        List<VectorHit> hits = index.query(List.of(1.0, 0.0), 2);

        assertThat(hits).extracting(VectorHit::getRecordId).containsExactly(1L, 3L);
        assertThat(hits.get(0).getDistance()).isEqualTo(0.0);
        assertThat(hits.get(1).getDistance()).isCloseTo(0.8, org.assertj.core.data.Offset.offset(1e-6));
        assertThat(index.count()).isEqualTo(3);
        assertThat(index.dimension()).isEqualTo(2);
    }

    @Test
    void upsertReplacesExistingEntry() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.upsert(1L, List.of(1.0, 0.0), meta("甲银行", "100000000001"));
        index.upsert(1L, List.of(0.0, 1.0), meta("甲银行新", "100000000001"));

        assertThat(index.count()).isEqualTo(1);
        assertThat(index.metadata(1L)).map(VectorMetadata::getBankName).contains("甲银行新");
        assertThat(index.query(List.of(0.0, 1.0), 5).get(0).getDistance()).isEqualTo(0.0);
    }

    @Test
    void equalDistancesAreOrderedByRecordId() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.upsert(9L, List.of(0.0, 1.0), meta("甲", "100000000009"));
        index.upsert(4L, List.of(0.0, -1.0), meta("乙", "100000000004"));
        index.upsert(6L, List.of(0.0, 1.0), meta("丙", "100000000006"));

        assertThat(index.query(List.of(1.0, 0.0), 2)).extracting(VectorHit::getRecordId).containsExactly(4L, 6L);
    }

    @Test
    void rejectsDimensionMismatch() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.upsert(1L, List.of(1.0, 0.0), meta("甲银行", "100000000001"));

        assertThatThrownBy(() -> index.upsert(2L, List.of(1.0), meta("乙银行", "100000000002")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> index.query(List.of(1.0, 0.0, 0.0), 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(new InMemoryVectorIndex().query(List.of(1.0), 3)).isEmpty();
    }
}
