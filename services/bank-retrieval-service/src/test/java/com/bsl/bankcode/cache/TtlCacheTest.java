package com.bsl.bankcode.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class TtlCacheTest {

    @Test
    void entriesExpireAfterTtl() {
        AtomicLong now = new AtomicLong(1_000L);
        TtlCache<String> cache = new TtlCache<>(10, now::get);
        cache.put("k", "v", 500L);

        assertThat(cache.get("k")).contains("v");
        now.set(1_501L);
        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    void oldestEntriesAreEvictedFirst() {
        TtlCache<Integer> cache = new TtlCache<>(2);
        cache.put("a", 1, 60_000L);
        cache.put("b", 2, 60_000L);
        cache.put("c", 3, 60_000L);

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).contains(2);
        assertThat(cache.get("c")).contains(3);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void nonPositiveTtlIsIgnored() {
        TtlCache<Integer> cache = new TtlCache<>(2);
        cache.put("a", 1, 0L);

        assertThat(cache.get("a")).isEmpty();
    }
}
