package com.escada.rentbot.subscription;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionCacheTest {

    private static final long USER = 100L;
    private static final long T = 1_700_000_000_000L;

    private SubscriptionCache cache;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        cache = new SubscriptionCache(Duration.ofSeconds(300));
        calls = new AtomicInteger();
    }

    private MembershipCheck answering(boolean member) {
        return userId -> {
            calls.incrementAndGet();
            return member;
        };
    }

    @Test
    void shouldServeCachedValueWithinTtl() {
        assertThat(cache.isSubscribed(USER, T, answering(true))).isTrue();
        assertThat(cache.isSubscribed(USER, T + 299_999, answering(false))).isTrue();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void shouldAskAgainWhenEntryIsStale() {
        cache.isSubscribed(USER, T, answering(true));

        assertThat(cache.isSubscribed(USER, T + 300_100, answering(false))).isFalse();
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void shouldCacheNegativeAnswers() {
        assertThat(cache.isSubscribed(USER, T, answering(false))).isFalse();
        assertThat(cache.isSubscribed(USER, T + 1_000, answering(true))).isFalse();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void shouldFailClosedAndNotCacheErrors() {
        MembershipCheck failing = userId -> {
            calls.incrementAndGet();
            throw new IllegalStateException("chat not found");
        };

        assertThat(cache.isSubscribed(USER, T, failing)).isFalse();
        assertThat(cache.size()).isZero();

        assertThat(cache.isSubscribed(USER, T + 1, answering(true))).isTrue();
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void shouldDropEntriesOnClear() {
        cache.isSubscribed(USER, T, answering(true));
        cache.isSubscribed(USER + 1, T, answering(true));
        assertThat(cache.size()).isEqualTo(2);

        cache.clear();

        assertThat(cache.size()).isZero();
        cache.isSubscribed(USER, T + 1, answering(true));
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void shouldEvictStaleEntriesOnLaterChecks() {
        cache.isSubscribed(1L, T, answering(true));
        cache.isSubscribed(2L, T + 1_000, answering(false));
        assertThat(cache.size()).isEqualTo(2);

        cache.isSubscribed(3L, T + 301_000, answering(true));

        assertThat(cache.size()).isEqualTo(1);
    }
}
