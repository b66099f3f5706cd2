package com.myorg.lhub.eventing.quota;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RedisQuotaCounterStoreTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    private final StringRedisTemplate redis = mock(StringRedisTemplate.class);
    private final RedisQuotaCounterStore store = new RedisQuotaCounterStore(redis, "lhub:quota");

    @Test
    void keyCarriesPrefixNamespaceAndDay() {
        assertThat(store.key("team-a", DAY)).isEqualTo("lhub:quota:team-a:2024-03-01");
    }

    @Test
    @SuppressWarnings("unchecked")
    void positiveScriptResultIsAnAdmission() {
        when(redis.execute(any(RedisScript.class), eq(List.of("lhub:quota:team-a:2024-03-01")), any(), any()))
                .thenReturn(7L);

        QuotaCounterStore.Decision d = store.tryAcquire("team-a", DAY, 10);

        assertThat(d.admitted()).isTrue();
        assertThat(d.used()).isEqualTo(7);
        assertThat(d.remaining()).isEqualTo(3);
    }

    @Test
    @SuppressWarnings("unchecked")
    void negativeScriptResultIsARefusalWithCurrentCount() {
        when(redis.execute(any(RedisScript.class), any(List.class), any(), any())).thenReturn(-11L);

        QuotaCounterStore.Decision d = store.tryAcquire("team-a", DAY, 10);

        assertThat(d.admitted()).isFalse();
        assertThat(d.used()).isEqualTo(10);
    }

    @Test
    @SuppressWarnings("unchecked")
    void usedReadsTheCounter() {
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.get("lhub:quota:team-a:2024-03-01")).thenReturn("42");

        assertThat(store.used("team-a", DAY)).isEqualTo(42);
        assertThat(store.used("team-b", DAY)).isZero();
        assertThat(store.shared()).isTrue();
    }
}
