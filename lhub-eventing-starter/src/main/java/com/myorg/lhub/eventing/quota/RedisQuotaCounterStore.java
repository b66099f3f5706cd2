package com.myorg.lhub.eventing.quota;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Counters shared by every gateway replica. One key per namespace and day, expiring two days
 * after its first increment.
 */
public class RedisQuotaCounterStore implements QuotaCounterStore {

    private static final Duration KEY_TTL = Duration.ofHours(48);

    // >= 0: admitted, new count. < 0: refused, count = -r - 1
    private static final DefaultRedisScript<Long> ACQUIRE_SCRIPT = new DefaultRedisScript<>(
            "local cur = tonumber(redis.call('GET', KEYS[1]) or '0'); " +
                    "if cur >= tonumber(ARGV[1]) then return -cur - 1 end " +
                    "local v = redis.call('INCR', KEYS[1]); " +
                    "if v == 1 then redis.call('PEXPIRE', KEYS[1], ARGV[2]) end " +
                    "return v",
            Long.class
    );

    private final StringRedisTemplate redis;
    private final String keyPrefix;

    public RedisQuotaCounterStore(StringRedisTemplate redis, String keyPrefix) {
        this.redis = redis;
        this.keyPrefix = normalizePrefix(keyPrefix);
    }

    String key(String namespace, LocalDate day) {
        return keyPrefix + namespace + ":" + day;
    }

    @Override
    public Decision tryAcquire(String namespace, LocalDate day, long limit) {
        Long res = redis.execute(
                ACQUIRE_SCRIPT,
                List.of(key(namespace, day)),
                String.valueOf(limit),
                String.valueOf(KEY_TTL.toMillis())
        );
        if (res == null) {
            throw new IllegalStateException("quota script returned no result for " + namespace);
        }
        long r = res;
        return r >= 0 ? new Decision(true, r, limit) : new Decision(false, -r - 1, limit);
    }

    @Override
    public long used(String namespace, LocalDate day) {
        String v = redis.opsForValue().get(key(namespace, day));
        return v == null ? 0 : Long.parseLong(v);
    }

    @Override
    public boolean shared() {
        return true;
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";
        String p = prefix.trim();
        return p.endsWith(":") ? p : (p + ":");
    }
}
