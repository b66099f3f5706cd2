package com.myorg.lhub.eventing.quota;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

// Counters live in this JVM only: fine for a single gateway, wrong for several replicas.
@Slf4j
public class InMemoryQuotaCounterStore implements QuotaCounterStore {

    private record DayKey(String namespace, LocalDate day) {}

    private final ConcurrentHashMap<DayKey, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleaner;

    public InMemoryQuotaCounterStore(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleaner = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lhub-quota-cleaner");
            t.setDaemon(true);
            return t;
        });
        long periodMs = Math.max(1_000L, cleanupInterval.toMillis());
        cleaner.scheduleAtFixedRate(this::pruneSafe, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public Decision tryAcquire(String namespace, LocalDate day, long limit) {
        AtomicLong counter = counters.computeIfAbsent(new DayKey(namespace, day), k -> new AtomicLong());
        while (true) {
            long cur = counter.get();
            if (cur >= limit) {
                return new Decision(false, cur, limit);
            }
            if (counter.compareAndSet(cur, cur + 1)) {
                return new Decision(true, cur + 1, limit);
            }
        }
    }

    @Override
    public long used(String namespace, LocalDate day) {
        AtomicLong c = counters.get(new DayKey(namespace, day));
        return c == null ? 0 : c.get();
    }

    private void pruneSafe() {
        try {
            prune();
        } catch (Exception e) {
            log.warn("Quota counter cleanup failed", e);
        }
    }

    /** Drops counters older than yesterday; yesterday stays for late usage queries. */
    void prune() {
        LocalDate keepFrom = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1);
        counters.keySet().removeIf(k -> k.day().isBefore(keepFrom));
    }

    int size() {
        return counters.size();
    }

    @Override
    public void close() {
        cleaner.shutdownNow();
    }
}
