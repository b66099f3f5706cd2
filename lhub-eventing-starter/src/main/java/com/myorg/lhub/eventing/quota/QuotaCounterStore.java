package com.myorg.lhub.eventing.quota;

import java.time.LocalDate;

/**
 * Per-namespace event counters over UTC calendar days.
 *
 * <p>{@link #tryAcquire} is an atomic compare-and-increment: it admits exactly {@code limit}
 * calls per namespace and day and never counts a refused call.
 */
public interface QuotaCounterStore extends AutoCloseable {

    record Decision(boolean admitted, long used, long limit) {
        public long remaining() {
            return Math.max(0, limit - used);
        }
    }

    Decision tryAcquire(String namespace, LocalDate day, long limit);

    long used(String namespace, LocalDate day);

    /** True when counters are shared between processes. */
    default boolean shared() {
        return false;
    }

    @Override
    default void close() {
    }
}
