package com.elssolution.livestxm.pipeline;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-item hand-off between a fast writer and a periodic reader.
 * {@link #offer} never blocks and overwrites whatever the reader has not taken yet;
 * {@link #poll} never blocks and empties the slot.
 */
public final class LatestValueSlot<T> {

    private final AtomicReference<T> pending = new AtomicReference<>();
    private final AtomicLong offered = new AtomicLong();
    private final AtomicLong overwritten = new AtomicLong();

    public void offer(T value) {
        Objects.requireNonNull(value, "value");
        offered.incrementAndGet();
        if (pending.getAndSet(value) != null) {
            overwritten.incrementAndGet();
        }
    }

    /** The newest unconsumed item, or empty if nothing new since the last poll. */
    public Optional<T> poll() {
        return Optional.ofNullable(pending.getAndSet(null));
    }

    /** Drop whatever is pending (used when a new scan starts). */
    public void clear() {
        pending.set(null);
    }

    public long offeredCount()     { return offered.get(); }
    public long overwrittenCount() { return overwritten.get(); }
}
