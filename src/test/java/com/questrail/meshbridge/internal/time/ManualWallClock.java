package com.questrail.meshbridge.internal.time;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Deterministic wall clock for tests.
 *
 * - Starts at a fixed instant
 * - Advances only when explicitly instructed
 */
public final class ManualWallClock implements WallClock {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private final AtomicReference<Instant> now = new AtomicReference<>(START);

    @Override
    public Instant now() {
        return now.get();
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Cannot advance clock backwards");
        }
        now.updateAndGet(t -> t.plus(delta));
    }
}
