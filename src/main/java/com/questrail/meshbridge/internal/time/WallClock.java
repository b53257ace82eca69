package com.questrail.meshbridge.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for event timestamps and a device's last-seen time.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * Nothing in the bridge orders or expires state by it.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
