package com.questrail.selective.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for the start and end timestamps of a report.
 *
 * <p>This clock may jump (NTP, DST). It MUST NOT be used to compute
 * durations.</p>
 */
public interface WallClock
{
    Instant now();
}
