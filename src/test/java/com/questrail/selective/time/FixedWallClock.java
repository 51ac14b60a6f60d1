package com.questrail.selective.time;

import com.questrail.selective.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;

/**
 * Wall clock for tests: returns a set instant until moved.
 */
public final class FixedWallClock implements WallClock {

    private Instant now;

    public FixedWallClock(Instant start) {
        this.now = start;
    }

    @Override
    public Instant now() {
        return now;
    }

    public void advance(Duration delta) {
        now = now.plus(delta);
    }
}
