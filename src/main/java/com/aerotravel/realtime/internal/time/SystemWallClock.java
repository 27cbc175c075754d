package com.aerotravel.realtime.internal.time;

import java.time.Instant;

/**
 * Production {@link WallClock} reading {@link Instant#now()}.
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
