package org.foxesworld.glowframe.engine.peripheral.playlist;

import java.util.Locale;

/** Why a playlist run ended; carried as {@code reason} in {@code event.playlist.stopped}. */
public enum StopReason {
    COMPLETED,
    CANCELLED,
    INTERRUPTED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
