package org.foxesworld.glowframe.engine.peripheral.playlist;

import org.foxesworld.glowframe.engine.peripheral.Payloads;

import java.time.Duration;
import java.util.Objects;

/**
 * One scheduled emission of a playlist.
 *
 * @param offset   delay from the start of the run, not negative
 * @param repeat   number of emissions, at least 1
 * @param interval gap between repeated emissions; required and positive when {@code repeat > 1}
 */
public record PlaylistStep(
        String eventType,
        Object data,
        Duration offset,
        int repeat,
        Duration interval,
        int producerId
) {

    public PlaylistStep {
        Objects.requireNonNull(eventType, "eventType");
        if (offset == null) offset = Duration.ZERO;
        if (offset.isNegative()) throw new IllegalArgumentException("PlaylistStep.offset must be non-negative");
        if (repeat < 1) throw new IllegalArgumentException("PlaylistStep.repeat must be at least 1");
        if (repeat > 1 && (interval == null || interval.isNegative() || interval.isZero())) {
            throw new IllegalArgumentException("PlaylistStep.interval must be positive when repeat > 1");
        }
        data = Payloads.freeze(data);
    }

    public static PlaylistStep at(Duration offset, String eventType, Object data) {
        return new PlaylistStep(eventType, data, offset, 1, null, 0);
    }

    public static PlaylistStep repeated(Duration offset, String eventType, Object data, int repeat, Duration interval) {
        return new PlaylistStep(eventType, data, offset, repeat, interval, 0);
    }

    public PlaylistStep withProducer(int producerId) {
        return new PlaylistStep(eventType, data, offset, repeat, interval, producerId);
    }
}
