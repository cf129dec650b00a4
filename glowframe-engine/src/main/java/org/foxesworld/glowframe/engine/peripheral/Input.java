package org.foxesworld.glowframe.engine.peripheral;

import java.time.Instant;
import java.util.Objects;

/**
 * One peripheral event. Immutable: {@code data} is frozen on construction.
 *
 * <p>Events are identified by type, producer and emission order, not by timestamp.</p>
 */
public record Input(String eventType, Object data, int producerId, Instant timestamp) {

    public Input {
        Objects.requireNonNull(eventType, "eventType");
        if (eventType.isBlank()) throw new IllegalArgumentException("eventType must not be blank");
        data = Payloads.freeze(data);
        if (timestamp == null) timestamp = Instant.now();
    }

    public static Input of(String eventType, Object data, int producerId) {
        return new Input(eventType, data, producerId, Instant.now());
    }

    public static Input of(String eventType, Object data) {
        return of(eventType, data, 0);
    }
}
