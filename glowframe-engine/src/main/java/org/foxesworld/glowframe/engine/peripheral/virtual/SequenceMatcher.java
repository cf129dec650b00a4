package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.foxesworld.glowframe.engine.peripheral.Input;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One step of a sequence detector.
 *
 * @param predicate extra condition on the event, may be null
 */
public record SequenceMatcher(String eventType, Predicate<Input> predicate) {

    public SequenceMatcher {
        Objects.requireNonNull(eventType, "eventType");
    }

    public static SequenceMatcher of(String eventType) {
        return new SequenceMatcher(eventType, null);
    }

    boolean matches(Input event) {
        if (!eventType.equals(event.eventType())) return false;
        return predicate == null || predicate.test(event);
    }
}
