package org.foxesworld.glowframe.engine.peripheral.bus;

/**
 * A subscriber that threw while handling an event.
 */
public record HandlerFailure(Subscription subscription, Throwable error) {
}
