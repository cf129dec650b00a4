package org.foxesworld.glowframe.engine.stream;

/**
 * Subscriber side handle of a {@link SharedStream}.
 */
public interface StreamSubscription extends AutoCloseable {

    boolean isActive();

    /** Detach the subscriber. Idempotent. */
    @Override
    void close();
}
