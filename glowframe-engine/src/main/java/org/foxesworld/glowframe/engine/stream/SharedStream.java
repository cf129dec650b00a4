package org.foxesworld.glowframe.engine.stream;

/**
 * One upstream source multiplexed to many subscribers.
 */
public interface SharedStream<T> extends AutoCloseable {

    String name();

    StreamSubscription subscribe(StreamObserver<? super T> observer);

    int subscriberCount();

    /** @return true while the upstream source is connected */
    boolean isConnected();

    /** Number of values received from upstream. */
    long delivered();

    /** Number of times the upstream source has been connected. */
    long connects();

    /** Disconnect upstream and complete every subscriber. Further subscribers complete at once. */
    @Override
    void close();
}
