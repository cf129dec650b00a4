package org.foxesworld.glowframe.engine.stream;

/**
 * Upstream producer of values. Each {@link #connect} starts an independent run of the
 * underlying work, which is exactly what a {@link SharedStream} avoids repeating.
 */
@FunctionalInterface
public interface StreamSource<T> {

    StreamConnection connect(StreamObserver<? super T> downstream);
}
