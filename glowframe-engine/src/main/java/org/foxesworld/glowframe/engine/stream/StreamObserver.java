package org.foxesworld.glowframe.engine.stream;

@FunctionalInterface
public interface StreamObserver<T> {

    void onNext(T value);

    default void onError(Throwable error) {}

    default void onComplete() {}
}
