package org.foxesworld.glowframe.engine.render.state;

import org.foxesworld.glowframe.engine.stream.ShareStrategy;
import org.foxesworld.glowframe.engine.stream.SharedStream;
import org.foxesworld.glowframe.engine.stream.SharedStreams;
import org.foxesworld.glowframe.engine.stream.StreamObserver;
import org.foxesworld.glowframe.engine.stream.StreamShareSettings;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class StateHolderTest {

    private final AtomicReference<StreamObserver<? super String>> upstream = new AtomicReference<>();

    private SharedStream<String> stream(ShareStrategy strategy) {
        return SharedStreams.share(downstream -> {
            upstream.set(downstream);
            return () -> upstream.set(null);
        }, "state", StreamShareSettings.of(strategy));
    }

    @Test
    void updateReplacesSnapshotWithoutMutatingIt() {
        StateHolder<String> holder = new StateHolder<>();
        holder.initialize("a");
        String before = holder.get();

        holder.update(s -> s + "b");

        assertEquals("a", before);
        assertEquals("ab", holder.require());
    }

    @Test
    void updateBeforeInitializeFails() {
        StateHolder<String> holder = new StateHolder<>();

        assertThrows(IllegalStateException.class, () -> holder.update(s -> s));
        assertThrows(IllegalStateException.class, holder::require);
        assertNull(holder.get());
    }

    @Test
    void boundStreamReplacesSnapshot() {
        SharedStream<String> s = stream(ShareStrategy.SHARE);
        StateHolder<String> holder = new StateHolder<>();

        holder.bind(s, () -> "fallback");
        assertEquals("fallback", holder.get());
        assertTrue(holder.isBound());

        upstream.get().onNext("live");
        assertEquals("live", holder.get());
    }

    @Test
    void replayedValueWinsOverFallback() {
        SharedStream<String> s = stream(ShareStrategy.REPLAY_LATEST);
        s.subscribe(v -> {});
        upstream.get().onNext("replayed");

        StateHolder<String> holder = new StateHolder<>();
        holder.bind(s, () -> "fallback");

        assertEquals("replayed", holder.get());
    }

    @Test
    void streamWithoutValueOrFallbackFailsAndUnsubscribes() {
        SharedStream<String> s = stream(ShareStrategy.SHARE);
        StateHolder<String> holder = new StateHolder<>();

        assertThrows(IllegalStateException.class, () -> holder.bind(s, null));
        assertEquals(0, s.subscriberCount());
        assertFalse(holder.isBound());
    }

    @Test
    void resetDisposesSubscriptionAndClears() {
        SharedStream<String> s = stream(ShareStrategy.SHARE);
        StateHolder<String> holder = new StateHolder<>();
        holder.bind(s, () -> "x");

        holder.reset();

        assertNull(holder.get());
        assertEquals(0, s.subscriberCount());
        assertFalse(s.isConnected());
    }
}
