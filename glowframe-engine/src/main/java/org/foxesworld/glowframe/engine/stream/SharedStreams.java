package org.foxesworld.glowframe.engine.stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.LongSupplier;

/**
 * Builds a {@link SharedStream} for a source from its {@link StreamShareSettings}.
 *
 * <p>The source is coalesced first when a coalesce window is configured, then shared with the
 * configured strategy. A stats interval wraps the result with periodic statistics logging.</p>
 */
public final class SharedStreams {

    private static final Logger log = LogManager.getLogger(SharedStreams.class);

    private SharedStreams() {}

    public static <T> SharedStream<T> share(StreamSource<T> source, String name, StreamShareSettings settings) {
        return share(source, name, settings, GraceScheduler.timer(), System::nanoTime);
    }

    public static <T> SharedStream<T> share(StreamSource<T> source,
                                            String name,
                                            StreamShareSettings settings,
                                            GraceScheduler grace,
                                            LongSupplier nanoClock) {
        SharedStream<T> shared = multicast(
                CoalescingSource.wrap(source, name, settings.coalesceWindowMs(), grace, nanoClock),
                name, settings, grace, nanoClock);
        if (settings.statsLogMs() <= 0) return shared;
        return new InstrumentedStream<>(shared, settings.statsLogMs(), grace);
    }

    private static <T> SharedStream<T> multicast(StreamSource<T> source,
                                                 String name,
                                                 StreamShareSettings settings,
                                                 GraceScheduler grace,
                                                 LongSupplier nanoClock) {
        ShareStrategy strategy = settings.strategy();
        int buffer = strategy.bufferSize(settings.replayBuffer());

        if (strategy.autoConnect()) {
            log.debug("Sharing {} with {} (buffer={}, window_ms={}, min_subscribers={})",
                    name, strategy, buffer, settings.replayWindowMs(), settings.autoConnectMinSubscribers());
            return new MulticastStream<>(name, source, MulticastStream.Policy.AUTO_CONNECT,
                    settings.autoConnectMinSubscribers(), 0, ConnectMode.LAZY,
                    buffer, settings.replayWindowMs(), grace, nanoClock);
        }

        log.debug("Sharing {} with {} (buffer={}, window_ms={}, refcount_grace_ms={}, min={}, mode={})",
                name, strategy, buffer, settings.replayWindowMs(), settings.refcountGraceMs(),
                settings.refcountMinSubscribers(), settings.connectMode());
        return new MulticastStream<>(name, source, MulticastStream.Policy.REF_COUNT,
                settings.refcountMinSubscribers(), settings.refcountGraceMs(), settings.connectMode(),
                buffer, settings.replayWindowMs(), grace, nanoClock);
    }
}
