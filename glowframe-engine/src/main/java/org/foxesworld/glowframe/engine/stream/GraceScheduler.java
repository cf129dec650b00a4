package org.foxesworld.glowframe.engine.stream;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs delayed stream tasks: ref-count disconnects, coalescing flushes and statistics logging.
 */
@FunctionalInterface
public interface GraceScheduler {

    interface Scheduled {
        void cancel();
    }

    Scheduled schedule(long delayMs, Runnable task);

    /** Shared daemon timer. */
    static GraceScheduler timer() {
        return Timer.INSTANCE;
    }

    final class Timer implements GraceScheduler {
        private static final Timer INSTANCE = new Timer();

        private final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "glowframe-stream-grace");
            t.setDaemon(true);
            return t;
        });

        private Timer() {}

        @Override
        public Scheduled schedule(long delayMs, Runnable task) {
            ScheduledFuture<?> f = exec.schedule(task, delayMs, TimeUnit.MILLISECONDS);
            return () -> f.cancel(false);
        }
    }
}
