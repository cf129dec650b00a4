package org.foxesworld.glowframe.engine.perf;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.core.SettingsReader;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Per-frame block timings with rolling-window stats (avg/p50/p95/max, spike count), summarised
 * to the log every N frames.
 *
 * <p>Usage:</p>
 * <pre>
 *   long t = profiler.begin("render.compose");
 *   ... work ...
 *   profiler.end("render.compose", t);
 *   profiler.endFrame(frameMs);
 * </pre>
 *
 * <p>Disabled profilers return immediately from every call. Single-threaded: call from the
 * render loop only.</p>
 */
public final class FrameProfiler {

    private static final Logger log = LogManager.getLogger(FrameProfiler.class);

    /**
     * @param windowFrames       rolling window size per block, at least 60
     * @param summaryEveryFrames summary period; 0 disables summaries
     * @param spikeThresholdNanos a sample at or above this counts as a spike; 0 disables
     */
    public record Config(boolean enabled, int windowFrames, int summaryEveryFrames, long spikeThresholdNanos) {

        public Config {
            if (windowFrames < 1) throw new IllegalArgumentException("windowFrames must be >= 1");
            if (summaryEveryFrames < 0) throw new IllegalArgumentException("summaryEveryFrames must be >= 0");
            if (spikeThresholdNanos < 0) throw new IllegalArgumentException("spikeThresholdNanos must be >= 0");
        }

        public static Config defaults() {
            return new Config(false, 600, 120, 1_000_000L);
        }

        public static Config from(SettingsReader r) {
            return new Config(
                    r.bool("perf.enabled", false),
                    r.i32("perf.window.frames", 600, 1),
                    r.i32("perf.summary.every.frames", 120, 0),
                    (long) (r.f64("perf.spike.threshold.ms", 1.0, 0.0, 60_000.0) * 1_000_000L));
        }
    }

    private final Config cfg;
    private final LongSupplier nanoClock;
    private final Map<String, StatWindow> windows = new LinkedHashMap<>();
    private long frameIndex;

    public FrameProfiler(Config cfg) {
        this(cfg, System::nanoTime);
    }

    public FrameProfiler(Config cfg, LongSupplier nanoClock) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    public static FrameProfiler disabled() {
        return new FrameProfiler(Config.defaults());
    }

    public boolean enabled() {
        return cfg.enabled();
    }

    /** @return start time, or 0 when disabled */
    public long begin(String name) {
        if (!cfg.enabled()) return 0L;
        return nanoClock.getAsLong();
    }

    public void end(String name, long startNanos) {
        if (!cfg.enabled() || startNanos == 0L || name == null || name.isEmpty()) return;
        record(name, nanoClock.getAsLong() - startNanos);
    }

    /** Add a measured duration directly. */
    public void record(String name, long nanos) {
        if (!cfg.enabled()) return;
        windows.computeIfAbsent(name, n -> new StatWindow(cfg.windowFrames(), cfg.spikeThresholdNanos())).add(nanos);
    }

    public void endFrame(double frameMs) {
        if (!cfg.enabled()) return;
        frameIndex++;
        if (cfg.summaryEveryFrames() > 0 && frameIndex % cfg.summaryEveryFrames() == 0) {
            logSummary(frameMs);
        }
    }

    public long frameIndex() {
        return frameIndex;
    }

    /** @return current stats per block, in first-seen order */
    public Map<String, Summary> summaries() {
        Map<String, Summary> out = new LinkedHashMap<>();
        windows.forEach((name, w) -> {
            if (w.count > 0) out.put(name, w.summarize());
        });
        return Collections.unmodifiableMap(out);
    }

    private void logSummary(double frameMs) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("[perf] frame=").append(frameIndex)
                .append(" dt=").append(String.format("%.3fms", frameMs))
                .append(" window=").append(cfg.windowFrames());
        summaries().forEach((name, s) -> sb.append('\n').append("  ")
                .append(padRight(name, 20))
                .append(" avg=").append(formatMs(s.avgNanos()))
                .append(" p50=").append(formatMs(s.p50Nanos()))
                .append(" p95=").append(formatMs(s.p95Nanos()))
                .append(" max=").append(formatMs(s.maxNanos()))
                .append(" spikes=").append(s.spikes()));
        log.info(sb.toString());
    }

    private static String padRight(String s, int n) {
        if (s.length() >= n) return s;
        StringBuilder sb = new StringBuilder(n).append(s);
        while (sb.length() < n) sb.append(' ');
        return sb.toString();
    }

    private static String formatMs(long nanos) {
        return String.format("%.3fms", nanos / 1_000_000.0);
    }

    public record Summary(long avgNanos, long p50Nanos, long p95Nanos, long maxNanos, long spikes) {}

    // ---------------- rolling window ----------------

    static final class StatWindow {
        final long[] ring;
        final long[] scratch;
        final long spikeThreshold;

        int idx;
        int count;
        long sum;
        long spikes;

        StatWindow(int windowSize, long spikeThreshold) {
            int sz = Math.max(60, windowSize);
            this.ring = new long[sz];
            this.scratch = new long[sz];
            this.spikeThreshold = spikeThreshold;
        }

        void add(long nanos) {
            if (count == ring.length) {
                sum -= ring[idx];
            } else {
                count++;
            }
            ring[idx] = nanos;
            sum += nanos;

            // cumulative, not rolling
            if (spikeThreshold > 0 && nanos >= spikeThreshold) spikes++;

            idx = (idx + 1) % ring.length;
        }

        Summary summarize() {
            int n = count;
            if (n == 0) return new Summary(0, 0, 0, 0, 0);

            long max = 0;
            for (int i = 0; i < n; i++) {
                scratch[i] = ring[i];
                if (ring[i] > max) max = ring[i];
            }
            Arrays.sort(scratch, 0, n);
            return new Summary(sum / n, percentileSorted(scratch, n, 0.50), percentileSorted(scratch, n, 0.95), max, spikes);
        }

        /** Nearest rank. */
        static long percentileSorted(long[] sorted, int n, double q) {
            int rank = (int) Math.ceil(q * n) - 1;
            return sorted[Math.max(0, Math.min(n - 1, rank))];
        }
    }
}
