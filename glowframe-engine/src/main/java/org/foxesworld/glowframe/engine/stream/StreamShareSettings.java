package org.foxesworld.glowframe.engine.stream;

import org.foxesworld.glowframe.core.SettingsReader;

import java.util.Objects;

/**
 * Sharing configuration of one stream, resolved when the stream is built.
 *
 * @param replayBuffer              capacity of {@code replay_buffer} strategies
 * @param replayWindowMs            drop replayed values older than this; 0 keeps them
 * @param autoConnectMinSubscribers subscribers needed before an auto-connect stream connects
 * @param refcountMinSubscribers    subscribers needed to connect and stay connected
 * @param refcountGraceMs           delay before disconnecting once below the minimum
 * @param coalesceWindowMs          forward only the latest upstream value per window; 0 forwards all
 * @param statsLogMs                interval of the per-stream statistics log line; 0 disables it
 */
public record StreamShareSettings(
        ShareStrategy strategy,
        int replayBuffer,
        int replayWindowMs,
        int autoConnectMinSubscribers,
        int refcountMinSubscribers,
        int refcountGraceMs,
        ConnectMode connectMode,
        int coalesceWindowMs,
        int statsLogMs
) {

    public static final int DEFAULT_REPLAY_BUFFER = 16;

    public StreamShareSettings {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(connectMode, "connectMode");
        if (replayBuffer < 1) throw new IllegalArgumentException("replayBuffer must be >= 1: " + replayBuffer);
        if (replayWindowMs < 0) throw new IllegalArgumentException("replayWindowMs must be >= 0: " + replayWindowMs);
        if (autoConnectMinSubscribers < 1) {
            throw new IllegalArgumentException("autoConnectMinSubscribers must be >= 1: " + autoConnectMinSubscribers);
        }
        if (refcountMinSubscribers < 1) {
            throw new IllegalArgumentException("refcountMinSubscribers must be >= 1: " + refcountMinSubscribers);
        }
        if (refcountGraceMs < 0) throw new IllegalArgumentException("refcountGraceMs must be >= 0: " + refcountGraceMs);
        if (coalesceWindowMs < 0) throw new IllegalArgumentException("coalesceWindowMs must be >= 0: " + coalesceWindowMs);
        if (statsLogMs < 0) throw new IllegalArgumentException("statsLogMs must be >= 0: " + statsLogMs);
    }

    public static StreamShareSettings defaults() {
        return of(ShareStrategy.REPLAY_LATEST);
    }

    public static StreamShareSettings of(ShareStrategy strategy) {
        return new StreamShareSettings(strategy, DEFAULT_REPLAY_BUFFER, 0, 1, 1, 0, ConnectMode.LAZY, 0, 0);
    }

    public static StreamShareSettings from(SettingsReader r) {
        return new StreamShareSettings(
                r.enumValue("stream.share.strategy", ShareStrategy.class, ShareStrategy.REPLAY_LATEST),
                r.i32("stream.replay.buffer", DEFAULT_REPLAY_BUFFER, 1),
                r.i32("stream.replay.window.ms", 0, 0),
                r.i32("stream.auto.connect.min.subscribers", 1, 1),
                r.i32("stream.refcount.min.subscribers", 1, 1),
                r.i32("stream.refcount.grace.ms", 0, 0),
                r.enumValue("stream.connect.mode", ConnectMode.class, ConnectMode.LAZY),
                r.i32("stream.coalesce.window.ms", 0, 0),
                r.i32("stream.stats.log.ms", 0, 0)
        );
    }

    public StreamShareSettings withReplayBuffer(int size) {
        return new StreamShareSettings(strategy, size, replayWindowMs, autoConnectMinSubscribers,
                refcountMinSubscribers, refcountGraceMs, connectMode, coalesceWindowMs, statsLogMs);
    }

    public StreamShareSettings withReplayWindowMs(int ms) {
        return new StreamShareSettings(strategy, replayBuffer, ms, autoConnectMinSubscribers,
                refcountMinSubscribers, refcountGraceMs, connectMode, coalesceWindowMs, statsLogMs);
    }

    public StreamShareSettings withAutoConnect(int minSubscribers) {
        return new StreamShareSettings(strategy, replayBuffer, replayWindowMs, minSubscribers,
                refcountMinSubscribers, refcountGraceMs, connectMode, coalesceWindowMs, statsLogMs);
    }

    public StreamShareSettings withRefCount(int minSubscribers, int graceMs, ConnectMode mode) {
        return new StreamShareSettings(strategy, replayBuffer, replayWindowMs, autoConnectMinSubscribers,
                minSubscribers, graceMs, mode, coalesceWindowMs, statsLogMs);
    }

    public StreamShareSettings withCoalesceWindowMs(int ms) {
        return new StreamShareSettings(strategy, replayBuffer, replayWindowMs, autoConnectMinSubscribers,
                refcountMinSubscribers, refcountGraceMs, connectMode, ms, statsLogMs);
    }

    public StreamShareSettings withStatsLogMs(int ms) {
        return new StreamShareSettings(strategy, replayBuffer, replayWindowMs, autoConnectMinSubscribers,
                refcountMinSubscribers, refcountGraceMs, connectMode, coalesceWindowMs, ms);
    }
}
