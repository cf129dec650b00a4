package org.foxesworld.glowframe.engine.stream;

public enum ShareStrategy {
    SHARE(false, false),
    SHARE_AUTO_CONNECT(false, true),
    REPLAY_LATEST(true, false),
    REPLAY_LATEST_AUTO_CONNECT(true, true),
    REPLAY_BUFFER(true, false),
    REPLAY_BUFFER_AUTO_CONNECT(true, true);

    private final boolean replays;
    private final boolean autoConnect;

    ShareStrategy(boolean replays, boolean autoConnect) {
        this.replays = replays;
        this.autoConnect = autoConnect;
    }

    public boolean replays() {
        return replays;
    }

    public boolean autoConnect() {
        return autoConnect;
    }

    /** Replay buffer capacity for this strategy given the configured buffer size. */
    public int bufferSize(int configured) {
        if (!replays) return 0;
        return (this == REPLAY_LATEST || this == REPLAY_LATEST_AUTO_CONNECT) ? 1 : configured;
    }
}
