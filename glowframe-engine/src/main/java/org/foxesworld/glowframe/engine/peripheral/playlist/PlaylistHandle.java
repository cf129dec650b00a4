package org.foxesworld.glowframe.engine.peripheral.playlist;

import java.util.Objects;

/** Registration of a playlist definition with an {@link EventPlaylistManager}. */
public record PlaylistHandle(String id) {

    public PlaylistHandle {
        Objects.requireNonNull(id, "id");
    }
}
