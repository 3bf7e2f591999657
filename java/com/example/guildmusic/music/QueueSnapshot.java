package com.example.guildmusic.music;

import java.util.Collections;
import java.util.List;

/**
 * Point-in-time copy of a queue: tracks, cursor and loop mode.
 */
public final class QueueSnapshot {
    private final List<Track> tracks;
    private final int currentIndex;
    private final LoopMode loopMode;

    public QueueSnapshot(List<Track> tracks, int currentIndex, LoopMode loopMode) {
        this.tracks = Collections.unmodifiableList(List.copyOf(tracks));
        this.currentIndex = currentIndex;
        this.loopMode = loopMode == null ? LoopMode.OFF : loopMode;
    }

    public List<Track> getTracks() {
        return tracks;
    }

    public int getCurrentIndex() {
        return currentIndex;
    }

    public LoopMode getLoopMode() {
        return loopMode;
    }

    public Track getCurrent() {
        if (currentIndex >= 0 && currentIndex < tracks.size()) {
            return tracks.get(currentIndex);
        }
        return null;
    }
}
