package com.example.guildmusic.storage;

import com.example.guildmusic.music.LoopMode;
import com.example.guildmusic.music.Track;

import java.util.Collections;
import java.util.List;

/**
 * A guild's queue as it was last saved.
 */
public final class StoredQueue {
    private final List<Track> tracks;
    private final int currentIndex;
    private final LoopMode loopMode;
    private final int volume;

    public StoredQueue(List<Track> tracks, int currentIndex, LoopMode loopMode, int volume) {
        this.tracks = Collections.unmodifiableList(List.copyOf(tracks));
        this.currentIndex = currentIndex;
        this.loopMode = loopMode == null ? LoopMode.OFF : loopMode;
        this.volume = volume;
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

    /**
     * Volume in percent, 0-200.
     */
    public int getVolume() {
        return volume;
    }
}
