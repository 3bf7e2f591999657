package com.example.guildmusic.music;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Per-guild track list with a playback cursor, loop mode and a short history.
 * <p>
 * The cursor is an index rather than a track reference because the same track may be queued
 * more than once. While the queue is non-empty, {@code 0 <= currentIndex < size} holds after
 * every operation. Not thread-safe: the owning {@link MusicPlayer} serialises access.
 */
public class MusicQueue {
    public static final int DEFAULT_MAX_SIZE = 500;
    public static final int HISTORY_SIZE = 50;

    private final List<Track> tracks = new ArrayList<>();
    private final Deque<Track> history = new ArrayDeque<>();
    private final int maxSize;
    private final Random random;
    private int currentIndex = 0;
    private LoopMode loopMode = LoopMode.OFF;

    public MusicQueue() {
        this(DEFAULT_MAX_SIZE);
    }

    public MusicQueue(int maxSize) {
        this(maxSize, new Random());
    }

    public MusicQueue(int maxSize, Random random) {
        this.maxSize = Math.max(1, maxSize);
        this.random = Objects.requireNonNull(random, "random");
    }

    public List<Track> getTracks() {
        return new ArrayList<>(tracks);
    }

    public Track getCurrent() {
        if (currentIndex >= 0 && currentIndex < tracks.size()) {
            return tracks.get(currentIndex);
        }
        return null;
    }

    public int getCurrentIndex() {
        return currentIndex;
    }

    public LoopMode getLoopMode() {
        return loopMode;
    }

    public void setLoopMode(LoopMode loopMode) {
        this.loopMode = loopMode == null ? LoopMode.OFF : loopMode;
    }

    public boolean isEmpty() {
        return tracks.isEmpty();
    }

    public int size() {
        return tracks.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Tracks after the current one.
     */
    public List<Track> getUpcoming() {
        if (currentIndex + 1 < tracks.size()) {
            return new ArrayList<>(tracks.subList(currentIndex + 1, tracks.size()));
        }
        return new ArrayList<>();
    }

    /**
     * Recently advanced-past tracks, oldest first.
     */
    public List<Track> getHistory() {
        return new ArrayList<>(history);
    }

    public long getTotalDuration() {
        long total = 0;
        for (Track track : tracks) {
            total += track.getDuration();
        }
        return total;
    }

    /**
     * Appends a track.
     *
     * @return false, without changing anything, if the queue is full
     */
    public boolean add(Track track) {
        Objects.requireNonNull(track, "track");
        if (tracks.size() >= maxSize) {
            return false;
        }
        tracks.add(track);
        return true;
    }

    /**
     * Appends as many tracks as fit, in order.
     *
     * @return how many were accepted
     */
    public int addMany(List<Track> toAdd) {
        int available = maxSize - tracks.size();
        int count = Math.max(0, Math.min(available, toAdd.size()));
        for (int i = 0; i < count; i++) {
            tracks.add(Objects.requireNonNull(toAdd.get(i), "track"));
        }
        return count;
    }

    /**
     * Inserts a track, never before the slot right after the current track.
     */
    public boolean insert(int index, Track track) {
        Objects.requireNonNull(track, "track");
        if (tracks.size() >= maxSize) {
            return false;
        }
        int actual = Math.max(currentIndex + 1, Math.min(index, tracks.size()));
        tracks.add(Math.min(actual, tracks.size()), track);
        return true;
    }

    /**
     * Removes the track at {@code index}, keeping the cursor on the same logical track where possible.
     *
     * @return the removed track, or null for an invalid index
     */
    public Track remove(int index) {
        if (index < 0 || index >= tracks.size()) {
            return null;
        }
        Track removed = tracks.remove(index);
        if (index < currentIndex) {
            currentIndex--;
        } else if (index == currentIndex && currentIndex >= tracks.size()) {
            currentIndex = Math.max(0, tracks.size() - 1);
        }
        return removed;
    }

    public void clear() {
        tracks.clear();
        currentIndex = 0;
    }

    /**
     * Drops everything after the current track. The current track and history are kept.
     *
     * @return number of tracks removed
     */
    public int clearUpcoming() {
        if (currentIndex + 1 < tracks.size()) {
            int removed = tracks.size() - currentIndex - 1;
            tracks.subList(currentIndex + 1, tracks.size()).clear();
            return removed;
        }
        return 0;
    }

    /**
     * Advances according to the loop mode.
     *
     * @return the new current track, or null when the queue is exhausted (cursor left as is)
     */
    public Track next() {
        if (tracks.isEmpty()) {
            return null;
        }

        Track current = getCurrent();
        if (current != null) {
            history.addLast(current);
            while (history.size() > HISTORY_SIZE) {
                history.removeFirst();
            }
        }

        if (loopMode == LoopMode.ONE) {
            return current;
        }
        if (currentIndex + 1 < tracks.size()) {
            currentIndex++;
            return getCurrent();
        }
        if (loopMode == LoopMode.ALL) {
            currentIndex = 0;
            return getCurrent();
        }
        return null;
    }

    public Track previous() {
        if (currentIndex > 0) {
            currentIndex--;
            return getCurrent();
        }
        if (loopMode == LoopMode.ALL && !tracks.isEmpty()) {
            currentIndex = tracks.size() - 1;
            return getCurrent();
        }
        return null;
    }

    public Track jump(int index) {
        if (index >= 0 && index < tracks.size()) {
            currentIndex = index;
            return getCurrent();
        }
        return null;
    }

    /**
     * Shuffles the tracks after the current one. Everything up to and including the current
     * track stays where it is.
     */
    public void shuffle() {
        if (currentIndex + 2 < tracks.size()) {
            Collections.shuffle(tracks.subList(currentIndex + 1, tracks.size()), random);
        }
    }

    public boolean move(int from, int to) {
        if (from < 0 || from >= tracks.size() || to < 0 || to >= tracks.size()) {
            return false;
        }

        Track track = tracks.remove(from);
        tracks.add(to, track);

        if (from == currentIndex) {
            currentIndex = to;
        } else if (from < currentIndex && currentIndex <= to) {
            currentIndex--;
        } else if (to <= currentIndex && currentIndex < from) {
            currentIndex++;
        }
        return true;
    }

    public QueueSnapshot getState() {
        return new QueueSnapshot(tracks, currentIndex, loopMode);
    }

    /**
     * Replaces the whole queue. Tracks beyond capacity are dropped and the index is clamped.
     */
    public void restoreState(List<Track> restored, int restoredIndex, LoopMode restoredLoopMode) {
        tracks.clear();
        int count = Math.min(restored.size(), maxSize);
        for (int i = 0; i < count; i++) {
            tracks.add(Objects.requireNonNull(restored.get(i), "track"));
        }
        currentIndex = Math.max(0, Math.min(restoredIndex, Math.max(0, tracks.size() - 1)));
        loopMode = restoredLoopMode == null ? LoopMode.OFF : restoredLoopMode;
    }

    public void restoreState(QueueSnapshot snapshot) {
        restoreState(snapshot.getTracks(), snapshot.getCurrentIndex(), snapshot.getLoopMode());
    }
}
