package com.example.guildmusic.storage;

import com.example.guildmusic.music.LoopMode;
import com.example.guildmusic.music.Track;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps queues and playlists in memory only; nothing survives a restart.
 * <p>
 * Tracks are held in their persisted map form, so what comes back out matches what
 * {@link JsonFileStorage} would return.
 */
public class InMemoryStorage implements QueueStorage {
    private final Map<Long, SavedQueue> queues = new ConcurrentHashMap<>();
    private final Map<Long, Map<String, List<Map<String, Object>>>> playlists = new ConcurrentHashMap<>();

    @Override
    public void saveQueue(long guildId, List<Track> tracks, int currentIndex, LoopMode loopMode, int volume) {
        queues.put(guildId, new SavedQueue(toMaps(tracks), currentIndex, loopMode, volume));
    }

    @Override
    public StoredQueue loadQueue(long guildId) {
        SavedQueue saved = queues.get(guildId);
        if (saved == null) {
            return null;
        }
        return new StoredQueue(fromMaps(saved.tracks), saved.currentIndex, saved.loopMode, saved.volume);
    }

    @Override
    public void clearGuildQueue(long guildId) {
        queues.remove(guildId);
    }

    @Override
    public void savePlaylist(long userId, String name, List<Track> tracks) {
        playlists.computeIfAbsent(userId, k -> new ConcurrentHashMap<>()).put(name, toMaps(tracks));
    }

    @Override
    public List<Track> loadPlaylist(long userId, String name) {
        Map<String, List<Map<String, Object>>> userPlaylists = playlists.get(userId);
        if (userPlaylists == null || !userPlaylists.containsKey(name)) {
            return null;
        }
        return fromMaps(userPlaylists.get(name));
    }

    @Override
    public List<String> listPlaylists(long userId) {
        Map<String, List<Map<String, Object>>> userPlaylists = playlists.get(userId);
        if (userPlaylists == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(new TreeMap<>(userPlaylists).keySet());
    }

    @Override
    public boolean deletePlaylist(long userId, String name) {
        Map<String, List<Map<String, Object>>> userPlaylists = playlists.get(userId);
        return userPlaylists != null && userPlaylists.remove(name) != null;
    }

    @Override
    public void close() {
        queues.clear();
        playlists.clear();
    }

    private static List<Map<String, Object>> toMaps(List<Track> tracks) {
        List<Map<String, Object>> maps = new ArrayList<>(tracks.size());
        for (Track track : tracks) {
            maps.add(track.toMap());
        }
        return maps;
    }

    private static List<Track> fromMaps(List<Map<String, Object>> maps) {
        List<Track> tracks = new ArrayList<>(maps.size());
        for (Map<String, Object> map : maps) {
            tracks.add(Track.fromMap(map));
        }
        return tracks;
    }

    private static final class SavedQueue {
        private final List<Map<String, Object>> tracks;
        private final int currentIndex;
        private final LoopMode loopMode;
        private final int volume;

        private SavedQueue(List<Map<String, Object>> tracks, int currentIndex, LoopMode loopMode, int volume) {
            this.tracks = tracks;
            this.currentIndex = currentIndex;
            this.loopMode = loopMode;
            this.volume = volume;
        }
    }
}
