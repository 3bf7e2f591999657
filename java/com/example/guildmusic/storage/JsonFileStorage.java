package com.example.guildmusic.storage;

import com.example.guildmusic.BotLogger;
import com.example.guildmusic.music.LoopMode;
import com.example.guildmusic.music.Track;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stores queues and playlists as JSON files under a data directory.
 * <pre>
 * data/queues/&lt;guildId&gt;.json      one guild's queue
 * data/playlists/&lt;userId&gt;.json    all playlists of one user, by name
 * </pre>
 * Files are written to a temp file first and then moved over the old one.
 */
public class JsonFileStorage implements QueueStorage {
    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<Map<String, Object>>() {
    };
    private static final TypeReference<Map<String, List<Map<String, Object>>>> PLAYLISTS =
            new TypeReference<Map<String, List<Map<String, Object>>>>() {
            };

    private final Path queueDir;
    private final Path playlistDir;
    private final ObjectMapper objectMapper;

    public JsonFileStorage(Path dataDir) throws StorageException {
        this.queueDir = dataDir.resolve("queues");
        this.playlistDir = dataDir.resolve("playlists");
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            Files.createDirectories(queueDir);
            Files.createDirectories(playlistDir);
        } catch (IOException e) {
            throw new StorageException("Could not create data directory " + dataDir, e);
        }
        BotLogger.info("Using JSON storage in " + dataDir.toAbsolutePath());
    }

    @Override
    public synchronized void saveQueue(long guildId, List<Track> tracks, int currentIndex, LoopMode loopMode, int volume)
            throws StorageException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("guild_id", guildId);
        document.put("tracks", toMaps(tracks));
        document.put("current_index", currentIndex);
        document.put("loop_mode", (loopMode == null ? LoopMode.OFF : loopMode).getValue());
        document.put("volume", volume);
        document.put("updated_at", Instant.now().toString());
        write(queueFile(guildId), document);
        BotLogger.storage("Saved queue for guild " + guildId + " (" + tracks.size() + " tracks)");
    }

    @Override
    public synchronized StoredQueue loadQueue(long guildId) throws StorageException {
        Path file = queueFile(guildId);
        if (!Files.exists(file)) {
            return null;
        }
        Map<String, Object> document = read(file, DOCUMENT);
        if (document == null) {
            return null;
        }

        List<Track> tracks = new ArrayList<>();
        Object rawTracks = document.get("tracks");
        if (rawTracks instanceof List) {
            for (Object raw : (List<?>) rawTracks) {
                if (raw instanceof Map) {
                    @SuppressWarnings("unchecked")
                    Map<String, ?> map = (Map<String, ?>) raw;
                    tracks.add(Track.fromMap(map));
                }
            }
        }
        int currentIndex = intValue(document.get("current_index"), 0);
        LoopMode loopMode = LoopMode.fromValue(String.valueOf(document.get("loop_mode")));
        int volume = intValue(document.get("volume"), 100);
        return new StoredQueue(tracks, currentIndex, loopMode, volume);
    }

    @Override
    public synchronized void clearGuildQueue(long guildId) throws StorageException {
        try {
            Files.deleteIfExists(queueFile(guildId));
        } catch (IOException e) {
            throw new StorageException("Could not delete queue for guild " + guildId, e);
        }
    }

    @Override
    public synchronized void savePlaylist(long userId, String name, List<Track> tracks) throws StorageException {
        Map<String, List<Map<String, Object>>> playlists = readPlaylists(userId);
        playlists.put(name, toMaps(tracks));
        write(playlistFile(userId), playlists);
    }

    @Override
    public synchronized List<Track> loadPlaylist(long userId, String name) throws StorageException {
        List<Map<String, Object>> maps = readPlaylists(userId).get(name);
        if (maps == null) {
            return null;
        }
        List<Track> tracks = new ArrayList<>(maps.size());
        for (Map<String, Object> map : maps) {
            tracks.add(Track.fromMap(map));
        }
        return tracks;
    }

    @Override
    public synchronized List<String> listPlaylists(long userId) throws StorageException {
        return new ArrayList<>(readPlaylists(userId).keySet());
    }

    @Override
    public synchronized boolean deletePlaylist(long userId, String name) throws StorageException {
        Map<String, List<Map<String, Object>>> playlists = readPlaylists(userId);
        if (playlists.remove(name) == null) {
            return false;
        }
        if (playlists.isEmpty()) {
            try {
                Files.deleteIfExists(playlistFile(userId));
            } catch (IOException e) {
                throw new StorageException("Could not delete playlists of user " + userId, e);
            }
        } else {
            write(playlistFile(userId), playlists);
        }
        return true;
    }

    @Override
    public void close() {
        // every write is flushed as it happens
    }

    private Map<String, List<Map<String, Object>>> readPlaylists(long userId) throws StorageException {
        Path file = playlistFile(userId);
        Map<String, List<Map<String, Object>>> playlists = new TreeMap<>();
        if (Files.exists(file)) {
            Map<String, List<Map<String, Object>>> stored = read(file, PLAYLISTS);
            if (stored != null) {
                playlists.putAll(stored);
            }
        }
        return playlists;
    }

    private <T> T read(Path file, TypeReference<T> type) throws StorageException {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new StorageException("Could not read " + file, e);
        }
    }

    private void write(Path file, Object document) throws StorageException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Could not write " + file, e);
        }
    }

    private Path queueFile(long guildId) {
        return queueDir.resolve(guildId + ".json");
    }

    private Path playlistFile(long userId) {
        return playlistDir.resolve(userId + ".json");
    }

    private static List<Map<String, Object>> toMaps(List<Track> tracks) {
        List<Map<String, Object>> maps = new ArrayList<>(tracks.size());
        for (Track track : tracks) {
            maps.add(track.toMap());
        }
        return maps;
    }

    private static int intValue(Object value, int fallback) {
        return value instanceof Number ? ((Number) value).intValue() : fallback;
    }
}
