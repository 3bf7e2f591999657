package com.example.guildmusic.storage;

import com.example.guildmusic.music.LoopMode;
import com.example.guildmusic.music.Track;

import java.util.List;

/**
 * Durable store for guild queues and user playlists.
 * <p>
 * Shared by all players. Each guild and each user is an independent key, last writer wins.
 * Stream urls are never stored.
 */
public interface QueueStorage {

    void saveQueue(long guildId, List<Track> tracks, int currentIndex, LoopMode loopMode, int volume) throws StorageException;

    /**
     * @return the saved queue, or null if the guild has none
     */
    StoredQueue loadQueue(long guildId) throws StorageException;

    void clearGuildQueue(long guildId) throws StorageException;

    /**
     * Creates or replaces the user's playlist called {@code name}.
     */
    void savePlaylist(long userId, String name, List<Track> tracks) throws StorageException;

    /**
     * @return the playlist's tracks, or null if the user has no playlist with that name
     */
    List<Track> loadPlaylist(long userId, String name) throws StorageException;

    List<String> listPlaylists(long userId) throws StorageException;

    /**
     * @return false if there was no such playlist
     */
    boolean deletePlaylist(long userId, String name) throws StorageException;

    void close();
}
