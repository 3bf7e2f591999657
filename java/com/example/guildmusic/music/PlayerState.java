package com.example.guildmusic.music;

/**
 * Coarse state of a {@link MusicPlayer}, for display and tests.
 */
public enum PlayerState {
    /** No voice connection. */
    IDLE,
    CONNECTING,
    /** Connected but nothing is streaming. */
    CONNECTED,
    PLAYING,
    PAUSED
}
