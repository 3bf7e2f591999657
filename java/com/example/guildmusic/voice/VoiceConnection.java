package com.example.guildmusic.voice;

/**
 * Handle to one open voice connection, as returned by {@link VoiceTransport#connect}.
 */
public interface VoiceConnection {

    long getGuildId();

    long getChannelId();

    boolean isConnected();
}
