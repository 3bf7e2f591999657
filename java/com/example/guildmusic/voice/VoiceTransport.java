package com.example.guildmusic.voice;

import java.time.Duration;

/**
 * Voice connections and audio streaming for the players.
 */
public interface VoiceTransport {

    VoiceConnection connect(long channelId, Duration timeout) throws VoiceConnectionException;

    /**
     * Moves an open connection to another channel of the same guild.
     */
    void move(VoiceConnection connection, long channelId, Duration timeout) throws VoiceConnectionException;

    /**
     * Starts streaming {@code sourceUrl}, replacing whatever was playing.
     *
     * @param volume             multiplier, 1.0 is unchanged
     * @param startOffsetSeconds where to start in the source, 0 for the beginning
     * @param completion         told when this stream ends, fails or is stopped
     */
    void playStream(VoiceConnection connection, String sourceUrl, double volume, long startOffsetSeconds,
                    StreamCompletion completion);

    void setVolume(VoiceConnection connection, double volume);

    void setPaused(VoiceConnection connection, boolean paused);

    void stop(VoiceConnection connection);

    void disconnect(VoiceConnection connection);
}
