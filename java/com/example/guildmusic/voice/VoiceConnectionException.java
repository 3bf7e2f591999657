package com.example.guildmusic.voice;

/**
 * Opening or moving a voice connection failed or timed out.
 */
public class VoiceConnectionException extends Exception {

    public VoiceConnectionException(String message) {
        super(message);
    }

    public VoiceConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
