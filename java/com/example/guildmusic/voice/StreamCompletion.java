package com.example.guildmusic.voice;

/**
 * Called once when a stream started by {@link VoiceTransport#playStream} is over.
 * <p>
 * May be invoked on any thread, typically the audio library's own.
 */
@FunctionalInterface
public interface StreamCompletion {

    /**
     * @param error why the stream failed, or null if it finished or was stopped
     */
    void onComplete(Throwable error);
}
