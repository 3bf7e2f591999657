package com.example.guildmusic;

import com.sedmelluq.discord.lavaplayer.player.AudioPlayer;
import com.sedmelluq.discord.lavaplayer.track.playback.AudioFrame;
import net.dv8tion.jda.api.audio.AudioSendHandler;

import java.nio.ByteBuffer;

/**
 * Feeds opus frames from a lavaplayer {@link AudioPlayer} into a JDA voice connection.
 */
public class AudioPlayerSendHandler implements AudioSendHandler {
    private final AudioPlayer audioPlayer;
    private volatile AudioFrame lastFrame;
    private volatile boolean providerFailed;

    public AudioPlayerSendHandler(AudioPlayer audioPlayer) {
        this.audioPlayer = audioPlayer;
    }

    @Override
    public synchronized boolean canProvide() {
        try {
            lastFrame = audioPlayer.provide();
            providerFailed = false;
            return lastFrame != null;
        } catch (RuntimeException e) {
            // Called every 20ms, so only report the first failure of a run
            if (!providerFailed) {
                BotLogger.warn("Error providing audio frame", e);
                providerFailed = true;
            }
            return false;
        }
    }

    @Override
    public ByteBuffer provide20MsAudio() {
        return ByteBuffer.wrap(lastFrame.getData());
    }

    @Override
    public boolean isOpus() {
        return true;
    }
}
