package com.example.guildmusic.music;

import com.example.guildmusic.voice.StreamCompletion;
import com.example.guildmusic.voice.VoiceConnection;
import com.example.guildmusic.voice.VoiceConnectionException;
import com.example.guildmusic.voice.VoiceTransport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Records what the player asks of the voice layer. Stopping a stream completes it, like lavaplayer does.
 */
class FakeVoiceTransport implements VoiceTransport {
    final List<Stream> streams = new ArrayList<>();
    int connectCalls;
    int moveCalls;
    int failConnects;
    // Hand back the same connection object on reconnect, as some transports do
    boolean reuseConnection;
    int stopCalls;
    int disconnectCalls;
    Double lastVolume;
    Boolean lastPaused;

    static final class Stream {
        final String url;
        final double volume;
        final long offset;
        private final StreamCompletion completion;
        private boolean completed;

        Stream(String url, double volume, long offset, StreamCompletion completion) {
            this.url = url;
            this.volume = volume;
            this.offset = offset;
            this.completion = completion;
        }

        void complete(Throwable error) {
            if (!completed) {
                completed = true;
                completion.onComplete(error);
            }
        }

        /** Fires again even if already completed, to check the player ignores it. */
        void completeAgain() {
            completion.onComplete(null);
        }
    }

    static final class FakeConnection implements VoiceConnection {
        final long guildId;
        long channelId;
        volatile boolean connected = true;

        FakeConnection(long guildId, long channelId) {
            this.guildId = guildId;
            this.channelId = channelId;
        }

        @Override
        public long getGuildId() {
            return guildId;
        }

        @Override
        public long getChannelId() {
            return channelId;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }
    }

    FakeConnection connection;

    @Override
    public VoiceConnection connect(long channelId, Duration timeout) throws VoiceConnectionException {
        connectCalls++;
        if (failConnects > 0) {
            failConnects--;
            throw new VoiceConnectionException("Timed out");
        }
        if (reuseConnection && connection != null) {
            connection.channelId = channelId;
            connection.connected = true;
        } else {
            connection = new FakeConnection(1L, channelId);
        }
        return connection;
    }

    @Override
    public void move(VoiceConnection voiceConnection, long channelId, Duration timeout) {
        moveCalls++;
        ((FakeConnection) voiceConnection).channelId = channelId;
    }

    @Override
    public void playStream(VoiceConnection voiceConnection, String sourceUrl, double volume, long startOffsetSeconds,
                           StreamCompletion completion) {
        streams.add(new Stream(sourceUrl, volume, startOffsetSeconds, completion));
    }

    @Override
    public void setVolume(VoiceConnection voiceConnection, double volume) {
        lastVolume = volume;
    }

    @Override
    public void setPaused(VoiceConnection voiceConnection, boolean paused) {
        lastPaused = paused;
    }

    @Override
    public void stop(VoiceConnection voiceConnection) {
        stopCalls++;
        if (!streams.isEmpty()) {
            latest().complete(null);
        }
    }

    @Override
    public void disconnect(VoiceConnection voiceConnection) {
        disconnectCalls++;
        ((FakeConnection) voiceConnection).connected = false;
    }

    Stream latest() {
        return streams.get(streams.size() - 1);
    }

    /** Ends the latest stream as if it played to the end. */
    void finishCurrent() {
        latest().complete(null);
    }
}
