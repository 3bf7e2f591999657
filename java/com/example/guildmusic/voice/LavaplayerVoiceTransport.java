package com.example.guildmusic.voice;

import com.example.guildmusic.AudioPlayerSendHandler;
import com.example.guildmusic.BotLogger;
import com.sedmelluq.discord.lavaplayer.player.AudioConfiguration;
import com.sedmelluq.discord.lavaplayer.player.AudioLoadResultHandler;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayer;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.player.DefaultAudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.player.event.AudioEventAdapter;
import com.sedmelluq.discord.lavaplayer.source.AudioSourceManagers;
import com.sedmelluq.discord.lavaplayer.tools.FriendlyException;
import com.sedmelluq.discord.lavaplayer.track.AudioPlaylist;
import com.sedmelluq.discord.lavaplayer.track.AudioTrack;
import com.sedmelluq.discord.lavaplayer.track.AudioTrackEndReason;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.audio.hooks.ConnectionStatus;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.middleman.AudioChannel;
import net.dv8tion.jda.api.managers.AudioManager;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link VoiceTransport} on top of JDA voice connections and lavaplayer.
 * <p>
 * Each guild gets one lavaplayer {@link AudioPlayer}, attached to the guild's
 * {@link AudioManager} through an {@link AudioPlayerSendHandler}. Stream urls are loaded with
 * lavaplayer's HTTP source.
 */
public class LavaplayerVoiceTransport implements VoiceTransport {
    private static final long POLL_INTERVAL_MS = 100;

    private final JDA jda;
    private final AudioPlayerManager playerManager;
    private final Map<Long, Connection> connections = new ConcurrentHashMap<>();

    public LavaplayerVoiceTransport(JDA jda) {
        this(jda, createPlayerManager());
    }

    LavaplayerVoiceTransport(JDA jda, AudioPlayerManager playerManager) {
        this.jda = jda;
        this.playerManager = playerManager;
    }

    private static AudioPlayerManager createPlayerManager() {
        AudioPlayerManager playerManager = new DefaultAudioPlayerManager();
        playerManager.getConfiguration().setResamplingQuality(AudioConfiguration.ResamplingQuality.MEDIUM);
        AudioSourceManagers.registerRemoteSources(playerManager);
        return playerManager;
    }

    @Override
    public VoiceConnection connect(long channelId, Duration timeout) throws VoiceConnectionException {
        AudioChannel channel = findChannel(channelId);
        Guild guild = channel.getGuild();
        AudioManager audioManager = guild.getAudioManager();

        // A fresh connection every time; one left over from a dropped session may already be closed
        Connection connection = new Connection(guild.getIdLong(), audioManager, createPlayer());
        Connection previous = connections.put(guild.getIdLong(), connection);
        if (previous != null) {
            previous.retire();
        }
        audioManager.setSendingHandler(new AudioPlayerSendHandler(connection.player));
        audioManager.setAutoReconnect(true);

        try {
            audioManager.openAudioConnection(channel);
            awaitConnected(audioManager, channelId, timeout);
        } catch (VoiceConnectionException | RuntimeException e) {
            connections.remove(guild.getIdLong(), connection);
            connection.retire();
            audioManager.closeAudioConnection();
            if (e instanceof VoiceConnectionException) {
                throw (VoiceConnectionException) e;
            }
            throw new VoiceConnectionException("Could not join " + channel.getName(), e);
        }

        connection.channelId = channelId;
        BotLogger.audio(guild.getIdLong(), "Voice connection open in " + channel.getName());
        return connection;
    }

    @Override
    public void move(VoiceConnection voiceConnection, long channelId, Duration timeout) throws VoiceConnectionException {
        Connection connection = (Connection) voiceConnection;
        AudioChannel channel = findChannel(channelId);
        if (channel.getGuild().getIdLong() != connection.guildId) {
            throw new VoiceConnectionException("Channel " + channelId + " belongs to another guild");
        }
        try {
            connection.audioManager.openAudioConnection(channel);
        } catch (RuntimeException e) {
            throw new VoiceConnectionException("Could not move to " + channel.getName(), e);
        }
        awaitConnected(connection.audioManager, channelId, timeout);
        connection.channelId = channelId;
    }

    @Override
    public void playStream(VoiceConnection voiceConnection, String sourceUrl, double volume, long startOffsetSeconds,
                           StreamCompletion completion) {
        Connection connection = (Connection) voiceConnection;
        StreamHandle handle = new StreamHandle(completion);
        connection.activeStream = handle;

        playerManager.loadItemOrdered(connection, sourceUrl, new AudioLoadResultHandler() {
            @Override
            public void trackLoaded(AudioTrack track) {
                start(track);
            }

            @Override
            public void playlistLoaded(AudioPlaylist playlist) {
                AudioTrack track = playlist.getSelectedTrack() != null
                        ? playlist.getSelectedTrack()
                        : playlist.getTracks().isEmpty() ? null : playlist.getTracks().get(0);
                if (track == null) {
                    handle.complete(new IllegalStateException("Stream url resolved to an empty playlist"));
                } else {
                    start(track);
                }
            }

            @Override
            public void noMatches() {
                handle.complete(new IllegalStateException("Nothing playable at stream url"));
            }

            @Override
            public void loadFailed(FriendlyException exception) {
                handle.complete(exception);
            }

            private void start(AudioTrack track) {
                if (connection.activeStream != handle) {
                    // stopped or replaced while loading
                    handle.complete(null);
                    return;
                }
                track.setUserData(handle);
                if (startOffsetSeconds > 0 && track.isSeekable()) {
                    track.setPosition(startOffsetSeconds * 1000);
                }
                connection.player.setVolume(toPlayerVolume(volume));
                connection.player.setPaused(false);
                connection.player.startTrack(track, false);
            }
        });
    }

    @Override
    public void setVolume(VoiceConnection voiceConnection, double volume) {
        ((Connection) voiceConnection).player.setVolume(toPlayerVolume(volume));
    }

    @Override
    public void setPaused(VoiceConnection voiceConnection, boolean paused) {
        ((Connection) voiceConnection).player.setPaused(paused);
    }

    @Override
    public void stop(VoiceConnection voiceConnection) {
        Connection connection = (Connection) voiceConnection;
        connection.activeStream = null;
        connection.player.stopTrack();
    }

    @Override
    public void disconnect(VoiceConnection voiceConnection) {
        Connection connection = (Connection) voiceConnection;
        boolean current = connections.remove(connection.guildId, connection);
        connection.retire();
        if (!current) {
            // Replaced by a newer connection on the same audio manager, which stays open
            BotLogger.audioDebug(connection.guildId, "Released superseded voice connection");
            return;
        }
        connection.audioManager.closeAudioConnection();
        connection.audioManager.setSendingHandler(null);
        BotLogger.audio(connection.guildId, "Voice connection closed");
    }

    static int toPlayerVolume(double multiplier) {
        return (int) Math.round(Math.max(0, multiplier) * 100);
    }

    private AudioChannel findChannel(long channelId) throws VoiceConnectionException {
        AudioChannel channel = jda.getChannelById(AudioChannel.class, channelId);
        if (channel == null) {
            throw new VoiceConnectionException("Unknown voice channel " + channelId);
        }
        return channel;
    }

    private AudioPlayer createPlayer() {
        AudioPlayer player = playerManager.createPlayer();
        player.addListener(new AudioEventAdapter() {
            @Override
            public void onTrackEnd(AudioPlayer player, AudioTrack track, AudioTrackEndReason endReason) {
                StreamHandle handle = track.getUserData(StreamHandle.class);
                if (handle != null) {
                    handle.complete(null);
                }
            }

            @Override
            public void onTrackException(AudioPlayer player, AudioTrack track, FriendlyException exception) {
                StreamHandle handle = track.getUserData(StreamHandle.class);
                if (handle != null) {
                    handle.complete(exception);
                }
            }

            @Override
            public void onTrackStuck(AudioPlayer player, AudioTrack track, long thresholdMs) {
                StreamHandle handle = track.getUserData(StreamHandle.class);
                if (handle != null) {
                    handle.complete(new IllegalStateException("Stream stuck for " + thresholdMs + "ms"));
                }
                player.stopTrack();
            }
        });
        return player;
    }

    private static void awaitConnected(AudioManager audioManager, long channelId, Duration timeout)
            throws VoiceConnectionException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (audioManager.getConnectionStatus() == ConnectionStatus.CONNECTED
                    && audioManager.getConnectedChannel() != null
                    && audioManager.getConnectedChannel().getIdLong() == channelId) {
                return;
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new VoiceConnectionException("Interrupted while connecting", e);
            }
        }
        throw new VoiceConnectionException("Timed out after " + timeout.toSeconds() + "s waiting for voice connection");
    }

    private static final class Connection implements VoiceConnection {
        private final long guildId;
        private final AudioManager audioManager;
        private final AudioPlayer player;
        private volatile long channelId;
        private volatile StreamHandle activeStream;
        private volatile boolean retired;

        private Connection(long guildId, AudioManager audioManager, AudioPlayer player) {
            this.guildId = guildId;
            this.audioManager = audioManager;
            this.player = player;
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
            return !retired && audioManager.isConnected();
        }

        private void retire() {
            if (!retired) {
                retired = true;
                activeStream = null;
                player.destroy();
            }
        }
    }

    /**
     * Ties one started stream to its completion so that it fires exactly once, whichever of
     * end, exception or load failure comes first.
     */
    private static final class StreamHandle {
        private final StreamCompletion completion;
        private final AtomicBoolean completed = new AtomicBoolean();

        private StreamHandle(StreamCompletion completion) {
            this.completion = completion;
        }

        private void complete(Throwable error) {
            if (completed.compareAndSet(false, true)) {
                completion.onComplete(error);
            }
        }
    }
}
