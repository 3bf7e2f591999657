package com.example.guildmusic.voice;

import com.sedmelluq.discord.lavaplayer.player.AudioLoadResultHandler;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayer;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.player.event.AudioEventAdapter;
import com.sedmelluq.discord.lavaplayer.tools.FriendlyException;
import com.sedmelluq.discord.lavaplayer.track.AudioTrack;
import com.sedmelluq.discord.lavaplayer.track.AudioTrackEndReason;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.audio.hooks.ConnectionStatus;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.unions.AudioChannelUnion;
import net.dv8tion.jda.api.managers.AudioManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives the transport against interface stand-ins for JDA and lavaplayer.
 */
class LavaplayerVoiceTransportTest {
    private static final long GUILD = 1L;
    private static final long CHANNEL = 100L;
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private FakeAudioManager audio;
    private final List<FakePlayer> players = new ArrayList<>();
    private final List<AudioLoadResultHandler> loads = new ArrayList<>();
    private LavaplayerVoiceTransport transport;

    @BeforeEach
    void setUp() {
        audio = new FakeAudioManager();
        Guild guild = stub(Guild.class, Map.of(
                "getIdLong", args -> GUILD,
                "getAudioManager", args -> audio.proxy));
        AudioChannelUnion channel = stub(AudioChannelUnion.class, Map.of(
                "getIdLong", args -> CHANNEL,
                "getName", args -> "Lounge",
                "getGuild", args -> guild));
        audio.channel = channel;
        JDA jda = stub(JDA.class, Map.of(
                "getChannelById", args -> args[1] instanceof Long && (Long) args[1] == CHANNEL ? channel : null));
        AudioPlayerManager manager = stub(AudioPlayerManager.class, Map.of(
                "createPlayer", args -> {
                    FakePlayer player = new FakePlayer();
                    players.add(player);
                    return player.proxy;
                },
                "loadItemOrdered", args -> {
                    loads.add((AudioLoadResultHandler) args[2]);
                    return null;
                }));
        transport = new LavaplayerVoiceTransport(jda, manager);
    }

    @Test
    void volumeMultiplierMapsToPlayerPercent() {
        assertEquals(100, LavaplayerVoiceTransport.toPlayerVolume(1.0));
        assertEquals(200, LavaplayerVoiceTransport.toPlayerVolume(2.0));
        assertEquals(35, LavaplayerVoiceTransport.toPlayerVolume(0.349));
        assertEquals(0, LavaplayerVoiceTransport.toPlayerVolume(-0.5));
    }

    @Test
    void connectWaitsForGatewayAndAttachesPlayer() throws VoiceConnectionException {
        VoiceConnection connection = transport.connect(CHANNEL, TIMEOUT);

        assertTrue(connection.isConnected());
        assertEquals(GUILD, connection.getGuildId());
        assertEquals(CHANNEL, connection.getChannelId());
        assertEquals(1, audio.opens);
        assertNotNull(audio.sendingHandler);
    }

    @Test
    void unknownChannelIsRejected() {
        assertThrows(VoiceConnectionException.class, () -> transport.connect(999L, TIMEOUT));
        assertEquals(0, audio.opens);
    }

    @Test
    void connectTimeoutClosesConnectionAndPlayer() {
        audio.connectOnOpen = false;

        VoiceConnectionException e = assertThrows(VoiceConnectionException.class,
                () -> transport.connect(CHANNEL, Duration.ofMillis(250)));

        assertTrue(e.getMessage().startsWith("Timed out"));
        assertEquals(1, audio.closes);
        assertTrue(players.get(0).destroyed);
    }

    @Test
    void reconnectAfterDropKeepsNewConnectionOpen() throws VoiceConnectionException {
        VoiceConnection first = transport.connect(CHANNEL, TIMEOUT);
        audio.drop();
        assertFalse(first.isConnected());

        VoiceConnection second = transport.connect(CHANNEL, TIMEOUT);
        assertNotSame(first, second);
        assertTrue(second.isConnected());
        assertTrue(players.get(0).destroyed);

        transport.disconnect(first);
        assertEquals(0, audio.closes);
        assertTrue(second.isConnected());
        assertFalse(players.get(1).destroyed);

        transport.disconnect(second);
        assertEquals(1, audio.closes);
        assertFalse(second.isConnected());
        assertNull(audio.sendingHandler);
    }

    @Test
    void streamCompletesOnceWhateverEndsIt() throws VoiceConnectionException {
        VoiceConnection connection = transport.connect(CHANNEL, TIMEOUT);
        List<Throwable> completions = new ArrayList<>();
        transport.playStream(connection, "https://cdn.example/a", 0.5, 30, completions::add);

        FakeTrack track = new FakeTrack();
        loads.get(0).trackLoaded(track.proxy);
        FakePlayer player = players.get(0);
        assertEquals(List.of(track.proxy), player.started);
        assertEquals(50, player.volume);
        assertEquals(30_000, track.position);

        FriendlyException failure = new FriendlyException("decoder broke", FriendlyException.Severity.COMMON, null);
        player.listener.onTrackException(player.proxy, track.proxy, failure);
        player.listener.onTrackEnd(player.proxy, track.proxy, AudioTrackEndReason.LOAD_FAILED);

        assertEquals(1, completions.size());
        assertSame(failure, completions.get(0));
    }

    @Test
    void nothingToLoadCompletesWithError() throws VoiceConnectionException {
        VoiceConnection connection = transport.connect(CHANNEL, TIMEOUT);
        List<Throwable> completions = new ArrayList<>();
        transport.playStream(connection, "https://cdn.example/gone", 1.0, 0, completions::add);

        loads.get(0).noMatches();

        assertEquals(1, completions.size());
        assertInstanceOf(IllegalStateException.class, completions.get(0));
        assertTrue(players.get(0).started.isEmpty());
    }

    @Test
    void loadFinishingAfterStopDoesNotStart() throws VoiceConnectionException {
        VoiceConnection connection = transport.connect(CHANNEL, TIMEOUT);
        List<Throwable> completions = new ArrayList<>();
        transport.playStream(connection, "https://cdn.example/a", 1.0, 0, completions::add);

        transport.stop(connection);
        loads.get(0).trackLoaded(new FakeTrack().proxy);

        assertTrue(players.get(0).started.isEmpty());
        assertEquals(1, completions.size());
        assertNull(completions.get(0));
    }

    @Test
    void newerStreamSupersedesPendingLoad() throws VoiceConnectionException {
        VoiceConnection connection = transport.connect(CHANNEL, TIMEOUT);
        List<Throwable> firstDone = new ArrayList<>();
        List<Throwable> secondDone = new ArrayList<>();
        transport.playStream(connection, "https://cdn.example/a", 1.0, 0, firstDone::add);
        transport.playStream(connection, "https://cdn.example/b", 1.0, 0, secondDone::add);

        FakeTrack late = new FakeTrack();
        FakeTrack current = new FakeTrack();
        loads.get(0).trackLoaded(late.proxy);
        loads.get(1).trackLoaded(current.proxy);

        assertEquals(List.of(current.proxy), players.get(0).started);
        assertEquals(1, firstDone.size());
        assertTrue(secondDone.isEmpty());
    }

    @SuppressWarnings("unchecked")
    private static <T> T stub(Class<T> type, Map<String, Function<Object[], Object>> answers) {
        return (T) Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, (proxy, method, args) -> {
            Function<Object[], Object> answer = answers.get(method.getName());
            if (answer != null) {
                return answer.apply(args);
            }
            switch (method.getName()) {
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "toString":
                    return type.getSimpleName() + " stand-in";
                default:
                    return defaultValue(method.getReturnType());
            }
        });
    }

    private static Object defaultValue(Class<?> type) {
        if (type == boolean.class) {
            return false;
        }
        if (type == int.class) {
            return 0;
        }
        if (type == long.class) {
            return 0L;
        }
        if (type == double.class) {
            return 0.0;
        }
        return null;
    }

    private static final class FakeAudioManager {
        final AudioManager proxy;
        AudioChannelUnion channel;
        boolean connectOnOpen = true;
        int opens;
        int closes;
        Object sendingHandler;
        volatile ConnectionStatus status = ConnectionStatus.NOT_CONNECTED;
        volatile AudioChannelUnion connectedChannel;

        FakeAudioManager() {
            Map<String, Function<Object[], Object>> answers = new HashMap<>();
            answers.put("openAudioConnection", args -> {
                opens++;
                if (connectOnOpen) {
                    status = ConnectionStatus.CONNECTED;
                    connectedChannel = channel;
                }
                return null;
            });
            answers.put("closeAudioConnection", args -> {
                closes++;
                drop();
                return null;
            });
            answers.put("setSendingHandler", args -> {
                sendingHandler = args[0];
                return null;
            });
            answers.put("getConnectionStatus", args -> status);
            answers.put("getConnectedChannel", args -> connectedChannel);
            answers.put("isConnected", args -> status == ConnectionStatus.CONNECTED);
            proxy = stub(AudioManager.class, answers);
        }

        void drop() {
            status = ConnectionStatus.NOT_CONNECTED;
            connectedChannel = null;
        }
    }

    private static final class FakePlayer {
        final AudioPlayer proxy;
        final List<AudioTrack> started = new ArrayList<>();
        AudioEventAdapter listener;
        int volume = 100;
        boolean destroyed;

        FakePlayer() {
            Map<String, Function<Object[], Object>> answers = new HashMap<>();
            answers.put("addListener", args -> {
                listener = (AudioEventAdapter) args[0];
                return null;
            });
            answers.put("startTrack", args -> started.add((AudioTrack) args[0]));
            answers.put("setVolume", args -> {
                volume = (Integer) args[0];
                return null;
            });
            answers.put("destroy", args -> {
                destroyed = true;
                return null;
            });
            proxy = stub(AudioPlayer.class, answers);
        }
    }

    private static final class FakeTrack {
        final AudioTrack proxy;
        Object userData;
        long position;

        FakeTrack() {
            Map<String, Function<Object[], Object>> answers = new HashMap<>();
            answers.put("setUserData", args -> {
                userData = args[0];
                return null;
            });
            answers.put("getUserData", args -> {
                if (args == null) {
                    return userData;
                }
                return ((Class<?>) args[0]).isInstance(userData) ? userData : null;
            });
            answers.put("isSeekable", args -> true);
            answers.put("setPosition", args -> {
                position = (Long) args[0];
                return null;
            });
            proxy = stub(AudioTrack.class, answers);
        }
    }
}
