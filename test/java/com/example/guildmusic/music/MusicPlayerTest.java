package com.example.guildmusic.music;

import com.example.guildmusic.storage.InMemoryStorage;
import com.example.guildmusic.storage.QueueStorage;
import com.example.guildmusic.storage.StorageException;
import com.example.guildmusic.storage.StoredQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MusicPlayerTest {
    private static final long GUILD = 1L;
    private static final long CHANNEL = 100L;

    private FakeVoiceTransport transport;
    private FakeExtractor extractor;
    private InMemoryStorage storage;
    private MutableClock clock;
    private ScheduledThreadPoolExecutor scheduler;
    private PlayerSettings settings;

    private final List<Track> started = new ArrayList<>();
    private final List<Track> ended = new ArrayList<>();
    private int queueEnds;

    private Track a;
    private Track b;
    private Track c;

    @BeforeEach
    void setUp() {
        transport = new FakeVoiceTransport();
        extractor = new FakeExtractor();
        storage = new InMemoryStorage();
        clock = new MutableClock();
        scheduler = new ScheduledThreadPoolExecutor(1);
        scheduler.setRemoveOnCancelPolicy(true);
        // The watchdog never fires on its own here; tests tick it by hand
        settings = new PlayerSettings(100, 500, Duration.ofSeconds(300), Duration.ofHours(1), Duration.ofSeconds(5));
        a = MusicQueueTest.track("A", 180);
        b = MusicQueueTest.track("B", 200);
        c = MusicQueueTest.track("C", 300);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private MusicPlayer newPlayer(Executor completionExecutor) {
        MusicPlayer player = new MusicPlayer(GUILD, settings, extractor, transport, storage, scheduler,
                completionExecutor, clock);
        player.setTrackStartListener(started::add);
        player.setTrackEndListener(ended::add);
        player.setQueueEndListener(() -> queueEnds++);
        return player;
    }

    private MusicPlayer newPlayer() {
        return newPlayer(Runnable::run);
    }

    private MusicPlayer playingABC() {
        MusicPlayer player = newPlayer();
        assertTrue(player.connect(CHANNEL));
        player.addTracks(List.of(a, b, c));
        assertTrue(player.play());
        return player;
    }

    @Test
    void playWithoutConnectionFailsAndLeavesQueueAlone() {
        MusicPlayer player = newPlayer();

        assertFalse(player.play(a));
        assertEquals(0, player.getQueueSize());
        assertEquals(PlayerState.IDLE, player.getState());
    }

    @Test
    void connectIsIdempotentForSameChannel() {
        MusicPlayer player = newPlayer();

        assertTrue(player.connect(CHANNEL));
        assertTrue(player.connect(CHANNEL));

        assertEquals(1, transport.connectCalls);
        assertEquals(0, transport.moveCalls);
        assertEquals(PlayerState.CONNECTED, player.getState());
        assertEquals(Long.valueOf(CHANNEL), player.getChannelId());
    }

    @Test
    void connectToOtherChannelMoves() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);

        assertTrue(player.connect(200L));

        assertEquals(1, transport.connectCalls);
        assertEquals(1, transport.moveCalls);
        assertEquals(Long.valueOf(200L), player.getChannelId());
    }

    @Test
    void connectRetriesOnce() {
        transport.failConnects = 1;
        MusicPlayer player = newPlayer();

        assertTrue(player.connect(CHANNEL));
        assertEquals(2, transport.connectCalls);
    }

    @Test
    void failedConnectLeavesPlayerIdle() {
        transport.failConnects = 2;
        MusicPlayer player = newPlayer();

        assertFalse(player.connect(CHANNEL));

        assertEquals(2, transport.connectCalls);
        assertEquals(PlayerState.IDLE, player.getState());
        assertNull(player.getChannelId());
        assertFalse(player.isWatchdogActive());
    }

    @Test
    void reconnectAfterDropKeepsReturnedConnection() {
        transport.reuseConnection = true;
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        transport.connection.connected = false;

        assertTrue(player.connect(CHANNEL));

        assertEquals(0, transport.disconnectCalls);
        assertTrue(player.isConnected());
        player.addTrack(a);
        assertTrue(player.play());
    }

    @Test
    void reconnectAfterDropClosesOldConnection() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        FakeVoiceTransport.FakeConnection dropped = transport.connection;
        dropped.connected = false;

        assertTrue(player.connect(CHANNEL));

        assertEquals(2, transport.connectCalls);
        assertEquals(1, transport.disconnectCalls);
        assertNotSame(dropped, transport.connection);
        assertTrue(player.isConnected());
    }

    @Test
    void playStartsCurrentTrackWithFreshStream() {
        MusicPlayer player = playingABC();

        assertEquals(PlayerState.PLAYING, player.getState());
        assertEquals(1, transport.streams.size());
        assertEquals("stream://A", transport.latest().url);
        assertEquals(1.0, transport.latest().volume);
        assertEquals(0, transport.latest().offset);
        assertEquals(List.of(a), started);
        assertEquals(List.of("A"), extractor.refreshed);
    }

    @Test
    void playWhilePlayingDoesNotRestart() {
        MusicPlayer player = playingABC();

        assertTrue(player.play());
        assertEquals(1, transport.streams.size());
    }

    @Test
    void playWithTrackSplicesItAfterCurrent() {
        MusicPlayer player = playingABC();
        Track d = MusicQueueTest.track("D", 10);

        assertTrue(player.play(d));

        assertEquals(List.of(a, d, b, c), player.getQueueSnapshot().getTracks());
        assertSame(a, player.getCurrentTrack());
        assertEquals(1, transport.streams.size());
    }

    @Test
    void trackEndAdvancesToNext() {
        MusicPlayer player = playingABC();

        transport.finishCurrent();

        assertEquals(List.of(a), ended);
        assertEquals(List.of(a, b), started);
        assertEquals("stream://B", transport.latest().url);
        assertSame(b, player.getCurrentTrack());
    }

    @Test
    void duplicateCompletionIsIgnored() {
        MusicPlayer player = playingABC();
        transport.finishCurrent();

        transport.streams.get(0).completeAgain();

        assertEquals(2, transport.streams.size());
        assertSame(b, player.getCurrentTrack());
        assertEquals(List.of(a), ended);
    }

    @Test
    void lastTrackEndingFinishesQueue() {
        MusicPlayer player = playingABC();

        transport.finishCurrent();
        transport.finishCurrent();
        transport.finishCurrent();

        assertEquals(List.of(a, b, c), ended);
        assertEquals(1, queueEnds);
        assertFalse(player.isPlaying());
        assertEquals(PlayerState.CONNECTED, player.getState());
        assertEquals(2, player.getQueueSnapshot().getCurrentIndex());
    }

    @Test
    void playAfterQueueFinishedStartsNewlyAddedTrack() {
        MusicPlayer player = playingABC();
        transport.finishCurrent();
        transport.finishCurrent();
        transport.finishCurrent();
        Track d = MusicQueueTest.track("D", 10);

        player.addTrack(d);
        assertTrue(player.play());

        assertEquals("stream://D", transport.latest().url);
        assertSame(d, player.getCurrentTrack());
    }

    @Test
    void unplayableTrackIsSkipped() {
        extractor.unplayable.add("B");
        MusicPlayer player = playingABC();

        transport.finishCurrent();

        assertEquals("stream://C", transport.latest().url);
        assertSame(c, player.getCurrentTrack());
        assertEquals(List.of(a, c), started);
    }

    @Test
    void queueOfUnplayableTracksDrains() {
        extractor.unplayable.addAll(List.of("A", "B", "C"));
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        player.addTracks(List.of(a, b, c));

        assertFalse(player.play());

        assertTrue(transport.streams.isEmpty());
        assertEquals(1, queueEnds);
        assertEquals(PlayerState.CONNECTED, player.getState());
    }

    @Test
    void loopOneWithUnplayableTrackGivesUp() {
        extractor.unplayable.add("A");
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        player.addTracks(List.of(a, b));
        player.setLoopMode(LoopMode.ONE);

        assertFalse(player.play());
        assertEquals(1, queueEnds);
    }

    @Test
    void loopOneWithFailingStreamGivesUp() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        player.addTrack(a);
        player.setLoopMode(LoopMode.ONE);
        player.play();

        transport.latest().complete(new IllegalStateException("403 from cdn"));

        assertEquals(1, transport.streams.size());
        assertEquals(1, queueEnds);
        assertFalse(player.isPlaying());
        assertEquals(List.of(a), ended);
    }

    @Test
    void loopAllStopsOncePassOfFailuresCompletes() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        player.addTracks(List.of(a, b));
        player.setLoopMode(LoopMode.ALL);
        player.play();

        transport.latest().complete(new IllegalStateException("403 from cdn"));
        assertEquals("stream://B", transport.latest().url);
        transport.latest().complete(new IllegalStateException("403 from cdn"));

        assertEquals(2, transport.streams.size());
        assertEquals(1, queueEnds);
        assertFalse(player.isPlaying());
    }

    @Test
    void cleanTrackEndResetsFailureCount() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        player.addTracks(List.of(a, b));
        player.setLoopMode(LoopMode.ALL);
        player.play();

        transport.latest().complete(new IllegalStateException("403 from cdn"));
        transport.finishCurrent();
        transport.latest().complete(new IllegalStateException("403 from cdn"));

        assertEquals(4, transport.streams.size());
        assertEquals("stream://B", transport.latest().url);
        assertEquals(0, queueEnds);
        assertTrue(player.isPlaying());
    }

    @Test
    void skipWhileStreamingStartsNextExactlyOnce() {
        MusicPlayer player = playingABC();

        Track next = player.skip();

        assertSame(b, next);
        assertEquals(2, transport.streams.size());
        assertEquals("stream://B", transport.latest().url);
        assertEquals(List.of(a), ended);
        assertEquals(1, transport.stopCalls);
    }

    @Test
    void skipWhileIdleAdvancesAndPlays() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        player.addTracks(List.of(a, b, c));

        Track next = player.skip();

        assertSame(b, next);
        assertEquals("stream://B", transport.latest().url);
        assertTrue(ended.isEmpty());
    }

    @Test
    void skipOnLastTrackReturnsNull() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        player.addTrack(a);
        player.play();

        assertNull(player.skip());
        assertEquals(1, queueEnds);
        assertFalse(player.isPlaying());
    }

    @Test
    void stopClearsQueueAndPersists() throws StorageException {
        MusicPlayer player = playingABC();

        player.stop();

        assertEquals(0, player.getQueueSize());
        assertFalse(player.isPlaying());
        assertEquals(PlayerState.CONNECTED, player.getState());
        assertTrue(storage.loadQueue(GUILD).getTracks().isEmpty());
        // stopping must not advance into anything
        assertEquals(1, transport.streams.size());
    }

    @Test
    void pauseAndResumeOnlyFromMatchingState() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        assertFalse(player.pause());
        assertFalse(player.resume());

        player.addTrack(a);
        player.play();
        assertTrue(player.pause());
        assertFalse(player.pause());
        assertEquals(PlayerState.PAUSED, player.getState());
        assertEquals(Boolean.TRUE, transport.lastPaused);

        assertTrue(player.resume());
        assertFalse(player.resume());
        assertEquals(PlayerState.PLAYING, player.getState());
        assertEquals(Boolean.FALSE, transport.lastPaused);
    }

    @Test
    void playWhilePausedResumes() {
        MusicPlayer player = playingABC();
        player.pause();

        assertTrue(player.play());

        assertTrue(player.isPlaying());
        assertEquals(1, transport.streams.size());
    }

    @Test
    void positionIgnoresPausedTime() {
        MusicPlayer player = playingABC();
        clock.advance(Duration.ofSeconds(20));
        player.pause();
        clock.advance(Duration.ofSeconds(100));

        assertEquals(20, player.getPositionSeconds());

        player.resume();
        clock.advance(Duration.ofSeconds(5));
        assertEquals(25, player.getPositionSeconds());
    }

    @Test
    void seekRejectsOutOfRange() {
        MusicPlayer player = playingABC();
        clock.advance(Duration.ofSeconds(10));

        assertFalse(player.seek(-5));
        assertFalse(player.seek(180));
        assertFalse(player.seek(500));

        assertEquals(10, player.getPositionSeconds());
        assertEquals(1, transport.streams.size());
    }

    @Test
    void seekRestartsStreamAtOffset() {
        MusicPlayer player = playingABC();

        assertTrue(player.seek(90));

        assertEquals(2, transport.streams.size());
        assertEquals(90, transport.latest().offset);
        assertEquals(90, player.getPositionSeconds());
        assertSame(a, player.getCurrentTrack());
        // the replaced stream's completion must not advance the queue
        assertTrue(ended.isEmpty());
        assertEquals(List.of(a), started);
    }

    @Test
    void seekWithoutPlaybackFails() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);

        assertFalse(player.seek(10));
    }

    @Test
    void volumeIsClampedAppliedLiveAndSaved() throws StorageException {
        MusicPlayer player = playingABC();

        assertEquals(200, player.setVolume(250));
        assertEquals(200, player.getVolume());
        assertEquals(2.0, transport.lastVolume);
        assertEquals(200, storage.loadQueue(GUILD).getVolume());

        assertEquals(0, player.setVolume(-3));
        assertEquals(0.0, transport.lastVolume);
        assertEquals(1, transport.streams.size());
    }

    @Test
    void volumeWhileIdleIsUsedForNextStream() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        player.setVolume(50);
        assertNull(transport.lastVolume);

        player.addTrack(a);
        player.play();
        assertEquals(0.5, transport.latest().volume);
    }

    @Test
    void watchdogDisconnectsAfterIdleTimeout() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        assertTrue(player.isWatchdogActive());

        clock.advance(Duration.ofSeconds(299));
        player.checkInactivity();
        assertTrue(player.isConnected());

        clock.advance(Duration.ofSeconds(2));
        player.checkInactivity();
        assertFalse(player.isConnected());
        assertEquals(PlayerState.IDLE, player.getState());
        assertFalse(player.isWatchdogActive());
        assertEquals(1, transport.disconnectCalls);
    }

    @Test
    void watchdogKeepsConnectionWhilePlaying() {
        MusicPlayer player = playingABC();

        for (int i = 0; i < 20; i++) {
            clock.advance(Duration.ofSeconds(30));
            player.checkInactivity();
        }
        assertTrue(player.isConnected());

        player.pause();
        clock.advance(Duration.ofSeconds(301));
        player.checkInactivity();
        assertFalse(player.isConnected());
    }

    @Test
    void slowExtractionDoesNotHoldUpOtherGuildsWatchdog() throws Exception {
        ScheduledThreadPoolExecutor shared = new ScheduledThreadPoolExecutor(1);
        ExecutorService handOff = Executors.newCachedThreadPool();
        ExecutorService commands = Executors.newSingleThreadExecutor();
        CountDownLatch extracting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeExtractor slow = new FakeExtractor() {
            @Override
            public String getStreamUrl(Track track) {
                extracting.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.getStreamUrl(track);
            }
        };
        PlayerSettings ticking = new PlayerSettings(100, 500, Duration.ofSeconds(300), Duration.ofMillis(50),
                Duration.ofSeconds(5));
        try {
            MusicPlayer busy = new MusicPlayer(1L, ticking, slow, new FakeVoiceTransport(), null, shared, handOff, clock);
            MusicPlayer quiet = new MusicPlayer(2L, ticking, extractor, new FakeVoiceTransport(), null, shared, handOff,
                    clock);
            assertTrue(busy.connect(CHANNEL));
            assertTrue(quiet.connect(CHANNEL));
            busy.addTrack(a);
            Future<Boolean> playing = commands.submit(() -> busy.play());
            assertTrue(extracting.await(5, TimeUnit.SECONDS));

            clock.advance(Duration.ofSeconds(400));
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (quiet.isConnected() && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }

            assertFalse(quiet.isConnected());
            // still resolving its track, so not idle
            assertTrue(busy.isConnected());
            assertEquals(PlayerState.CONNECTED, busy.getState());
            release.countDown();
            assertTrue(playing.get(5, TimeUnit.SECONDS));
            assertTrue(busy.isPlaying());
        } finally {
            release.countDown();
            commands.shutdownNow();
            shared.shutdownNow();
            handOff.shutdownNow();
        }
    }

    @Test
    void stopDuringExtractionDropsTheStart() throws Exception {
        ExecutorService commands = Executors.newSingleThreadExecutor();
        CountDownLatch extracting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        extractor = new FakeExtractor() {
            @Override
            public String getStreamUrl(Track track) {
                extracting.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.getStreamUrl(track);
            }
        };
        try {
            MusicPlayer player = newPlayer();
            player.connect(CHANNEL);
            player.addTracks(List.of(a, b));
            Future<Boolean> playing = commands.submit(() -> player.play());
            assertTrue(extracting.await(5, TimeUnit.SECONDS));

            // the lock is free while the url is resolved
            player.stop();
            release.countDown();

            assertFalse(playing.get(5, TimeUnit.SECONDS));
            assertTrue(transport.streams.isEmpty());
            assertFalse(player.isPlaying());
            assertEquals(0, queueEnds);
        } finally {
            release.countDown();
            commands.shutdownNow();
        }
    }

    @Test
    void onlyOneWatchdogPerPlayer() {
        MusicPlayer player = newPlayer();
        player.connect(CHANNEL);
        player.connect(200L);
        player.connect(300L);

        assertEquals(1, scheduler.getQueue().size());

        player.disconnect();
        assertEquals(0, scheduler.getQueue().size());
    }

    @Test
    void disconnectIsIdempotentAndSaves() throws StorageException {
        MusicPlayer player = playingABC();

        player.disconnect();
        player.disconnect();

        assertEquals(1, transport.disconnectCalls);
        assertFalse(player.isPlaying());
        assertEquals(PlayerState.IDLE, player.getState());
        StoredQueue saved = storage.loadQueue(GUILD);
        assertEquals(3, saved.getTracks().size());
        // the disconnect's stop must not advance the queue
        assertSame(a, player.getCurrentTrack());
    }

    @Test
    void restoreRebuildsQueueAndRefreshesStreamOnPlay() throws StorageException {
        storage.saveQueue(GUILD, List.of(a, b), 1, LoopMode.ALL, 150);
        MusicPlayer player = newPlayer();

        assertTrue(player.restoreState());

        QueueSnapshot snapshot = player.getQueueSnapshot();
        assertEquals(2, snapshot.getTracks().size());
        assertEquals(1, snapshot.getCurrentIndex());
        assertEquals(LoopMode.ALL, snapshot.getLoopMode());
        assertEquals(150, player.getVolume());
        assertNull(snapshot.getCurrent().getStreamUrl());

        player.connect(CHANNEL);
        player.play();
        assertEquals(List.of("B"), extractor.refreshed);
        assertEquals(1.5, transport.latest().volume);
    }

    @Test
    void restoreWithNothingSavedReturnsFalse() {
        assertFalse(newPlayer().restoreState());
    }

    @Test
    void storageFailuresNeverReachCaller() {
        MusicPlayer player = new MusicPlayer(GUILD, settings, extractor, transport, new BrokenStorage(), scheduler,
                Runnable::run, clock);

        assertFalse(player.restoreState());
        assertTrue(player.connect(CHANNEL));
        assertTrue(player.addTrack(a));
        assertTrue(player.play());
        player.setVolume(80);
        player.disconnect();
    }

    @Test
    void playerWithoutStorageWorks() {
        MusicPlayer player = new MusicPlayer(GUILD, settings, extractor, transport, null, scheduler,
                Runnable::run, clock);

        assertFalse(player.restoreState());
        player.connect(CHANNEL);
        player.addTrack(a);
        assertTrue(player.play());
    }

    @Test
    void mutationsArePersisted() throws StorageException {
        MusicPlayer player = newPlayer();
        player.addTracks(List.of(a, b, c));
        player.moveTrack(2, 1);
        player.setLoopMode(LoopMode.ONE);

        StoredQueue saved = storage.loadQueue(GUILD);
        assertEquals("C", saved.getTracks().get(1).getTitle());
        assertEquals(LoopMode.ONE, saved.getLoopMode());

        player.removeTrack(0);
        assertEquals(2, storage.loadQueue(GUILD).getTracks().size());
        assertEquals(1, player.clearQueue());
        assertEquals(1, storage.loadQueue(GUILD).getTracks().size());
    }

    @Test
    void removingStreamingTrackPlaysReplacement() {
        MusicPlayer player = playingABC();

        assertSame(a, player.removeTrack(0));

        assertSame(b, player.getCurrentTrack());
        assertEquals("stream://B", transport.latest().url);
        assertTrue(ended.isEmpty());
    }

    @Test
    void removingStreamingLastTrackFinishesQueue() {
        MusicPlayer player = playingABC();
        player.jump(2);

        assertSame(c, player.removeTrack(2));

        assertEquals(2, transport.streams.size());
        assertEquals(1, queueEnds);
        assertFalse(player.isPlaying());
        assertEquals(List.of(a, b), player.getQueueSnapshot().getTracks());
    }

    @Test
    void removingStreamingLastTrackWrapsWithLoopAll() {
        MusicPlayer player = playingABC();
        player.setLoopMode(LoopMode.ALL);
        player.jump(2);

        player.removeTrack(2);

        assertEquals("stream://A", transport.latest().url);
        assertSame(a, player.getCurrentTrack());
        assertEquals(0, queueEnds);
    }

    @Test
    void playAfterFinishedQueueAndRejoinStartsNewTrack() {
        MusicPlayer player = playingABC();
        transport.finishCurrent();
        transport.finishCurrent();
        transport.finishCurrent();
        player.disconnect();
        Track d = MusicQueueTest.track("D", 10);

        player.connect(CHANNEL);
        assertTrue(player.play(d));

        assertEquals("stream://D", transport.latest().url);
        assertEquals(3, ended.size());
    }

    @Test
    void previousAndJumpRestartPlayback() {
        MusicPlayer player = playingABC();

        assertSame(c, player.jump(2));
        assertEquals("stream://C", transport.latest().url);

        assertSame(b, player.previous());
        assertEquals("stream://B", transport.latest().url);
        assertNull(player.jump(7));
        assertEquals(3, transport.streams.size());
    }

    @Test
    void completionIsHandedOffBeforeTouchingState() {
        List<Runnable> handedOff = new ArrayList<>();
        MusicPlayer player = newPlayer(handedOff::add);
        player.connect(CHANNEL);
        player.addTracks(List.of(a, b));
        player.play();

        transport.finishCurrent();

        assertEquals(1, handedOff.size());
        assertSame(a, player.getCurrentTrack());
        assertTrue(player.isPlaying());

        handedOff.remove(0).run();
        assertSame(b, player.getCurrentTrack());
        assertEquals(2, transport.streams.size());
    }

    @Test
    void staleHandedOffCompletionIsIgnoredAfterSkip() {
        List<Runnable> handedOff = new ArrayList<>();
        MusicPlayer player = newPlayer(handedOff::add);
        player.connect(CHANNEL);
        player.addTracks(List.of(a, b, c));
        player.play();

        player.skip();
        assertEquals(1, handedOff.size());

        handedOff.remove(0).run();
        assertSame(b, player.getCurrentTrack());
        assertEquals(2, transport.streams.size());
    }

    @Test
    void listenerFailureDoesNotBreakPlayback() {
        MusicPlayer player = playingABC();
        player.setTrackStartListener(track -> {
            throw new IllegalStateException("boom");
        });

        assertNotNull(player.skip());
        assertTrue(player.isPlaying());
    }

    private static final class BrokenStorage implements QueueStorage {
        @Override
        public void saveQueue(long guildId, List<Track> tracks, int currentIndex, LoopMode loopMode, int volume)
                throws StorageException {
            throw new StorageException("disk full");
        }

        @Override
        public StoredQueue loadQueue(long guildId) throws StorageException {
            throw new StorageException("disk gone");
        }

        @Override
        public void clearGuildQueue(long guildId) throws StorageException {
            throw new StorageException("disk gone");
        }

        @Override
        public void savePlaylist(long userId, String name, List<Track> tracks) throws StorageException {
            throw new StorageException("disk gone");
        }

        @Override
        public List<Track> loadPlaylist(long userId, String name) throws StorageException {
            throw new StorageException("disk gone");
        }

        @Override
        public List<String> listPlaylists(long userId) throws StorageException {
            throw new StorageException("disk gone");
        }

        @Override
        public boolean deletePlaylist(long userId, String name) throws StorageException {
            throw new StorageException("disk gone");
        }

        @Override
        public void close() {
        }
    }
}
