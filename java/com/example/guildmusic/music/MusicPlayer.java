package com.example.guildmusic.music;

import com.example.guildmusic.BotLogger;
import com.example.guildmusic.extractor.Extractor;
import com.example.guildmusic.storage.QueueStorage;
import com.example.guildmusic.storage.StorageException;
import com.example.guildmusic.storage.StoredQueue;
import com.example.guildmusic.voice.VoiceConnection;
import com.example.guildmusic.voice.VoiceConnectionException;
import com.example.guildmusic.voice.VoiceTransport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Plays one guild's queue over one voice connection.
 * <p>
 * Every state change happens under the player's lock, so commands, the inactivity watchdog and
 * stream completions never interleave. The lock is never held while blocking: stream urls are
 * resolved and voice channels joined outside it, and the result is only applied if nothing else
 * changed the playback meanwhile. Completions arrive on the transport's threads and watchdog ticks
 * on the shared scheduler; both are handed to the completion executor before they touch any
 * state. Each playback attempt gets a generation number and only a completion for the current
 * generation is acted on, so a stream that was stopped, replaced or seeked can never advance
 * the queue.
 */
public class MusicPlayer {
    private static final long QUEUE_ENDED = -1;
    private static final long NOT_CONNECTED = -2;

    private final long guildId;
    private final PlayerSettings settings;
    private final Extractor extractor;
    private final VoiceTransport transport;
    private final QueueStorage storage;
    private final ScheduledExecutorService scheduler;
    private final Executor completionExecutor;
    private final Clock clock;
    private final MusicQueue queue;
    // Serializes joins and moves; held while waiting on the voice gateway, the player lock is not
    private final Object connectLock = new Object();

    private volatile VoiceConnection connection;
    private volatile boolean connecting;
    private volatile boolean streaming;
    private volatile boolean paused;

    private double volume;
    private long streamGeneration;
    private long connectionEpoch;
    // A track is being resolved for the current generation
    private boolean starting;
    private Track streamingTrack;
    // Set once the queue ran out with loop off, so the next play() moves past the finished track
    private boolean finished;
    private int failureStreak;

    private long positionBase;
    private Instant resumedAt;
    private Instant lastActivity;
    private ScheduledFuture<?> watchdog;

    private Consumer<Track> trackStartListener;
    private Consumer<Track> trackEndListener;
    private Runnable queueEndListener;

    public MusicPlayer(long guildId, PlayerSettings settings, Extractor extractor, VoiceTransport transport,
                       QueueStorage storage, ScheduledExecutorService scheduler, Executor completionExecutor,
                       Clock clock) {
        this.guildId = guildId;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.storage = storage;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.completionExecutor = Objects.requireNonNull(completionExecutor, "completionExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.queue = new MusicQueue(settings.getMaxQueueSize());
        this.volume = settings.getDefaultVolume() / 100.0;
        this.lastActivity = clock.instant();
    }

    // ---- connection ----

    /**
     * Joins a voice channel, or moves there if already connected elsewhere.
     *
     * @return false if the channel could not be joined; the player is then unchanged
     */
    public boolean connect(long channelId) {
        synchronized (connectLock) {
            VoiceConnection current;
            long epoch;
            synchronized (this) {
                current = connection;
                epoch = connectionEpoch;
                if (current != null && current.isConnected() && current.getChannelId() == channelId) {
                    return true;
                }
            }
            if (current != null && current.isConnected()) {
                return moveTo(current, channelId, epoch);
            }

            connecting = true;
            try {
                VoiceConnection opened = openConnection(channelId);
                if (opened == null) {
                    return false;
                }
                return install(opened, channelId, epoch);
            } finally {
                connecting = false;
            }
        }
    }

    private boolean moveTo(VoiceConnection current, long channelId, long epoch) {
        try {
            transport.move(current, channelId, settings.getConnectTimeout());
        } catch (VoiceConnectionException | RuntimeException e) {
            BotLogger.audioWarn(guildId, "Could not move to channel " + channelId + ": " + e.getMessage());
            return false;
        }
        synchronized (this) {
            if (epoch != connectionEpoch || connection != current) {
                BotLogger.audioDebug(guildId, "Left voice while moving to channel " + channelId);
                return false;
            }
            BotLogger.audio(guildId, "Moved to channel " + channelId);
            touch();
            startWatchdog();
            return true;
        }
    }

    private synchronized boolean install(VoiceConnection opened, long channelId, long epoch) {
        if (epoch != connectionEpoch) {
            BotLogger.audioDebug(guildId, "Left voice while joining channel " + channelId);
            closeQuietly(opened);
            return false;
        }
        VoiceConnection previous = connection;
        if (previous != null) {
            // The old connection dropped underneath us
            retireStream();
            if (previous != opened) {
                closeQuietly(previous);
            }
        }
        connection = opened;
        touch();
        startWatchdog();
        BotLogger.audio(guildId, "Connected to channel " + channelId);
        return true;
    }

    private VoiceConnection openConnection(long channelId) {
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                return transport.connect(channelId, settings.getConnectTimeout());
            } catch (VoiceConnectionException | RuntimeException e) {
                BotLogger.audioWarn(guildId, "Connect attempt " + attempt + " to channel " + channelId
                        + " failed: " + e.getMessage());
            }
        }
        return null;
    }

    /**
     * Stops playback, leaves the channel and saves the queue. Safe to call when not connected.
     */
    public synchronized void disconnect() {
        connectionEpoch++;
        cancelWatchdog();
        retireStream();
        VoiceConnection current = connection;
        connection = null;
        if (current != null) {
            closeQuietly(current);
            BotLogger.audio(guildId, "Disconnected");
        }
        saveState();
    }

    private void closeQuietly(VoiceConnection current) {
        try {
            transport.disconnect(current);
        } catch (RuntimeException e) {
            BotLogger.audioWarn(guildId, "Error closing voice connection: " + e.getMessage());
        }
    }

    // ---- playback ----

    /**
     * Starts playing the queue, or resumes it if paused.
     *
     * @param track optional track to put right after the current one
     * @return false if not connected or nothing could be played
     */
    public boolean play(Track track) {
        long attempt;
        synchronized (this) {
            if (!isConnected()) {
                return false;
            }
            if (track != null) {
                if (!queue.insert(queue.getCurrentIndex() + 1, track)) {
                    BotLogger.audioWarn(guildId, "Queue full, not adding " + track.getTitle());
                    return false;
                }
                saveState();
            }
            if (paused) {
                return resume();
            }
            if (streaming || starting) {
                return true;
            }
            if (finished && queue.getCurrentIndex() + 1 < queue.size()) {
                queue.next();
            }
            failureStreak = 0;
            attempt = beginAttempt();
        }
        return playCurrent(attempt) != null;
    }

    public boolean play() {
        return play(null);
    }

    /**
     * Invalidates whatever is playing and opens a new playback attempt.
     *
     * @return the generation the attempt runs under
     */
    private long beginAttempt() {
        retireStream();
        starting = true;
        touch();
        return streamGeneration;
    }

    /**
     * Plays the current track, skipping over tracks that cannot be streamed. Gives up after
     * one pass over the queue. Must be called without holding the lock: stream urls are
     * resolved outside it and the attempt is dropped if another one replaced it meanwhile.
     *
     * @return the track that started, or null
     */
    private Track playCurrent(long generation) {
        int attempts;
        synchronized (this) {
            attempts = Math.max(1, queue.size());
        }
        for (int i = 0; i < attempts; i++) {
            Track track;
            synchronized (this) {
                if (generation != streamGeneration) {
                    return null;
                }
                track = queue.getCurrent();
                if (track == null || connection == null) {
                    break;
                }
            }
            String streamUrl = resolveStreamUrl(track);
            synchronized (this) {
                if (generation != streamGeneration) {
                    return null;
                }
                if (streamUrl != null && connection != null && beginStream(track, streamUrl, 0)) {
                    finished = false;
                    BotLogger.audio(guildId, "Now playing: " + track.getTitle());
                    fireTrackStart(track);
                    saveState();
                    return track;
                }
                if (queue.next() == null) {
                    break;
                }
            }
        }
        synchronized (this) {
            if (generation == streamGeneration) {
                starting = false;
                endOfQueue();
            }
        }
        return null;
    }

    /**
     * Refreshes the track's stream url. Blocks on the extractor.
     *
     * @return the url, or null if the track cannot be streamed
     */
    private String resolveStreamUrl(Track track) {
        String streamUrl;
        try {
            streamUrl = extractor.getStreamUrl(track);
        } catch (RuntimeException e) {
            BotLogger.audioError(guildId, "Extractor failed for " + track.getTitle(), e);
            return null;
        }
        if (streamUrl == null || streamUrl.isEmpty()) {
            BotLogger.audioWarn(guildId, "No stream url for " + track.getTitle() + ", skipping");
            return null;
        }
        return streamUrl;
    }

    /**
     * Hands a resolved stream to the transport under the current generation.
     *
     * @return false if the transport refused the stream
     */
    private boolean beginStream(Track track, String streamUrl, long offsetSeconds) {
        long generation = streamGeneration;
        streaming = true;
        starting = false;
        paused = false;
        streamingTrack = track;
        positionBase = offsetSeconds;
        resumedAt = clock.instant();
        touch();
        try {
            transport.playStream(connection, streamUrl, volume, offsetSeconds,
                    error -> completionExecutor.execute(() -> onStreamComplete(generation, error)));
            return true;
        } catch (RuntimeException e) {
            BotLogger.audioError(guildId, "Could not start stream for " + track.getTitle(), e);
            clearStream();
            starting = true;
            return false;
        }
    }

    /**
     * Invalidates the active stream or pending attempt, if any, so its completion is ignored,
     * and stops it.
     */
    private void retireStream() {
        streamGeneration++;
        if (streaming && connection != null) {
            try {
                transport.stop(connection);
            } catch (RuntimeException e) {
                BotLogger.audioWarn(guildId, "Error stopping stream: " + e.getMessage());
            }
        }
        starting = false;
        clearStream();
    }

    private void clearStream() {
        streaming = false;
        paused = false;
        streamingTrack = null;
        positionBase = 0;
        resumedAt = null;
    }

    void onStreamComplete(long generation, Throwable error) {
        long attempt;
        synchronized (this) {
            if (generation != streamGeneration || !streaming) {
                return;
            }
            Track ended = streamingTrack;
            streamGeneration++;
            clearStream();
            if (error == null) {
                failureStreak = 0;
            } else {
                failureStreak++;
                BotLogger.audioWarn(guildId, "Stream ended with error: " + error.getMessage());
                if (failureStreak >= Math.max(1, queue.size())) {
                    BotLogger.audioWarn(guildId, failureStreak + " streams failed in a row, giving up");
                    failureStreak = 0;
                    if (ended != null) {
                        fireTrackEnd(ended);
                    }
                    endOfQueue();
                    return;
                }
            }
            attempt = advance(ended);
        }
        if (attempt >= 0) {
            playCurrent(attempt);
        }
    }

    /**
     * Moves the queue on. Used for natural track ends and skips; the caller starts the returned
     * attempt once it has released the lock.
     *
     * @param ended the track that was streaming, or null
     * @return the attempt's generation, {@link #QUEUE_ENDED} or {@link #NOT_CONNECTED}
     */
    private long advance(Track ended) {
        if (ended != null) {
            fireTrackEnd(ended);
        }
        if (queue.next() == null) {
            endOfQueue();
            return QUEUE_ENDED;
        }
        if (!isConnected()) {
            saveState();
            return NOT_CONNECTED;
        }
        return beginAttempt();
    }

    private void endOfQueue() {
        clearStream();
        finished = !queue.isEmpty();
        BotLogger.audio(guildId, "Queue finished");
        fireQueueEnd();
        saveState();
    }

    public synchronized boolean pause() {
        if (!streaming || paused || connection == null) {
            return false;
        }
        try {
            transport.setPaused(connection, true);
        } catch (RuntimeException e) {
            BotLogger.audioWarn(guildId, "Could not pause: " + e.getMessage());
            return false;
        }
        positionBase = currentPosition();
        resumedAt = null;
        paused = true;
        return true;
    }

    public synchronized boolean resume() {
        if (!paused || connection == null) {
            return false;
        }
        try {
            transport.setPaused(connection, false);
        } catch (RuntimeException e) {
            BotLogger.audioWarn(guildId, "Could not resume: " + e.getMessage());
            return false;
        }
        paused = false;
        resumedAt = clock.instant();
        touch();
        return true;
    }

    /**
     * Stops playback and empties the queue.
     */
    public synchronized void stop() {
        retireStream();
        queue.clear();
        finished = false;
        failureStreak = 0;
        saveState();
    }

    /**
     * Ends the current track and moves on.
     *
     * @return the track now playing, or null if the queue is exhausted
     */
    public Track skip() {
        long attempt;
        synchronized (this) {
            failureStreak = 0;
            Track ended = null;
            if (streaming) {
                ended = streamingTrack;
                retireStream();
            }
            attempt = advance(ended);
            if (attempt == QUEUE_ENDED) {
                return null;
            }
            if (attempt == NOT_CONNECTED) {
                return queue.getCurrent();
            }
        }
        return playCurrent(attempt);
    }

    /**
     * Restarts the current track at {@code seconds}. The old stream keeps playing until the new
     * one is ready.
     *
     * @return false for a negative or out of range position, or when nothing is playing
     */
    public boolean seek(long seconds) {
        Track track;
        long generation;
        synchronized (this) {
            if (seconds < 0 || !streaming || streamingTrack == null || connection == null) {
                return false;
            }
            track = streamingTrack;
            if (track.getDuration() > 0 && seconds >= track.getDuration()) {
                return false;
            }
            generation = streamGeneration;
        }
        String streamUrl = resolveStreamUrl(track);
        if (streamUrl == null) {
            return false;
        }
        synchronized (this) {
            if (generation != streamGeneration || connection == null) {
                BotLogger.audioDebug(guildId, "Playback changed while seeking in " + track.getTitle());
                return false;
            }
            retireStream();
            if (!beginStream(track, streamUrl, seconds)) {
                starting = false;
                return false;
            }
        }
        BotLogger.audioDebug(guildId, "Seeked to " + Track.formatSeconds(seconds) + " in " + track.getTitle());
        return true;
    }

    public Track previous() {
        long attempt;
        synchronized (this) {
            if (queue.previous() == null) {
                return null;
            }
            attempt = restartAttempt();
        }
        return startRestart(attempt);
    }

    public Track jump(int index) {
        long attempt;
        synchronized (this) {
            if (queue.jump(index) == null) {
                return null;
            }
            attempt = restartAttempt();
        }
        return startRestart(attempt);
    }

    private long restartAttempt() {
        failureStreak = 0;
        saveState();
        if (!isConnected()) {
            retireStream();
            return NOT_CONNECTED;
        }
        return beginAttempt();
    }

    private Track startRestart(long attempt) {
        if (attempt >= 0) {
            playCurrent(attempt);
        }
        return getCurrentTrack();
    }

    // ---- volume ----

    /**
     * @return volume in percent, 0 to 200
     */
    public synchronized int getVolume() {
        return (int) Math.round(volume * 100);
    }

    /**
     * Sets the volume, applying it to the active stream without restarting it.
     *
     * @return the volume actually set, after clamping
     */
    public synchronized int setVolume(int percent) {
        int clamped = PlayerSettings.clampVolume(percent);
        volume = clamped / 100.0;
        if (streaming && connection != null) {
            try {
                transport.setVolume(connection, volume);
            } catch (RuntimeException e) {
                BotLogger.audioWarn(guildId, "Could not change volume: " + e.getMessage());
            }
        }
        saveState();
        return clamped;
    }

    // ---- queue ----

    public synchronized boolean addTrack(Track track) {
        boolean added = queue.add(track);
        if (added) {
            saveState();
        }
        return added;
    }

    public synchronized int addTracks(List<Track> tracks) {
        int added = queue.addMany(tracks);
        if (added > 0) {
            saveState();
        }
        return added;
    }

    public synchronized boolean insertTrack(int index, Track track) {
        boolean inserted = queue.insert(index, track);
        if (inserted) {
            saveState();
        }
        return inserted;
    }

    /**
     * Removes a track. Removing the one that is streaming starts whatever takes its place, or
     * finishes the queue if nothing does.
     */
    public Track removeTrack(int index) {
        long attempt = QUEUE_ENDED;
        Track removed;
        synchronized (this) {
            boolean removingCurrent = streaming && index == queue.getCurrentIndex();
            boolean removingLast = index == queue.size() - 1;
            removed = queue.remove(index);
            if (removed == null) {
                return null;
            }
            if (removingCurrent) {
                retireStream();
                if (!queue.isEmpty() && removingLast && queue.getLoopMode() == LoopMode.ALL) {
                    queue.jump(0);
                    attempt = beginAttempt();
                } else if (!queue.isEmpty() && !removingLast) {
                    attempt = beginAttempt();
                } else {
                    endOfQueue();
                }
            }
            saveState();
        }
        if (attempt >= 0) {
            playCurrent(attempt);
        }
        return removed;
    }

    public synchronized boolean moveTrack(int from, int to) {
        boolean moved = queue.move(from, to);
        if (moved) {
            saveState();
        }
        return moved;
    }

    /**
     * Drops the upcoming tracks, keeping the current one.
     */
    public synchronized int clearQueue() {
        int removed = queue.clearUpcoming();
        saveState();
        return removed;
    }

    public synchronized void shuffle() {
        queue.shuffle();
        saveState();
    }

    public synchronized void setLoopMode(LoopMode loopMode) {
        queue.setLoopMode(loopMode == null ? LoopMode.OFF : loopMode);
        saveState();
    }

    // ---- persistence ----

    /**
     * Saves the queue and volume. Failures are logged and otherwise ignored.
     */
    public synchronized void saveState() {
        if (storage == null) {
            return;
        }
        try {
            storage.saveQueue(guildId, queue.getTracks(), queue.getCurrentIndex(), queue.getLoopMode(), getVolume());
        } catch (StorageException | RuntimeException e) {
            BotLogger.storageError("Failed to save queue for guild " + guildId, e);
        }
    }

    /**
     * Loads the saved queue and volume, if any. Restored tracks have no stream url.
     *
     * @return true if something was restored
     */
    public synchronized boolean restoreState() {
        if (storage == null) {
            return false;
        }
        StoredQueue stored;
        try {
            stored = storage.loadQueue(guildId);
        } catch (StorageException | RuntimeException e) {
            BotLogger.storageError("Failed to load queue for guild " + guildId, e);
            return false;
        }
        if (stored == null) {
            return false;
        }
        queue.restoreState(stored.getTracks(), stored.getCurrentIndex(), stored.getLoopMode());
        volume = PlayerSettings.clampVolume(stored.getVolume()) / 100.0;
        BotLogger.audio(guildId, "Restored " + queue.size() + " tracks");
        return true;
    }

    // ---- inactivity ----

    private void startWatchdog() {
        cancelWatchdog();
        long interval = settings.getWatchdogInterval().toMillis();
        watchdog = scheduler.scheduleAtFixedRate(this::tick, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void cancelWatchdog() {
        if (watchdog != null) {
            watchdog.cancel(false);
            watchdog = null;
        }
    }

    // Runs on the scheduler all guilds share, so it must not wait for this player's lock
    private void tick() {
        try {
            completionExecutor.execute(this::checkInactivity);
        } catch (RejectedExecutionException e) {
            BotLogger.audioDebug(guildId, "Inactivity check skipped, player is shutting down");
        }
    }

    synchronized void checkInactivity() {
        try {
            if (connection == null) {
                cancelWatchdog();
                return;
            }
            Instant now = clock.instant();
            if (isPlaying() || starting) {
                lastActivity = now;
                return;
            }
            Duration idle = Duration.between(lastActivity, now);
            if (idle.compareTo(settings.getInactivityTimeout()) >= 0) {
                BotLogger.audio(guildId, "Idle for " + idle.getSeconds() + "s, leaving voice");
                disconnect();
            }
        } catch (RuntimeException e) {
            // An exception would silently cancel the scheduled task
            BotLogger.audioError(guildId, "Inactivity check failed", e);
        }
    }

    synchronized boolean isWatchdogActive() {
        return watchdog != null && !watchdog.isDone();
    }

    private void touch() {
        lastActivity = clock.instant();
    }

    // ---- listeners ----

    public synchronized void setTrackStartListener(Consumer<Track> listener) {
        this.trackStartListener = listener;
    }

    public synchronized void setTrackEndListener(Consumer<Track> listener) {
        this.trackEndListener = listener;
    }

    public synchronized void setQueueEndListener(Runnable listener) {
        this.queueEndListener = listener;
    }

    private void fireTrackStart(Track track) {
        if (trackStartListener != null) {
            try {
                trackStartListener.accept(track);
            } catch (RuntimeException e) {
                BotLogger.audioError(guildId, "Track start listener failed", e);
            }
        }
    }

    private void fireTrackEnd(Track track) {
        if (trackEndListener != null) {
            try {
                trackEndListener.accept(track);
            } catch (RuntimeException e) {
                BotLogger.audioError(guildId, "Track end listener failed", e);
            }
        }
    }

    private void fireQueueEnd() {
        if (queueEndListener != null) {
            try {
                queueEndListener.run();
            } catch (RuntimeException e) {
                BotLogger.audioError(guildId, "Queue end listener failed", e);
            }
        }
    }

    // ---- state ----

    public PlayerState getState() {
        if (connection == null) {
            return connecting ? PlayerState.CONNECTING : PlayerState.IDLE;
        }
        if (paused) {
            return PlayerState.PAUSED;
        }
        return streaming ? PlayerState.PLAYING : PlayerState.CONNECTED;
    }

    public long getGuildId() {
        return guildId;
    }

    public boolean isConnected() {
        VoiceConnection current = connection;
        return current != null && current.isConnected();
    }

    /**
     * @return true while a stream is running and not paused
     */
    public boolean isPlaying() {
        return streaming && !paused;
    }

    public boolean isPaused() {
        return paused;
    }

    /**
     * @return the connected channel, or null
     */
    public Long getChannelId() {
        VoiceConnection current = connection;
        return current == null ? null : current.getChannelId();
    }

    /**
     * @return the streaming track, or the queue's current one when nothing streams
     */
    public synchronized Track getCurrentTrack() {
        return streamingTrack != null ? streamingTrack : queue.getCurrent();
    }

    public synchronized long getPositionSeconds() {
        return streaming ? currentPosition() : 0;
    }

    private long currentPosition() {
        long position = positionBase;
        if (resumedAt != null) {
            position += Math.max(0, Duration.between(resumedAt, clock.instant()).getSeconds());
        }
        if (streamingTrack != null && streamingTrack.getDuration() > 0) {
            position = Math.min(position, streamingTrack.getDuration());
        }
        return position;
    }

    public synchronized QueueSnapshot getQueueSnapshot() {
        return queue.getState();
    }

    public synchronized List<Track> getUpcoming() {
        return queue.getUpcoming();
    }

    public synchronized List<Track> getHistory() {
        return queue.getHistory();
    }

    public synchronized int getQueueSize() {
        return queue.size();
    }

    public synchronized long getTotalDuration() {
        return queue.getTotalDuration();
    }

    public synchronized LoopMode getLoopMode() {
        return queue.getLoopMode();
    }
}
