package com.example.guildmusic.music;

import com.example.guildmusic.BotLogger;
import com.example.guildmusic.extractor.Extractor;
import com.example.guildmusic.storage.QueueStorage;
import com.example.guildmusic.storage.StorageException;
import com.example.guildmusic.voice.VoiceTransport;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holds one {@link MusicPlayer} per guild along with the threads they share.
 */
public class PlayerRegistry {
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final PlayerSettings settings;
    private final Extractor extractor;
    private final VoiceTransport transport;
    private final QueueStorage storage;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService completionExecutor;
    private final Map<Long, MusicPlayer> players = new ConcurrentHashMap<>();

    public PlayerRegistry(PlayerSettings settings, Extractor extractor, VoiceTransport transport, QueueStorage storage) {
        this(settings, extractor, transport, storage, Clock.systemUTC(),
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "Music-Task-Scheduler");
                    t.setDaemon(true);
                    return t;
                }),
                Executors.newCachedThreadPool(daemonThreads("Music-Completion-")));
    }

    PlayerRegistry(PlayerSettings settings, Extractor extractor, VoiceTransport transport, QueueStorage storage,
                   Clock clock, ScheduledExecutorService scheduler, ExecutorService completionExecutor) {
        this.settings = settings;
        this.extractor = extractor;
        this.transport = transport;
        this.storage = storage;
        this.clock = clock;
        this.scheduler = scheduler;
        this.completionExecutor = completionExecutor;
    }

    /**
     * Returns the guild's player, creating it and restoring its saved queue on first use.
     */
    public MusicPlayer getPlayer(long guildId) {
        return players.computeIfAbsent(guildId, id -> {
            MusicPlayer player = new MusicPlayer(id, settings, extractor, transport, storage, scheduler,
                    completionExecutor, clock);
            player.restoreState();
            BotLogger.debug("Created player for guild " + id);
            return player;
        });
    }

    /**
     * @return the guild's player, or null if none was created yet
     */
    public MusicPlayer getExistingPlayer(long guildId) {
        return players.get(guildId);
    }

    public int getPlayerCount() {
        return players.size();
    }

    /**
     * Forgets a guild the bot was removed from, including its saved queue.
     */
    public void removeGuild(long guildId) {
        MusicPlayer player = players.remove(guildId);
        if (player != null) {
            player.disconnect();
        }
        if (storage != null) {
            try {
                storage.clearGuildQueue(guildId);
            } catch (StorageException e) {
                BotLogger.storageError("Failed to clear queue of guild " + guildId, e);
            }
        }
        BotLogger.info("Removed guild " + guildId);
    }

    /**
     * Disconnects every player, stops the shared threads and closes storage.
     */
    public void shutdown() {
        BotLogger.status("Shutting down " + players.size() + " players");
        ExecutorService closer = Executors.newCachedThreadPool(daemonThreads("Music-Shutdown-"));
        try {
            List<Future<?>> pending = new ArrayList<>();
            for (MusicPlayer player : players.values()) {
                pending.add(closer.submit(player::disconnect));
            }
            for (Future<?> future : pending) {
                try {
                    future.get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                } catch (TimeoutException e) {
                    future.cancel(true);
                    BotLogger.warn("A player did not disconnect within " + SHUTDOWN_TIMEOUT_SECONDS + "s");
                } catch (ExecutionException e) {
                    BotLogger.warn("Error disconnecting player", e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            closer.shutdownNow();
        }
        players.clear();

        scheduler.shutdownNow();
        completionExecutor.shutdown();

        if (storage != null) {
            try {
                storage.close();
            } catch (RuntimeException e) {
                BotLogger.storageError("Error closing storage", e);
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
