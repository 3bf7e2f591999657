package com.example.guildmusic;

import com.example.guildmusic.commands.RateLimiter;
import com.example.guildmusic.commands.SlashCommandHandler;
import com.example.guildmusic.commands.TrackEmbeds;
import com.example.guildmusic.extractor.YtDlpExtractor;
import com.example.guildmusic.music.PlayerRegistry;
import com.example.guildmusic.storage.InMemoryStorage;
import com.example.guildmusic.storage.JsonFileStorage;
import com.example.guildmusic.storage.QueueStorage;
import com.example.guildmusic.storage.StorageException;
import com.example.guildmusic.voice.LavaplayerVoiceTransport;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.entities.Activity;
import net.dv8tion.jda.api.events.guild.GuildLeaveEvent;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.events.session.ReadyEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.OptionData;
import net.dv8tion.jda.api.interactions.commands.build.SubcommandData;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.cache.CacheFlag;

import java.io.File;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.EnumSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class Bot extends ListenerAdapter {
    private static final int COMMAND_THREADS = 4;

    private final BotConfig config;
    private final QueueStorage storage;
    private final YtDlpExtractor extractor;
    private final RateLimiter rateLimiter;
    private final ExecutorService commandExecutor;
    private volatile JDA jda;
    private volatile PlayerRegistry registry;
    private volatile SlashCommandHandler slashCommandHandler;

    public Bot(BotConfig config) throws StorageException {
        this.config = config;
        this.storage = createStorage(config);
        this.extractor = new YtDlpExtractor(config.getYtDlpPath(), config.getYoutubeCookiesPath(),
                Duration.ofSeconds(config.getExtractionTimeout()));
        this.rateLimiter = new RateLimiter(config.getRateLimitCommands(), Duration.ofSeconds(60));
        AtomicInteger threadCount = new AtomicInteger();
        this.commandExecutor = Executors.newFixedThreadPool(COMMAND_THREADS, r -> {
            Thread t = new Thread(r, "Command-Worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    static QueueStorage createStorage(BotConfig config) throws StorageException {
        if (BotConfig.STORAGE_MEMORY.equals(config.getStorageType())) {
            BotLogger.info("Using in-memory storage, queues are lost on restart");
            return new InMemoryStorage();
        }
        return new JsonFileStorage(Paths.get(config.getDataDir()));
    }

    public void start() throws InterruptedException {
        BotLogger.status("Starting bot...");

        // Only voice states are needed: everything else arrives through interactions
        jda = JDABuilder.createDefault(config.getToken(), EnumSet.of(GatewayIntent.GUILD_VOICE_STATES))
                .enableCache(CacheFlag.VOICE_STATE)
                .setActivity(Activity.listening("/play"))
                .addEventListeners(this)
                .setBulkDeleteSplittingEnabled(false)
                .setAutoReconnect(true)
                .build();

        registry = new PlayerRegistry(config.toPlayerSettings(), extractor, new LavaplayerVoiceTransport(jda), storage);
        slashCommandHandler = new SlashCommandHandler(registry, extractor, storage, rateLimiter,
                new TrackEmbeds(config.getEmbedColor()), config.getMaxQueueDisplay(), commandExecutor);

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "Bot-Shutdown"));
        jda.awaitReady();
    }

    @Override
    public void onReady(ReadyEvent event) {
        BotLogger.status("Music Bot successfully connected to Discord! Serving "
                + event.getGuildTotalCount() + " servers");
        registerSlashCommands(event.getJDA());
    }

    private void registerSlashCommands(JDA jda) {
        BotLogger.info("Registering slash commands...");
        jda.updateCommands().addCommands(
                Commands.slash("play", "Play a song from URL or search query")
                        .addOption(OptionType.STRING, "query", "YouTube/SoundCloud URL or search query", true),
                Commands.slash("search", "Search for a song")
                        .addOption(OptionType.STRING, "query", "What to search for", true)
                        .addOptions(new OptionData(OptionType.STRING, "source", "Where to search")
                                .addChoice("YouTube", "youtube")
                                .addChoice("SoundCloud", "soundcloud"))
                        .addOption(OptionType.INTEGER, "pick", "Queue this result number", false),
                Commands.slash("pause", "Pause playback"),
                Commands.slash("resume", "Resume playback"),
                Commands.slash("skip", "Skip to the next track"),
                Commands.slash("stop", "Stop playback and clear the queue"),
                Commands.slash("seek", "Seek to a position in the current track")
                        .addOption(OptionType.INTEGER, "seconds", "Position in seconds", true),
                Commands.slash("volume", "Show or set playback volume")
                        .addOptions(new OptionData(OptionType.INTEGER, "level", "Volume level (0-200)")
                                .setRequiredRange(0, 200)),
                Commands.slash("queue", "Show the current queue")
                        .addOption(OptionType.INTEGER, "page", "Page number", false),
                Commands.slash("nowplaying", "Show the currently playing track"),
                Commands.slash("remove", "Remove a track from the queue")
                        .addOption(OptionType.INTEGER, "position", "Position in Up Next (1-based)", true),
                Commands.slash("move", "Move a track in the queue")
                        .addOption(OptionType.INTEGER, "from", "Current position in Up Next", true)
                        .addOption(OptionType.INTEGER, "to", "New position in Up Next", true),
                Commands.slash("clear", "Clear the queue (keeps current track)"),
                Commands.slash("shuffle", "Shuffle the queue"),
                Commands.slash("loop", "Set loop mode")
                        .addOptions(new OptionData(OptionType.STRING, "mode", "Loop mode", true)
                                .addChoice("Off", "off")
                                .addChoice("Track", "one")
                                .addChoice("Queue", "all")),
                Commands.slash("previous", "Play the previous track"),
                Commands.slash("jump", "Play a track from the queue")
                        .addOption(OptionType.INTEGER, "position", "Position in Up Next (1-based)", true),
                Commands.slash("join", "Join your voice channel"),
                Commands.slash("leave", "Leave the voice channel"),
                Commands.slash("playlist", "Manage your saved playlists").addSubcommands(
                        new SubcommandData("save", "Save the current queue")
                                .addOption(OptionType.STRING, "name", "Playlist name", true),
                        new SubcommandData("load", "Queue a saved playlist")
                                .addOption(OptionType.STRING, "name", "Playlist name", true),
                        new SubcommandData("list", "List your playlists"),
                        new SubcommandData("delete", "Delete a playlist")
                                .addOption(OptionType.STRING, "name", "Playlist name", true)),
                Commands.slash("ping", "Check the bot's response time"),
                Commands.slash("help", "Show help and command list")
        ).queue(
                commands -> BotLogger.info("Registered " + commands.size() + " slash commands"),
                error -> BotLogger.error("Failed to register slash commands", error));
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        SlashCommandHandler handler = slashCommandHandler;
        if (handler == null) {
            event.reply("Still starting up, try again in a moment.").setEphemeral(true).queue();
            return;
        }
        handler.handleSlashCommand(event);
    }

    @Override
    public void onGuildLeave(GuildLeaveEvent event) {
        long guildId = event.getGuild().getIdLong();
        if (registry == null) {
            return;
        }
        commandExecutor.execute(() -> registry.removeGuild(guildId));
    }

    public void shutdown() {
        BotLogger.status("Shutting down...");
        commandExecutor.shutdown();
        try {
            if (!commandExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                commandExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            commandExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (registry != null) {
            registry.shutdown();
        }
        extractor.shutdown();
        if (jda != null) {
            jda.shutdown();
        }
    }

    public static void main(String[] args) {
        BotConfig config = args.length > 0 ? new BotConfig(new File(args[0])) : new BotConfig();
        BotLogger.applyLevel(config.getLogLevel());
        if (config.isDebugLogging()) {
            BotLogger.info("Log level " + config.getLogLevel() + ", storage " + config.getStorageType()
                    + ", yt-dlp at " + config.getYtDlpPath());
        }
        if (!config.hasToken()) {
            BotLogger.error("No bot token configured. Fill in 'token' in " + (args.length > 0 ? args[0] : BotConfig.DEFAULT_FILE));
            System.exit(1);
        }
        try {
            new Bot(config).start();
        } catch (StorageException e) {
            BotLogger.error("Storage unavailable: " + e.getMessage(), e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            BotLogger.error("Interrupted while starting");
            System.exit(1);
        } catch (RuntimeException e) {
            BotLogger.error("Failed to start bot", e);
            System.exit(1);
        }
    }
}
