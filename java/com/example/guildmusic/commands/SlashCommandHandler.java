package com.example.guildmusic.commands;

import com.example.guildmusic.BotLogger;
import com.example.guildmusic.extractor.Extractor;
import com.example.guildmusic.extractor.SearchSource;
import com.example.guildmusic.music.LoopMode;
import com.example.guildmusic.music.MusicPlayer;
import com.example.guildmusic.music.PlayerRegistry;
import com.example.guildmusic.music.QueueSnapshot;
import com.example.guildmusic.music.Track;
import com.example.guildmusic.storage.QueueStorage;
import com.example.guildmusic.storage.StorageException;
import net.dv8tion.jda.api.entities.GuildVoiceState;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.channel.middleman.AudioChannel;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.InteractionHook;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Routes slash commands to the guild's {@link MusicPlayer}.
 * <p>
 * Anything that may block (yt-dlp lookups, voice connects, storage) runs on the command
 * executor after the reply has been deferred, never on JDA's event thread.
 */
public class SlashCommandHandler {
    private static final int SEARCH_RESULTS = 5;
    private static final int MAX_PLAYLIST_NAME = 50;

    private final PlayerRegistry registry;
    private final Extractor extractor;
    private final QueueStorage storage;
    private final RateLimiter rateLimiter;
    private final TrackEmbeds embeds;
    private final int maxQueueDisplay;
    private final ExecutorService commandExecutor;

    public SlashCommandHandler(PlayerRegistry registry, Extractor extractor, QueueStorage storage,
                               RateLimiter rateLimiter, TrackEmbeds embeds, int maxQueueDisplay,
                               ExecutorService commandExecutor) {
        this.registry = registry;
        this.extractor = extractor;
        this.storage = storage;
        this.rateLimiter = rateLimiter;
        this.embeds = embeds;
        this.maxQueueDisplay = maxQueueDisplay;
        this.commandExecutor = commandExecutor;
    }

    public void handleSlashCommand(SlashCommandInteractionEvent event) {
        if (!event.isFromGuild() || event.getGuild() == null) {
            event.replyEmbeds(embeds.error("Music commands only work in a server.")).setEphemeral(true).queue();
            return;
        }
        long userId = event.getUser().getIdLong();
        if (rateLimiter.isLimited(userId)) {
            event.replyEmbeds(embeds.message("⏳ Slow down",
                    "Too many commands. Try again in " + rateLimiter.getRetryAfterSeconds(userId) + "s.",
                    TrackEmbeds.COLOR_WARNING)).setEphemeral(true).queue();
            return;
        }

        String commandName = event.getFullCommandName();
        BotLogger.command(event.getGuild().getId(), event.getUser().getName(), commandName, describeOptions(event));

        if ("help".equals(commandName)) {
            event.replyEmbeds(helpEmbed()).setEphemeral(true).queue();
            return;
        }

        event.deferReply().queue();
        InteractionHook hook = event.getHook();
        try {
            commandExecutor.execute(() -> {
                try {
                    hook.sendMessageEmbeds(execute(event)).queue();
                } catch (Exception e) {
                    BotLogger.error("Error while processing /" + commandName, e);
                    hook.sendMessageEmbeds(embeds.error("Something went wrong: " + e.getMessage())).queue();
                }
            });
        } catch (RejectedExecutionException e) {
            hook.sendMessageEmbeds(embeds.error("The bot is shutting down.")).queue();
        }
    }

    MessageEmbed execute(SlashCommandInteractionEvent event) {
        long guildId = event.getGuild().getIdLong();
        switch (event.getFullCommandName()) {
            case "play":
                return handlePlay(event, guildId);
            case "search":
                return handleSearch(event, guildId);
            case "pause":
                return handlePause(guildId);
            case "resume":
                return handleResume(guildId);
            case "skip":
                return handleSkip(guildId);
            case "stop":
                return handleStop(guildId);
            case "seek":
                return handleSeek(event, guildId);
            case "volume":
                return handleVolume(event, guildId);
            case "queue":
                return handleQueue(event, guildId);
            case "nowplaying":
                return handleNowPlaying(guildId);
            case "remove":
                return handleRemove(event, guildId);
            case "move":
                return handleMove(event, guildId);
            case "clear":
                return handleClear(guildId);
            case "shuffle":
                return handleShuffle(guildId);
            case "loop":
                return handleLoop(event, guildId);
            case "previous":
                return handlePrevious(guildId);
            case "jump":
                return handleJump(event, guildId);
            case "join":
                return handleJoin(event, guildId);
            case "leave":
                return handleLeave(guildId);
            case "playlist save":
                return handlePlaylistSave(event, guildId);
            case "playlist load":
                return handlePlaylistLoad(event, guildId);
            case "playlist list":
                return handlePlaylistList(event);
            case "playlist delete":
                return handlePlaylistDelete(event);
            case "ping":
                return embeds.message("🏓 Pong!", "Gateway latency: " + event.getJDA().getGatewayPing() + "ms",
                        embeds.getPrimary());
            default:
                return embeds.error("Unknown command: " + event.getFullCommandName());
        }
    }

    private MessageEmbed handlePlay(SlashCommandInteractionEvent event, long guildId) {
        AudioChannel channel = memberChannel(event.getMember());
        if (channel == null) {
            return notInVoice();
        }
        String query = event.getOption("query", OptionMapping::getAsString);
        List<Track> tracks = extractor.extract(query, event.getUser().getIdLong(), event.getMember().getEffectiveName());
        if (tracks.isEmpty()) {
            return embeds.error("No results found for `" + query + "`.");
        }

        MusicPlayer player = joinAndBind(event, guildId, channel);
        if (player == null) {
            return embeds.error("Could not join " + channel.getName() + ".");
        }
        return enqueue(player, tracks, null);
    }

    private MessageEmbed handleSearch(SlashCommandInteractionEvent event, long guildId) {
        String query = event.getOption("query", OptionMapping::getAsString);
        String sourceName = event.getOption("source", "youtube", OptionMapping::getAsString);
        SearchSource source = "soundcloud".equalsIgnoreCase(sourceName) ? SearchSource.SOUNDCLOUD : SearchSource.YOUTUBE;
        Integer pick = event.getOption("pick", OptionMapping::getAsInt);

        List<Track> results = extractor.search(query, event.getUser().getIdLong(),
                event.getMember().getEffectiveName(), SEARCH_RESULTS, source);
        if (results.isEmpty()) {
            return embeds.error("No results found for `" + query + "`.");
        }
        if (pick == null) {
            return embeds.searchResults(query, results);
        }
        if (pick < 1 || pick > results.size()) {
            return embeds.error("Pick a result between 1 and " + results.size() + ".");
        }

        AudioChannel channel = memberChannel(event.getMember());
        if (channel == null) {
            return notInVoice();
        }
        MusicPlayer player = joinAndBind(event, guildId, channel);
        if (player == null) {
            return embeds.error("Could not join " + channel.getName() + ".");
        }
        return enqueue(player, List.of(results.get(pick - 1)), null);
    }

    private MessageEmbed enqueue(MusicPlayer player, List<Track> tracks, String title) {
        MessageEmbed reply;
        if (tracks.size() == 1) {
            Track track = tracks.get(0);
            if (!player.addTrack(track)) {
                return embeds.error("The queue is full.");
            }
            reply = embeds.trackAdded(track, player.getQueueSize() - 1);
        } else {
            int added = player.addTracks(tracks);
            if (added == 0) {
                return embeds.error("The queue is full.");
            }
            reply = embeds.tracksAdded(title, added, tracks.size());
        }
        if (!player.isPlaying() && !player.isPaused()) {
            player.play();
        }
        return reply;
    }

    private MessageEmbed handlePause(long guildId) {
        MusicPlayer player = registry.getExistingPlayer(guildId);
        if (player == null || !player.pause()) {
            return embeds.error("Nothing is playing.");
        }
        return embeds.message("⏸️ Paused", "Use `/resume` to continue.", embeds.getPrimary());
    }

    private MessageEmbed handleResume(long guildId) {
        MusicPlayer player = registry.getExistingPlayer(guildId);
        if (player == null || !player.resume()) {
            return embeds.error("Playback is not paused.");
        }
        return embeds.message("▶️ Resumed", "Playback continues.", embeds.getPrimary());
    }

    private MessageEmbed handleSkip(long guildId) {
        MusicPlayer player = connectedPlayer(guildId);
        if (player == null) {
            return notConnected();
        }
        Track next = player.skip();
        if (next == null) {
            return embeds.message("⏭️ Skipped", "That was the last track in the queue.", embeds.getPrimary());
        }
        return embeds.message("⏭️ Skipped", "Now playing **" + next.getDisplayTitle() + "**", embeds.getPrimary());
    }

    private MessageEmbed handleStop(long guildId) {
        MusicPlayer player = registry.getExistingPlayer(guildId);
        if (player == null) {
            return notConnected();
        }
        player.stop();
        return embeds.message("⏹️ Stopped", "Playback stopped and the queue was cleared.", embeds.getPrimary());
    }

    private MessageEmbed handleSeek(SlashCommandInteractionEvent event, long guildId) {
        MusicPlayer player = connectedPlayer(guildId);
        if (player == null) {
            return notConnected();
        }
        long seconds = event.getOption("seconds", OptionMapping::getAsLong);
        if (!player.seek(seconds)) {
            return embeds.error("Cannot seek to " + seconds + "s in this track.");
        }
        return embeds.message("⏩ Seeked", "Jumped to `" + Track.formatSeconds(seconds) + "`", embeds.getPrimary());
    }

    private MessageEmbed handleVolume(SlashCommandInteractionEvent event, long guildId) {
        MusicPlayer player = registry.getPlayer(guildId);
        Integer level = event.getOption("level", OptionMapping::getAsInt);
        if (level == null) {
            return embeds.message("🔊 Volume", "Volume is " + player.getVolume() + "%", embeds.getPrimary());
        }
        int set = player.setVolume(level);
        return embeds.message("🔊 Volume", "Volume set to " + set + "%", embeds.getPrimary());
    }

    private MessageEmbed handleQueue(SlashCommandInteractionEvent event, long guildId) {
        MusicPlayer player = registry.getPlayer(guildId);
        int page = event.getOption("page", 1, OptionMapping::getAsInt);
        return embeds.queue(player.getQueueSnapshot(), player.getUpcoming(), player.getTotalDuration(),
                page - 1, maxQueueDisplay);
    }

    private MessageEmbed handleNowPlaying(long guildId) {
        MusicPlayer player = registry.getExistingPlayer(guildId);
        if (player == null || (!player.isPlaying() && !player.isPaused())) {
            return embeds.error("Nothing is playing.");
        }
        return embeds.nowPlaying(player.getCurrentTrack(), player.getPositionSeconds(), player.getVolume(),
                player.getLoopMode());
    }

    private MessageEmbed handleRemove(SlashCommandInteractionEvent event, long guildId) {
        MusicPlayer player = registry.getPlayer(guildId);
        int position = event.getOption("position", OptionMapping::getAsInt);
        Track removed = position < 1 ? null : player.removeTrack(upcomingIndex(player, position));
        if (removed == null) {
            return embeds.error("There is no track at position " + position + ".");
        }
        return embeds.message("🗑️ Removed", "**" + removed.getDisplayTitle() + "**", embeds.getPrimary());
    }

    private MessageEmbed handleMove(SlashCommandInteractionEvent event, long guildId) {
        MusicPlayer player = registry.getPlayer(guildId);
        int from = event.getOption("from", OptionMapping::getAsInt);
        int to = event.getOption("to", OptionMapping::getAsInt);
        if (from < 1 || to < 1 || !player.moveTrack(upcomingIndex(player, from), upcomingIndex(player, to))) {
            return embeds.error("Invalid positions.");
        }
        return embeds.message("↕️ Moved", "Moved track " + from + " to position " + to + ".", embeds.getPrimary());
    }

    private MessageEmbed handleClear(long guildId) {
        int removed = registry.getPlayer(guildId).clearQueue();
        return embeds.message("🧹 Cleared", "Removed " + removed + " upcoming tracks.", embeds.getPrimary());
    }

    private MessageEmbed handleShuffle(long guildId) {
        MusicPlayer player = registry.getPlayer(guildId);
        if (player.getUpcoming().size() < 2) {
            return embeds.error("Need at least 2 upcoming tracks to shuffle.");
        }
        player.shuffle();
        return embeds.message("🔀 Shuffled", "The upcoming tracks were shuffled.", embeds.getPrimary());
    }

    private MessageEmbed handleLoop(SlashCommandInteractionEvent event, long guildId) {
        LoopMode mode = LoopMode.fromValue(event.getOption("mode", OptionMapping::getAsString));
        registry.getPlayer(guildId).setLoopMode(mode);
        return embeds.message("🔁 Loop", "Loop mode set to **" + mode.getValue() + "**", embeds.getPrimary());
    }

    private MessageEmbed handlePrevious(long guildId) {
        MusicPlayer player = connectedPlayer(guildId);
        if (player == null) {
            return notConnected();
        }
        Track track = player.previous();
        if (track == null) {
            return embeds.error("There is no previous track.");
        }
        return embeds.message("⏮️ Previous", "Now playing **" + track.getDisplayTitle() + "**", embeds.getPrimary());
    }

    private MessageEmbed handleJump(SlashCommandInteractionEvent event, long guildId) {
        MusicPlayer player = connectedPlayer(guildId);
        if (player == null) {
            return notConnected();
        }
        int position = event.getOption("position", OptionMapping::getAsInt);
        Track track = position < 1 ? null : player.jump(upcomingIndex(player, position));
        if (track == null) {
            return embeds.error("There is no track at position " + position + ".");
        }
        return embeds.message("⏭️ Jumped", "Now playing **" + track.getDisplayTitle() + "**", embeds.getPrimary());
    }

    private MessageEmbed handleJoin(SlashCommandInteractionEvent event, long guildId) {
        AudioChannel channel = memberChannel(event.getMember());
        if (channel == null) {
            return notInVoice();
        }
        if (joinAndBind(event, guildId, channel) == null) {
            return embeds.error("Could not join " + channel.getName() + ".");
        }
        return embeds.message("👋 Joined", "Connected to **" + channel.getName() + "**", TrackEmbeds.COLOR_SUCCESS);
    }

    private MessageEmbed handleLeave(long guildId) {
        MusicPlayer player = connectedPlayer(guildId);
        if (player == null) {
            return notConnected();
        }
        player.disconnect();
        return embeds.message("👋 Left", "Disconnected from voice.", embeds.getPrimary());
    }

    private MessageEmbed handlePlaylistSave(SlashCommandInteractionEvent event, long guildId) {
        String name = playlistName(event);
        if (name == null) {
            return embeds.error("Playlist names must be 1-" + MAX_PLAYLIST_NAME + " characters.");
        }
        QueueSnapshot snapshot = registry.getPlayer(guildId).getQueueSnapshot();
        if (snapshot.getTracks().isEmpty()) {
            return embeds.error("The queue is empty, nothing to save.");
        }
        try {
            storage.savePlaylist(event.getUser().getIdLong(), name, snapshot.getTracks());
        } catch (StorageException e) {
            BotLogger.storageError("Failed to save playlist " + name, e);
            return embeds.error("Could not save the playlist.");
        }
        return embeds.message("💾 Saved", "Saved **" + snapshot.getTracks().size() + "** tracks as **" + name + "**",
                TrackEmbeds.COLOR_SUCCESS);
    }

    private MessageEmbed handlePlaylistLoad(SlashCommandInteractionEvent event, long guildId) {
        String name = playlistName(event);
        if (name == null) {
            return embeds.error("Playlist names must be 1-" + MAX_PLAYLIST_NAME + " characters.");
        }
        AudioChannel channel = memberChannel(event.getMember());
        if (channel == null) {
            return notInVoice();
        }
        List<Track> tracks;
        try {
            tracks = storage.loadPlaylist(event.getUser().getIdLong(), name);
        } catch (StorageException e) {
            BotLogger.storageError("Failed to load playlist " + name, e);
            return embeds.error("Could not load the playlist.");
        }
        if (tracks == null || tracks.isEmpty()) {
            return embeds.error("No playlist named **" + name + "**.");
        }
        MusicPlayer player = joinAndBind(event, guildId, channel);
        if (player == null) {
            return embeds.error("Could not join " + channel.getName() + ".");
        }
        return enqueue(player, tracks, name);
    }

    private MessageEmbed handlePlaylistList(SlashCommandInteractionEvent event) {
        try {
            return embeds.playlists(event.getUser().getName(), storage.listPlaylists(event.getUser().getIdLong()));
        } catch (StorageException e) {
            BotLogger.storageError("Failed to list playlists", e);
            return embeds.error("Could not list your playlists.");
        }
    }

    private MessageEmbed handlePlaylistDelete(SlashCommandInteractionEvent event) {
        String name = playlistName(event);
        try {
            if (name == null || !storage.deletePlaylist(event.getUser().getIdLong(), name)) {
                return embeds.error("No playlist named **" + name + "**.");
            }
        } catch (StorageException e) {
            BotLogger.storageError("Failed to delete playlist " + name, e);
            return embeds.error("Could not delete the playlist.");
        }
        return embeds.message("🗑️ Deleted", "Deleted playlist **" + name + "**", embeds.getPrimary());
    }

    /**
     * Connects the guild's player to {@code channel} and points its notifications at the
     * channel the command came from.
     *
     * @return the player, or null if the channel could not be joined
     */
    private MusicPlayer joinAndBind(SlashCommandInteractionEvent event, long guildId, AudioChannel channel) {
        MusicPlayer player = registry.getPlayer(guildId);
        if (!player.connect(channel.getIdLong())) {
            return null;
        }
        MessageChannel textChannel = event.getChannel();
        player.setTrackStartListener(track -> textChannel.sendMessageEmbeds(
                embeds.nowPlaying(track, 0, player.getVolume(), player.getLoopMode())).queue());
        player.setQueueEndListener(() -> textChannel.sendMessageEmbeds(
                embeds.message("✅ Queue finished", "Add more with `/play`.", embeds.getPrimary())).queue());
        return player;
    }

    private MusicPlayer connectedPlayer(long guildId) {
        MusicPlayer player = registry.getExistingPlayer(guildId);
        return player != null && player.isConnected() ? player : null;
    }

    /**
     * Converts a 1-based position in the "Up Next" list into a queue index.
     */
    private static int upcomingIndex(MusicPlayer player, int position) {
        return player.getQueueSnapshot().getCurrentIndex() + position;
    }

    private static AudioChannel memberChannel(Member member) {
        if (member == null) {
            return null;
        }
        GuildVoiceState voiceState = member.getVoiceState();
        if (voiceState == null || !voiceState.inAudioChannel()) {
            return null;
        }
        return voiceState.getChannel();
    }

    private static String playlistName(SlashCommandInteractionEvent event) {
        String name = event.getOption("name", OptionMapping::getAsString);
        if (name == null) {
            return null;
        }
        name = name.trim();
        return name.isEmpty() || name.length() > MAX_PLAYLIST_NAME ? null : name;
    }

    private static String describeOptions(SlashCommandInteractionEvent event) {
        return event.getOptions().stream()
                .map(option -> option.getName() + "=" + option.getAsString())
                .collect(Collectors.joining(" "));
    }

    private MessageEmbed notInVoice() {
        return embeds.error("You must be in a voice channel to use this command!");
    }

    private MessageEmbed notConnected() {
        return embeds.error("I'm not connected to a voice channel.");
    }

    private MessageEmbed helpEmbed() {
        String[][] commands = {
                {"/play <query>", "Play a URL or search YouTube"},
                {"/search <query> [source] [pick]", "Search YouTube or SoundCloud"},
                {"/pause, /resume", "Pause or resume playback"},
                {"/skip, /previous", "Next or previous track"},
                {"/jump <position>", "Play a track from the queue"},
                {"/stop", "Stop and clear the queue"},
                {"/seek <seconds>", "Jump within the current track"},
                {"/volume [level]", "Show or set volume (0-200)"},
                {"/queue [page]", "Show the queue"},
                {"/nowplaying", "Show the current track"},
                {"/remove, /move", "Edit the queue"},
                {"/clear, /shuffle", "Clear or shuffle upcoming tracks"},
                {"/loop <off|one|all>", "Set loop mode"},
                {"/join, /leave", "Join or leave your voice channel"},
                {"/playlist save|load|list|delete", "Personal playlists"},
        };
        StringBuilder description = new StringBuilder();
        for (String[] command : commands) {
            description.append('`').append(command[0]).append("` ").append(command[1]).append('\n');
        }
        return embeds.message("🎵 Commands", description.toString(), embeds.getPrimary());
    }
}
