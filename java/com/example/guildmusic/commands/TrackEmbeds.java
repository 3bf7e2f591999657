package com.example.guildmusic.commands;

import com.example.guildmusic.music.LoopMode;
import com.example.guildmusic.music.QueueSnapshot;
import com.example.guildmusic.music.Track;
import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.MessageEmbed;

import java.awt.Color;
import java.util.List;

/**
 * Embeds shown by the slash commands.
 */
public class TrackEmbeds {
    public static final Color COLOR_SUCCESS = new Color(0x43B581);
    public static final Color COLOR_WARNING = new Color(0xFAA61A);
    public static final Color COLOR_ERROR = new Color(0xF04747);
    private static final int PROGRESS_BAR_LENGTH = 15;

    private final Color primary;

    public TrackEmbeds(String embedColor) {
        this.primary = parseColor(embedColor);
    }

    static Color parseColor(String hex) {
        try {
            return Color.decode(hex);
        } catch (NumberFormatException | NullPointerException e) {
            return new Color(0x1DB954);
        }
    }

    public Color getPrimary() {
        return primary;
    }

    public MessageEmbed nowPlaying(Track track, long positionSeconds, int volume, LoopMode loopMode) {
        EmbedBuilder embed = trackEmbed(track, "🎵 Now Playing", primary);
        StringBuilder progress = new StringBuilder();
        if (!track.isLive()) {
            progress.append(progressBar(positionSeconds, track.getDuration())).append('\n');
        }
        progress.append('`').append(Track.formatSeconds(positionSeconds)).append(" / ")
                .append(track.getDurationString()).append('`');
        embed.addField("Progress", progress.toString(), false);
        embed.addField("Volume", volume + "%", true);
        embed.addField("Loop", loopLabel(loopMode), true);
        return embed.build();
    }

    public MessageEmbed trackAdded(Track track, int position) {
        EmbedBuilder embed = trackEmbed(track, "✅ Added to Queue", COLOR_SUCCESS);
        embed.addField("Position", "#" + (position + 1), true);
        return embed.build();
    }

    public MessageEmbed tracksAdded(String title, int added, int requested) {
        EmbedBuilder embed = new EmbedBuilder()
                .setTitle("📋 Playlist Added")
                .setColor(COLOR_SUCCESS)
                .setDescription("Added **" + added + "** tracks" + (title == null ? "" : " from **" + title + "**"));
        if (added < requested) {
            embed.setFooter((requested - added) + " tracks did not fit in the queue");
        }
        return embed.build();
    }

    public MessageEmbed queue(QueueSnapshot snapshot, List<Track> upcoming, long totalDuration, int page, int perPage) {
        EmbedBuilder embed = new EmbedBuilder().setTitle("📜 Music Queue").setColor(primary);
        if (snapshot.getTracks().isEmpty()) {
            embed.setDescription("The queue is empty. Use `/play` to add tracks!");
            return embed.build();
        }

        Track current = snapshot.getCurrent();
        if (current != null) {
            embed.addField("🎵 Now Playing", link(current) + " [" + current.getDurationString() + "]", false);
        }

        int totalPages = Math.max(1, (upcoming.size() + perPage - 1) / perPage);
        int shownPage = Math.max(0, Math.min(page, totalPages - 1));
        int start = shownPage * perPage;
        int end = Math.min(upcoming.size(), start + perPage);
        if (start < end) {
            StringBuilder lines = new StringBuilder();
            for (int i = start; i < end; i++) {
                Track track = upcoming.get(i);
                lines.append('`').append(i + 1).append(".` ").append(link(track))
                        .append(" [").append(track.getDurationString()).append("]\n");
            }
            embed.addField("📋 Up Next (" + upcoming.size() + " tracks)", lines.toString(), false);
        }

        embed.setFooter("Page " + (shownPage + 1) + "/" + totalPages + " • " + snapshot.getTracks().size()
                + " tracks • " + formatTotal(totalDuration) + " • Loop: " + loopLabel(snapshot.getLoopMode()));
        return embed.build();
    }

    public MessageEmbed searchResults(String query, List<Track> results) {
        StringBuilder lines = new StringBuilder();
        for (int i = 0; i < results.size(); i++) {
            Track track = results.get(i);
            lines.append('`').append(i + 1).append(".` ").append(link(track))
                    .append(" [").append(track.getDurationString()).append("]\n");
        }
        return new EmbedBuilder()
                .setTitle("🔍 Results for " + query)
                .setColor(primary)
                .setDescription(lines.toString())
                .setFooter("Run /search again with pick to queue one")
                .build();
    }

    public MessageEmbed playlists(String userName, List<String> names) {
        EmbedBuilder embed = new EmbedBuilder().setTitle("💾 Playlists of " + userName).setColor(primary);
        if (names.isEmpty()) {
            embed.setDescription("No saved playlists. Use `/playlist save` to create one.");
        } else {
            embed.setDescription("• " + String.join("\n• ", names));
        }
        return embed.build();
    }

    public MessageEmbed message(String title, String description, Color color) {
        return new EmbedBuilder().setTitle(title).setDescription(description).setColor(color).build();
    }

    public MessageEmbed error(String description) {
        return message("❌ Error", description, COLOR_ERROR);
    }

    private EmbedBuilder trackEmbed(Track track, String title, Color color) {
        EmbedBuilder embed = new EmbedBuilder()
                .setTitle(title)
                .setColor(color)
                .setDescription(link(track))
                .addField("Duration", track.getDurationString(), true)
                .addField("Source", sourceLabel(track.getSource()), true)
                .setFooter("Requested by " + track.getRequesterName());
        if (track.getThumbnail() != null && !track.getThumbnail().isEmpty()) {
            embed.setThumbnail(track.getThumbnail());
        }
        return embed;
    }

    static String progressBar(long position, long duration) {
        if (duration <= 0) {
            return "";
        }
        int filled = (int) Math.min(PROGRESS_BAR_LENGTH, position * PROGRESS_BAR_LENGTH / duration);
        StringBuilder bar = new StringBuilder();
        for (int i = 0; i < PROGRESS_BAR_LENGTH; i++) {
            bar.append(i == filled ? "🔘" : "▬");
        }
        return bar.toString();
    }

    static String formatTotal(long seconds) {
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        return minutes + "m " + (seconds % 60) + "s";
    }

    private static String link(Track track) {
        String url = track.getLookupUrl();
        if (url == null || url.isEmpty()) {
            return "**" + track.getDisplayTitle() + "**";
        }
        return "**[" + track.getDisplayTitle() + "](" + url + ")**";
    }

    private static String sourceLabel(String source) {
        switch (source) {
            case "youtube":
                return "🔴 YouTube";
            case "soundcloud":
                return "🟠 SoundCloud";
            default:
                return "🎵 " + source;
        }
    }

    private static String loopLabel(LoopMode loopMode) {
        switch (loopMode) {
            case ONE:
                return "🔂 Track";
            case ALL:
                return "🔁 Queue";
            default:
                return "➡️ Off";
        }
    }
}
