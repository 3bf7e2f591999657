package com.example.guildmusic.music;

import com.example.guildmusic.extractor.ExtractedInfo;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One playable item plus who asked for it.
 * <p>
 * The stream url is a short-lived direct media link. It is never part of the persisted form
 * and has to be refreshed through the extractor before the track is played.
 */
public class Track {
    public static final String DEFAULT_TITLE = "Unknown Title";
    public static final String DEFAULT_REQUESTER = "Unknown";
    public static final String DEFAULT_SOURCE = "unknown";
    private static final int MAX_DISPLAY_TITLE = 60;

    private final String url;
    private final String title;
    private final int duration;
    private final String thumbnail;
    private final String webpageUrl;
    private final String streamUrl;
    private final String source;
    private final Long requesterId;
    private final String requesterName;
    private final Instant addedAt;

    public Track(String url, String title, int duration, String thumbnail, String webpageUrl,
                 String streamUrl, String source, Long requesterId, String requesterName) {
        this(url, title, duration, thumbnail, webpageUrl, streamUrl, source, requesterId, requesterName, Instant.now());
    }

    public Track(String url, String title, int duration, String thumbnail, String webpageUrl,
                 String streamUrl, String source, Long requesterId, String requesterName, Instant addedAt) {
        this.url = url == null ? "" : url;
        this.title = title == null || title.isBlank() ? DEFAULT_TITLE : title;
        this.duration = Math.max(0, duration);
        this.thumbnail = thumbnail;
        this.webpageUrl = webpageUrl;
        this.streamUrl = streamUrl;
        this.source = source == null || source.isBlank() ? DEFAULT_SOURCE : source;
        this.requesterId = requesterId;
        this.requesterName = requesterName == null ? DEFAULT_REQUESTER : requesterName;
        this.addedAt = addedAt == null ? Instant.now() : addedAt;
    }

    /**
     * Builds a track from one extracted yt-dlp entry.
     */
    public static Track fromExtractedInfo(ExtractedInfo info, long requesterId, String requesterName) {
        Objects.requireNonNull(info, "info");
        String extractor = info.getExtractor() == null ? "" : info.getExtractor().toLowerCase(Locale.ROOT);
        String source;
        if (extractor.contains("youtube")) {
            source = "youtube";
        } else if (extractor.contains("soundcloud")) {
            source = "soundcloud";
        } else {
            source = extractor.isEmpty() ? DEFAULT_SOURCE : extractor;
        }

        String url = firstNonEmpty(info.getOriginalUrl(), info.getWebpageUrl(), info.getUrl());
        int duration = info.getDuration() == null ? 0 : (int) Math.floor(info.getDuration());

        return new Track(url, info.getTitle(), duration, info.getThumbnail(), info.getWebpageUrl(),
                info.getUrl(), source, requesterId, requesterName);
    }

    /**
     * Rebuilds a track from its persisted form. The result has no stream url.
     */
    public static Track fromMap(Map<String, ?> data) {
        Object duration = data.get("duration");
        Object requesterId = data.get("requester_id");
        return new Track(
                stringOrDefault(data.get("url"), ""),
                stringOrDefault(data.get("title"), DEFAULT_TITLE),
                duration instanceof Number ? ((Number) duration).intValue() : 0,
                stringOrDefault(data.get("thumbnail"), null),
                stringOrDefault(data.get("webpage_url"), null),
                null,
                stringOrDefault(data.get("source"), DEFAULT_SOURCE),
                requesterId instanceof Number ? ((Number) requesterId).longValue() : null,
                stringOrDefault(data.get("requester_name"), DEFAULT_REQUESTER));
    }

    /**
     * Persisted form of this track. The stream url is left out on purpose: it expires.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("url", url);
        map.put("title", title);
        map.put("duration", duration);
        map.put("thumbnail", thumbnail);
        map.put("webpage_url", webpageUrl);
        map.put("source", source);
        map.put("requester_id", requesterId);
        map.put("requester_name", requesterName);
        return map;
    }

    /**
     * Url handed to the extractor when a fresh stream url is needed.
     */
    public String getLookupUrl() {
        return webpageUrl != null && !webpageUrl.isEmpty() ? webpageUrl : url;
    }

    public boolean isLive() {
        return duration <= 0;
    }

    public String getDurationString() {
        return formatSeconds(duration);
    }

    public String getDisplayTitle() {
        if (title.length() > MAX_DISPLAY_TITLE) {
            return title.substring(0, MAX_DISPLAY_TITLE - 3) + "...";
        }
        return title;
    }

    /**
     * Formats seconds as H:MM:SS or M:SS, or "Live" for zero.
     */
    public static String formatSeconds(long seconds) {
        if (seconds <= 0) {
            return "Live";
        }
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return String.format("%d:%02d:%02d", hours, minutes, secs);
        }
        return String.format("%d:%02d", minutes, secs);
    }

    public String getUrl() {
        return url;
    }

    public String getTitle() {
        return title;
    }

    public int getDuration() {
        return duration;
    }

    public String getThumbnail() {
        return thumbnail;
    }

    public String getWebpageUrl() {
        return webpageUrl;
    }

    public String getStreamUrl() {
        return streamUrl;
    }

    public String getSource() {
        return source;
    }

    public Long getRequesterId() {
        return requesterId;
    }

    public String getRequesterName() {
        return requesterName;
    }

    public Instant getAddedAt() {
        return addedAt;
    }

    @Override
    public String toString() {
        return "Track{" + title + " (" + getDurationString() + ") " + url + "}";
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static String stringOrDefault(Object value, String fallback) {
        return value == null ? fallback : value.toString();
    }
}
