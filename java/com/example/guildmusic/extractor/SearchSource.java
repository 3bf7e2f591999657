package com.example.guildmusic.extractor;

/**
 * Sites the extractor can search by text.
 */
public enum SearchSource {
    YOUTUBE("ytsearch"),
    SOUNDCLOUD("scsearch");

    private final String prefix;

    SearchSource(String prefix) {
        this.prefix = prefix;
    }

    /**
     * yt-dlp search expression for {@code limit} results, e.g. {@code ytsearch5:lofi}.
     */
    public String toSearchQuery(String query, int limit) {
        return prefix + Math.max(1, limit) + ":" + query;
    }
}
