package com.example.guildmusic.extractor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The fields of one yt-dlp info entry that the bot uses.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractedInfo {
    private final String id;
    private final String title;
    private final Double duration;
    private final String thumbnail;
    private final String webpageUrl;
    private final String originalUrl;
    private final String url;
    private final String extractor;

    @JsonCreator
    public ExtractedInfo(@JsonProperty("id") String id,
                         @JsonProperty("title") String title,
                         @JsonProperty("duration") Double duration,
                         @JsonProperty("thumbnail") String thumbnail,
                         @JsonProperty("webpage_url") String webpageUrl,
                         @JsonProperty("original_url") String originalUrl,
                         @JsonProperty("url") String url,
                         @JsonProperty("extractor") String extractor) {
        this.id = id;
        this.title = title;
        this.duration = duration;
        this.thumbnail = thumbnail;
        this.webpageUrl = webpageUrl;
        this.originalUrl = originalUrl;
        this.url = url;
        this.extractor = extractor;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public Double getDuration() {
        return duration;
    }

    public String getThumbnail() {
        return thumbnail;
    }

    public String getWebpageUrl() {
        return webpageUrl;
    }

    public String getOriginalUrl() {
        return originalUrl;
    }

    /**
     * Direct media url. Expires after a while.
     */
    public String getUrl() {
        return url;
    }

    public String getExtractor() {
        return extractor;
    }
}
