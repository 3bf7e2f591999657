package com.example.guildmusic.extractor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of one yt-dlp lookup: either a single entry (a video or track url) or a collection
 * (a playlist or a search result).
 */
public abstract class ExtractionResult {

    private ExtractionResult() {
    }

    /**
     * All entries, in order. A single result has exactly one.
     */
    public abstract List<ExtractedInfo> getEntries();

    public abstract boolean isCollection();

    public static Single single(ExtractedInfo info) {
        return new Single(info);
    }

    public static Collection collection(String title, List<ExtractedInfo> entries) {
        return new Collection(title, entries);
    }

    public static final class Single extends ExtractionResult {
        private final ExtractedInfo info;

        private Single(ExtractedInfo info) {
            this.info = Objects.requireNonNull(info, "info");
        }

        public ExtractedInfo getInfo() {
            return info;
        }

        @Override
        public List<ExtractedInfo> getEntries() {
            return Collections.singletonList(info);
        }

        @Override
        public boolean isCollection() {
            return false;
        }
    }

    public static final class Collection extends ExtractionResult {
        private final String title;
        private final List<ExtractedInfo> entries;

        private Collection(String title, List<ExtractedInfo> entries) {
            this.title = title;
            List<ExtractedInfo> kept = new ArrayList<>();
            for (ExtractedInfo entry : entries) {
                if (entry != null) {
                    kept.add(entry);
                }
            }
            this.entries = Collections.unmodifiableList(kept);
        }

        /**
         * Playlist title, if yt-dlp reported one.
         */
        public String getTitle() {
            return title;
        }

        @Override
        public List<ExtractedInfo> getEntries() {
            return entries;
        }

        @Override
        public boolean isCollection() {
            return true;
        }
    }
}
