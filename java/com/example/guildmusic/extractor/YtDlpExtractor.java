package com.example.guildmusic.extractor;

import com.example.guildmusic.BotLogger;
import com.example.guildmusic.music.Track;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * {@link Extractor} backed by the yt-dlp command line tool.
 * <p>
 * Each lookup starts one {@code yt-dlp --dump-single-json} process and parses its output.
 * The calling thread blocks until the process finishes or the timeout runs out.
 */
public class YtDlpExtractor implements Extractor {
    private static final Pattern URL_PATTERN = Pattern.compile("^https?://\\S+");
    private static final Pattern YOUTUBE_PATTERN = Pattern.compile("^(https?://)?(www\\.|m\\.|music\\.)?(youtube\\.com|youtu\\.be)/.+");
    private static final Pattern SOUNDCLOUD_PATTERN = Pattern.compile("^(https?://)?(www\\.|m\\.)?soundcloud\\.com/.+");

    private final String executable;
    private final String cookiesPath;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    // Drains process output so a chatty yt-dlp never blocks on a full pipe
    private final ExecutorService outputReaders;

    public YtDlpExtractor(String executable, String cookiesPath, Duration timeout) {
        this.executable = executable == null || executable.isBlank() ? "yt-dlp" : executable;
        this.cookiesPath = cookiesPath == null || cookiesPath.isBlank() ? null : cookiesPath;
        this.timeout = timeout;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        AtomicInteger threadCount = new AtomicInteger();
        this.outputReaders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "yt-dlp-reader-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static boolean isUrl(String query) {
        return query != null && URL_PATTERN.matcher(query.trim()).matches();
    }

    public static boolean isYouTubeUrl(String url) {
        return url != null && YOUTUBE_PATTERN.matcher(url.trim()).matches();
    }

    public static boolean isSoundCloudUrl(String url) {
        return url != null && SOUNDCLOUD_PATTERN.matcher(url.trim()).matches();
    }

    public static boolean isPlaylistUrl(String url) {
        return url != null && (url.toLowerCase(Locale.ROOT).contains("playlist") || url.contains("list="));
    }

    @Override
    public List<Track> extract(String query, long requesterId, String requesterName) {
        if (query == null || query.isBlank()) {
            return new ArrayList<>();
        }
        String lookup = query.trim();
        if (!isUrl(lookup)) {
            lookup = SearchSource.YOUTUBE.toSearchQuery(lookup, 1);
        }
        return toTracks(lookup, requesterId, requesterName);
    }

    @Override
    public List<Track> search(String query, long requesterId, String requesterName, int limit, SearchSource source) {
        if (query == null || query.isBlank()) {
            return new ArrayList<>();
        }
        SearchSource searchSource = source == null ? SearchSource.YOUTUBE : source;
        return toTracks(searchSource.toSearchQuery(query.trim(), limit), requesterId, requesterName);
    }

    @Override
    public String getStreamUrl(Track track) {
        String lookup = track.getLookupUrl();
        if (lookup == null || lookup.isEmpty()) {
            return null;
        }
        try {
            ExtractionResult result = run(lookup, true);
            if (result == null) {
                return null;
            }
            for (ExtractedInfo entry : result.getEntries()) {
                if (entry.getUrl() != null && !entry.getUrl().isEmpty()) {
                    return entry.getUrl();
                }
            }
            return null;
        } catch (IOException e) {
            BotLogger.warn("Failed to get stream url for '" + track.getTitle() + "': " + e.getMessage());
            return null;
        }
    }

    private List<Track> toTracks(String lookup, long requesterId, String requesterName) {
        List<Track> tracks = new ArrayList<>();
        try {
            ExtractionResult result = run(lookup, false);
            if (result == null) {
                return tracks;
            }
            for (ExtractedInfo entry : result.getEntries()) {
                tracks.add(Track.fromExtractedInfo(entry, requesterId, requesterName));
            }
        } catch (IOException e) {
            BotLogger.warn("Extraction failed for '" + lookup + "': " + e.getMessage());
        }
        return tracks;
    }

    List<String> buildCommand(String lookup, boolean singleItem) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--dump-single-json");
        command.add("--no-warnings");
        command.add("--no-check-certificates");
        command.add("--geo-bypass");
        command.add("--format");
        command.add("bestaudio/best");
        command.add("--default-search");
        command.add("ytsearch");
        command.add(singleItem ? "--no-playlist" : "--yes-playlist");
        if (cookiesPath != null) {
            command.add("--cookies");
            command.add(cookiesPath);
        }
        // Everything after "--" is the lookup, even if it starts with a dash
        command.add("--");
        command.add(lookup);
        return command;
    }

    /**
     * Runs yt-dlp and parses its output.
     *
     * @return the parsed result, or null if yt-dlp found nothing
     */
    private ExtractionResult run(String lookup, boolean singleItem) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(buildCommand(lookup, singleItem));
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process = pb.start();

        Future<String> output = outputReaders.submit(() -> readFully(process.getInputStream()));
        try {
            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                throw new IOException("yt-dlp timed out after " + timeout.toSeconds() + "s");
            }
            String json = output.get(5, TimeUnit.SECONDS);
            if (process.exitValue() != 0 && json.isBlank()) {
                throw new IOException("yt-dlp exited with code " + process.exitValue());
            }
            return parseResult(json);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for yt-dlp", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Could not read yt-dlp output", e);
        } finally {
            output.cancel(true);
        }
    }

    /**
     * Turns yt-dlp's JSON into a result. A document with an {@code entries} array is a playlist
     * or search result; anything else is a single entry.
     *
     * @return the result, or null for blank or {@code null} output
     */
    ExtractionResult parseResult(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return null;
        }
        JsonNode root = objectMapper.readTree(json);
        if (root == null || root.isNull() || root.isMissingNode()) {
            return null;
        }

        JsonNode entries = root.get("entries");
        if (entries != null && entries.isArray()) {
            List<ExtractedInfo> infos = new ArrayList<>();
            for (JsonNode entry : entries) {
                if (entry != null && entry.isObject()) {
                    infos.add(objectMapper.treeToValue(entry, ExtractedInfo.class));
                }
            }
            JsonNode title = root.get("title");
            return ExtractionResult.collection(title == null || title.isNull() ? null : title.asText(), infos);
        }
        return ExtractionResult.single(objectMapper.treeToValue(root, ExtractedInfo.class));
    }

    private static String readFully(InputStream in) throws IOException {
        try (InputStream stream = in) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public void shutdown() {
        outputReaders.shutdownNow();
    }
}
