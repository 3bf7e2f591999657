package com.example.guildmusic.extractor;

import com.example.guildmusic.music.Track;

import java.util.List;

/**
 * Resolves urls and search text to tracks, and refreshes a track's direct stream url.
 * <p>
 * Implementations block while the lookup runs. They never throw: a failed lookup is an
 * empty list or a null stream url.
 */
public interface Extractor {

    List<Track> extract(String query, long requesterId, String requesterName);

    List<Track> search(String query, long requesterId, String requesterName, int limit, SearchSource source);

    /**
     * Fetches a fresh direct stream url for the track.
     *
     * @return the url, or null when the track can't be played right now
     */
    String getStreamUrl(Track track);
}
