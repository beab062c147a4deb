package com.example.musiclibrary.infrastructure.provider;

import com.example.musiclibrary.domain.model.LyricsQuery;
import com.example.musiclibrary.domain.model.ServiceResult;

/**
 * Online lyrics source. Implementations own their HTTP client and map every failure into a
 * {@link ServiceResult} status instead of throwing.
 */
public interface LyricsProvider {

    /**
     * Name used in {@code app.library.lyrics-providers}.
     */
    String getName();

    /**
     * Returns LRC or plain lyrics text for the query.
     */
    ServiceResult<String> searchLyrics(LyricsQuery query);
}
