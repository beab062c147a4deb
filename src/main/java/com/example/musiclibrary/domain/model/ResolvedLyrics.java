package com.example.musiclibrary.domain.model;

import com.example.musiclibrary.domain.enumtype.LyricsSource;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedLyrics {

    private LyricsSource source;

    /**
     * File the lyrics were read from or cached to; null for embedded lyrics.
     */
    private String path;

    private String content;

    private ParsedLrc parsed;

    public boolean isSynced() {
        return parsed != null && !parsed.isEmpty();
    }
}
