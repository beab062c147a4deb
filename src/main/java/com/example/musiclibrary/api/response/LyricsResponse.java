package com.example.musiclibrary.api.response;

import com.example.musiclibrary.domain.model.LyricLine;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LyricsResponse {

    private Long songId;
    private boolean found;
    private String source;
    private boolean synced;
    private long offsetMs;
    private List<LyricLine> lines;
    /**
     * Raw text, returned when the lyrics carry no timestamps.
     */
    private String plainText;
    /**
     * Line active at the requested position; null when no position was given.
     */
    private Integer activeIndex;
}
