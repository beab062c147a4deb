package com.example.musiclibrary.domain.model;

import com.example.musiclibrary.domain.enumtype.ExtractionFailureReason;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class AudioMetadata {

    private String title;

    private List<String> artists = new ArrayList<>();

    private List<String> albumArtists = new ArrayList<>();

    private String album;

    private Integer trackNo;

    private Integer discNo;

    private Integer year;

    private List<String> genres = new ArrayList<>();

    private Integer durationSec;

    private Integer bitrate;

    private Integer sampleRate;

    private Integer channels;

    private List<EmbeddedPicture> embeddedPictures = new ArrayList<>();

    private String lyrics;

    private Double replayGainTrackGain;

    private Double replayGainTrackPeak;

    /**
     * Set when the tags could not be read and the fields above are a best-effort fallback.
     */
    private ExtractionFailureReason failureReason;

    public EmbeddedPicture firstPicture() {
        return embeddedPictures == null || embeddedPictures.isEmpty() ? null : embeddedPictures.get(0);
    }
}
