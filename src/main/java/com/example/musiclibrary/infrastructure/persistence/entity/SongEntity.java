package com.example.musiclibrary.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SongEntity {

    private Long id;

    private Long folderId;

    private String filePath;

    private String filePathHash;

    private String directoryPath;

    private LocalDateTime fileModifiedDate;

    private String title;

    /**
     * Derived from the ordered song_artist rows; written only by the denormalization step.
     */
    private String artistName;

    private String primaryArtistName;

    private Long albumId;

    private Integer trackNo;

    private Integer discNo;

    private Integer year;

    private String genre;

    private Integer durationSec;

    private Integer bitrate;

    private Integer sampleRate;

    private Integer channels;

    private String coverArtUri;

    private String lightSwatch;

    private String darkSwatch;

    private String lyrics;

    private String lrcFilePath;

    private LocalDateTime lyricsLastCheckedUtc;

    private Double replayGainTrackGain;

    private Double replayGainTrackPeak;

    private String extractionError;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
