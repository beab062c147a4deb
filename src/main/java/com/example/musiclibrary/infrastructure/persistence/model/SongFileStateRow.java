package com.example.musiclibrary.infrastructure.persistence.model;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SongFileStateRow {

    private Long id;

    private String filePath;

    private LocalDateTime fileModifiedDate;

    private String coverArtUri;

    private String lrcFilePath;
}
