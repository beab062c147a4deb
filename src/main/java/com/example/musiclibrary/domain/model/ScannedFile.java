package com.example.musiclibrary.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScannedFile {

    private String path;

    private String extension;

    /**
     * Last write time in UTC, truncated to milliseconds.
     */
    private LocalDateTime lastModified;
}
