package com.example.musiclibrary.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ArtistEntity {

    private Long id;

    private String name;

    private String biography;

    /**
     * Cached portrait; the {@code .custom.}/{@code .local.}/{@code .fetched.} part of the name records its origin.
     */
    private String localImageCachePath;

    private LocalDateTime metadataLastCheckedUtc;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
