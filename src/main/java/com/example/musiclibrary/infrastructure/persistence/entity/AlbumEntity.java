package com.example.musiclibrary.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class AlbumEntity {

    private Long id;

    private String title;

    private String artistName;

    private String primaryArtistName;

    private Integer year;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
