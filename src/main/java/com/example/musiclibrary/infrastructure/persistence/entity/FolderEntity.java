package com.example.musiclibrary.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class FolderEntity {

    private Long id;

    private String path;

    private String pathHash;

    private String name;

    private LocalDateTime lastModifiedDate;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
