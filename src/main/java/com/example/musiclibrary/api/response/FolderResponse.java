package com.example.musiclibrary.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FolderResponse {

    private Long id;
    private String path;
    private String name;
    private LocalDateTime lastModifiedDate;
    private boolean scanning;
}
