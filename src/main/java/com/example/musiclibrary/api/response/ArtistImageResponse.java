package com.example.musiclibrary.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArtistImageResponse {

    private Long artistId;
    private String localImageCachePath;
    private boolean updated;
}
