package com.example.musiclibrary.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Artist metadata as returned by an online provider.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArtistProfile {

    private String biography;

    private byte[] imageBytes;

    private String imageExtension;

    public boolean hasImage() {
        return imageBytes != null && imageBytes.length > 0;
    }
}
