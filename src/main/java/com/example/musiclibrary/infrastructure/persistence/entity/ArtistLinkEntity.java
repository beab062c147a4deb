package com.example.musiclibrary.infrastructure.persistence.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of song_artist or album_artist. {@code parentId} is the song or album id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArtistLinkEntity {

    private Long id;

    private Long parentId;

    private Long artistId;

    private Integer sortOrder;
}
