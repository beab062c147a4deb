package com.example.musiclibrary.infrastructure.provider;

import com.example.musiclibrary.domain.model.ArtistProfile;
import com.example.musiclibrary.domain.model.ServiceResult;

/**
 * Online source of artist biographies and portraits.
 */
public interface ArtistInfoProvider {

    /**
     * Name used in {@code app.library.artist-providers}.
     */
    String getName();

    ServiceResult<ArtistProfile> fetchArtist(String artistName);
}
