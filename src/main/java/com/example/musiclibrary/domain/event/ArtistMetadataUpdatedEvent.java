package com.example.musiclibrary.domain.event;

public class ArtistMetadataUpdatedEvent {

    private final Long artistId;
    private final String newLocalImageCachePath;

    public ArtistMetadataUpdatedEvent(Long artistId, String newLocalImageCachePath) {
        this.artistId = artistId;
        this.newLocalImageCachePath = newLocalImageCachePath;
    }

    public Long getArtistId() {
        return artistId;
    }

    public String getNewLocalImageCachePath() {
        return newLocalImageCachePath;
    }

    @Override
    public String toString() {
        return "ArtistMetadataUpdatedEvent{artistId=" + artistId + ", path=" + newLocalImageCachePath + "}";
    }
}
