package com.example.musiclibrary.application.listener;

import com.example.musiclibrary.domain.event.ArtistMetadataUpdatedEvent;
import com.example.musiclibrary.domain.event.LibraryContentChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class LibraryEventLogListener {

    private static final Logger log = LoggerFactory.getLogger(LibraryEventLogListener.class);

    @EventListener
    public void onLibraryContentChanged(LibraryContentChangedEvent event) {
        log.info("LIBRARY_EVENT type={} folderId={}", event.getChangeType(), event.getFolderId());
    }

    @EventListener
    public void onArtistMetadataUpdated(ArtistMetadataUpdatedEvent event) {
        log.info("ARTIST_EVENT artistId={} imagePath={}", event.getArtistId(), event.getNewLocalImageCachePath());
    }
}
