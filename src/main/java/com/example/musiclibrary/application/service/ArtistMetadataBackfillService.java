package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.domain.model.ArtistProfile;
import com.example.musiclibrary.domain.model.ServiceResult;
import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.musiclibrary.infrastructure.persistence.mapper.ArtistMapper;
import com.example.musiclibrary.infrastructure.provider.ProviderSessionRegistry;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Background pass that asks online providers about every artist never checked before.
 */
@Service
public class ArtistMetadataBackfillService {

    private static final Logger log = LoggerFactory.getLogger(ArtistMetadataBackfillService.class);

    static final String BACKFILL_KEY = "artist-metadata-backfill";

    private final ArtistMapper artistMapper;
    private final ArtistImageResolver artistImageResolver;
    private final ProviderSessionRegistry providerSessionRegistry;
    private final SingleFlightGuard singleFlightGuard;
    private final ExecutorService libraryTaskExecutor;
    private final AppLibraryProperties appLibraryProperties;

    public ArtistMetadataBackfillService(ArtistMapper artistMapper,
                                         ArtistImageResolver artistImageResolver,
                                         ProviderSessionRegistry providerSessionRegistry,
                                         SingleFlightGuard singleFlightGuard,
                                         @Qualifier("libraryTaskExecutor") ExecutorService libraryTaskExecutor,
                                         AppLibraryProperties appLibraryProperties) {
        this.artistMapper = artistMapper;
        this.artistImageResolver = artistImageResolver;
        this.providerSessionRegistry = providerSessionRegistry;
        this.singleFlightGuard = singleFlightGuard;
        this.libraryTaskExecutor = libraryTaskExecutor;
        this.appLibraryProperties = appLibraryProperties;
    }

    /**
     * Starts the backfill in the background.
     *
     * @return false when online metadata is disabled, no provider is enabled, or a backfill is already running
     */
    public boolean startBackfill() {
        if (!appLibraryProperties.isOnlineArtistMetadataEnabled()
                || providerSessionRegistry.enabledArtistProviders().isEmpty()) {
            log.debug("ARTIST_BACKFILL_SKIPPED reason=disabled");
            return false;
        }
        if (!singleFlightGuard.tryAcquire(BACKFILL_KEY)) {
            log.info("ARTIST_BACKFILL_SKIPPED reason=in-flight");
            return false;
        }
        try {
            libraryTaskExecutor.submit(() -> {
                try {
                    runBackfill();
                } catch (Exception e) {
                    log.error("ARTIST_BACKFILL_FAILED", e);
                } finally {
                    singleFlightGuard.release(BACKFILL_KEY);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            singleFlightGuard.release(BACKFILL_KEY);
            throw e;
        }
    }

    /**
     * One pass over unchecked artists in id order. Artists whose lookup failed temporarily stay unchecked
     * and are picked up by the next pass.
     */
    BackfillStats runBackfill() {
        BackfillStats stats = new BackfillStats();
        int batchSize = Math.max(1, appLibraryProperties.getArtistBackfillBatchSize());
        long afterId = 0L;
        log.info("ARTIST_BACKFILL_START batchSize={}", batchSize);
        while (true) {
            List<ArtistEntity> batch = artistMapper.selectPendingMetadata(afterId, batchSize);
            if (batch == null || batch.isEmpty()) {
                break;
            }
            for (ArtistEntity artist : batch) {
                afterId = Math.max(afterId, artist.getId());
                if (providerSessionRegistry.enabledArtistProviders().isEmpty()) {
                    log.info("ARTIST_BACKFILL_STOP reason=no-provider-left checked={}", stats.checked);
                    return stats;
                }
                try {
                    backfillArtist(artist, stats);
                } catch (Exception e) {
                    stats.failed++;
                    log.warn("ARTIST_BACKFILL_ITEM_FAILED artistId={} name={}", artist.getId(), artist.getName(), e);
                }
            }
        }
        log.info("ARTIST_BACKFILL_FINISH checked={} images={} retryLater={} failed={}",
                stats.checked, stats.images, stats.retryLater, stats.failed);
        return stats;
    }

    private void backfillArtist(ArtistEntity artist, BackfillStats stats) {
        ServiceResult<ArtistProfile> result = artistImageResolver.fetchOnlineProfile(artist.getName());
        if (!result.isConclusive()) {
            stats.retryLater++;
            return;
        }
        String biography = result.isSuccess() ? result.getData().getBiography() : null;
        artistMapper.updateMetadataChecked(artist.getId(), biography,
                LocalDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS));
        stats.checked++;
        if (result.isSuccess() && artistImageResolver.storeFetchedImage(artist, result.getData()) != null) {
            stats.images++;
        }
    }

    static class BackfillStats {

        int checked;
        int images;
        int retryLater;
        int failed;
    }
}
