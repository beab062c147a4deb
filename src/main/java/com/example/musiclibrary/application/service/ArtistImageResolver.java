package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.domain.enumtype.ImageProvenance;
import com.example.musiclibrary.domain.enumtype.ServiceResultStatus;
import com.example.musiclibrary.domain.event.ArtistMetadataUpdatedEvent;
import com.example.musiclibrary.domain.model.ArtistProfile;
import com.example.musiclibrary.domain.model.ServiceResult;
import com.example.musiclibrary.infrastructure.filesystem.FileSystemService;
import com.example.musiclibrary.infrastructure.image.ImageProcessingException;
import com.example.musiclibrary.infrastructure.image.ImageProcessor;
import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.musiclibrary.infrastructure.persistence.mapper.ArtistMapper;
import com.example.musiclibrary.infrastructure.provider.ArtistInfoProvider;
import com.example.musiclibrary.infrastructure.provider.ProviderSessionRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Finds an artist portrait: {@code artist.*} in the artist folder (parent of the album folder), then in the
 * album folder, then from online providers when allowed. User-supplied ({@code .custom.}) and already
 * resolved ({@code .local.}) images are left alone. At most one caller works on a given artist at a time;
 * a concurrent caller for the same artist returns without doing anything.
 */
@Component
public class ArtistImageResolver {

    private static final Logger log = LoggerFactory.getLogger(ArtistImageResolver.class);

    static final String ARTIST_IMAGE_BASENAME = "artist";

    private final FileSystemService fileSystemService;
    private final ImageProcessor imageProcessor;
    private final ContentCache contentCache;
    private final ArtistMapper artistMapper;
    private final ProviderSessionRegistry providerSessionRegistry;
    private final SingleFlightGuard singleFlightGuard;
    private final ApplicationEventPublisher eventPublisher;
    private final AppLibraryProperties appLibraryProperties;

    public ArtistImageResolver(FileSystemService fileSystemService,
                               ImageProcessor imageProcessor,
                               ContentCache contentCache,
                               ArtistMapper artistMapper,
                               ProviderSessionRegistry providerSessionRegistry,
                               SingleFlightGuard singleFlightGuard,
                               ApplicationEventPublisher eventPublisher,
                               AppLibraryProperties appLibraryProperties) {
        this.fileSystemService = fileSystemService;
        this.imageProcessor = imageProcessor;
        this.contentCache = contentCache;
        this.artistMapper = artistMapper;
        this.providerSessionRegistry = providerSessionRegistry;
        this.singleFlightGuard = singleFlightGuard;
        this.eventPublisher = eventPublisher;
        this.appLibraryProperties = appLibraryProperties;
    }

    /**
     * @param artist         the artist row as currently persisted
     * @param sampleSongPath any song credited to the artist
     * @param allowOnline    whether online providers may be asked when no local image exists
     * @return the new cache path, or null when nothing changed or the artist is busy
     */
    public String resolve(ArtistEntity artist, String sampleSongPath, boolean allowOnline) {
        String key = SingleFlightGuard.artistKey(artist.getId());
        if (!singleFlightGuard.tryAcquire(key)) {
            log.debug("ARTIST_IMAGE_BUSY artistId={}", artist.getId());
            return null;
        }
        try {
            reload(artist);
            return doResolve(artist, sampleSongPath, allowOnline);
        } finally {
            singleFlightGuard.release(key);
        }
    }

    private String doResolve(ArtistEntity artist, String sampleSongPath, boolean allowOnline) {
        if (isSettled(artist)) {
            log.debug("ARTIST_IMAGE_SKIP artistId={} path={}", artist.getId(), artist.getLocalImageCachePath());
            return null;
        }
        Path albumDir = sampleSongPath == null ? null : Paths.get(sampleSongPath).getParent();
        boolean online = allowOnline && appLibraryProperties.isOnlineArtistMetadataEnabled()
                && artist.getMetadataLastCheckedUtc() == null;

        FallbackChain<ArtistEntity, ArtistImage> chain = FallbackChain.<ArtistEntity, ArtistImage>named("artist-image")
                .then("artist-folder", a -> findLocalImage(albumDir == null ? null : albumDir.getParent()))
                .then("album-folder", a -> findLocalImage(albumDir))
                .then("online", a -> online ? fetchOnlineImage(a) : Optional.empty());
        Optional<ArtistImage> found = chain.resolve(artist);
        if (!found.isPresent()) {
            return null;
        }
        return store(artist, found.get());
    }

    /**
     * Looks the artist up with the enabled providers in priority order. The first success wins. Not found
     * is only reported when at least one provider said so; otherwise the lookup counts as a temporary error
     * and the artist stays unchecked.
     */
    public ServiceResult<ArtistProfile> fetchOnlineProfile(String artistName) {
        List<ArtistInfoProvider> providers = providerSessionRegistry.enabledArtistProviders();
        boolean answered = false;
        for (ArtistInfoProvider provider : providers) {
            ServiceResult<ArtistProfile> result;
            try {
                result = provider.fetchArtist(artistName);
            } catch (RuntimeException e) {
                log.warn("ARTIST_PROVIDER_FAILED provider={} artist={}", provider.getName(), artistName, e);
                result = ServiceResult.temporaryError(e.getMessage());
            }
            providerSessionRegistry.record(provider.getName(), result);
            if (result == null) {
                continue;
            }
            if (result.isSuccess()) {
                return result;
            }
            if (result.getStatus() == ServiceResultStatus.SUCCESS_NOT_FOUND) {
                answered = true;
            }
        }
        return answered ? ServiceResult.notFound() : ServiceResult.temporaryError("no provider answered");
    }

    /**
     * Caches an online image as {@code {artistId}.fetched.{ext}} unless a custom or local image is in place.
     */
    public String storeFetchedImage(ArtistEntity artist, ArtistProfile profile) {
        if (!profile.hasImage()) {
            return null;
        }
        String key = SingleFlightGuard.artistKey(artist.getId());
        if (!singleFlightGuard.tryAcquire(key)) {
            log.debug("ARTIST_IMAGE_BUSY artistId={}", artist.getId());
            return null;
        }
        try {
            reload(artist);
            if (isSettled(artist)) {
                return null;
            }
            return store(artist, new ArtistImage(profile.getImageBytes(), profile.getImageExtension(),
                    ImageProvenance.FETCHED));
        } finally {
            singleFlightGuard.release(key);
        }
    }

    /**
     * Picks up an image path or check time written by another caller since {@code artist} was read.
     */
    private void reload(ArtistEntity artist) {
        ArtistEntity current = artistMapper.selectById(artist.getId());
        if (current != null) {
            artist.setLocalImageCachePath(current.getLocalImageCachePath());
            artist.setMetadataLastCheckedUtc(current.getMetadataLastCheckedUtc());
        }
    }

    boolean isSettled(ArtistEntity artist) {
        String current = artist.getLocalImageCachePath();
        ImageProvenance provenance = ImageProvenance.fromPath(current);
        if (provenance == ImageProvenance.CUSTOM) {
            return true;
        }
        return provenance == ImageProvenance.LOCAL && fileSystemService.fileExists(Paths.get(current));
    }

    Optional<ArtistImage> findLocalImage(Path directory) throws IOException {
        if (directory == null || !fileSystemService.directoryExists(directory)) {
            return Optional.empty();
        }
        Set<String> imageExtensions = appLibraryProperties.normalizedImageExtensions();
        for (Path file : fileSystemService.listFiles(directory)) {
            String name = file.getFileName().toString();
            int dot = name.lastIndexOf('.');
            if (dot <= 0 || !ARTIST_IMAGE_BASENAME.equals(name.substring(0, dot).toLowerCase(Locale.ROOT))) {
                continue;
            }
            String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
            if (!imageExtensions.contains(extension)) {
                continue;
            }
            byte[] data = fileSystemService.readBytes(file);
            if (data == null || data.length == 0) {
                return Optional.empty();
            }
            return Optional.of(new ArtistImage(data, extension, ImageProvenance.LOCAL));
        }
        return Optional.empty();
    }

    private Optional<ArtistImage> fetchOnlineImage(ArtistEntity artist) {
        ServiceResult<ArtistProfile> result = fetchOnlineProfile(artist.getName());
        if (result.isConclusive()) {
            String biography = result.isSuccess() ? result.getData().getBiography() : null;
            artistMapper.updateMetadataChecked(artist.getId(), biography, nowUtc());
            artist.setMetadataLastCheckedUtc(nowUtc());
        }
        if (!result.isSuccess() || !result.getData().hasImage()) {
            return Optional.empty();
        }
        ArtistProfile profile = result.getData();
        return Optional.of(new ArtistImage(profile.getImageBytes(), profile.getImageExtension(), ImageProvenance.FETCHED));
    }

    private String store(ArtistEntity artist, ArtistImage image) {
        try {
            imageProcessor.extractSwatches(image.data);
            Path cached = contentCache.storeEntityArtifact(artistImageDir(), String.valueOf(artist.getId()),
                    image.provenance, image.data, image.extension);
            String path = cached.toString();
            artistMapper.updateLocalImageCachePath(artist.getId(), path);
            artist.setLocalImageCachePath(path);
            eventPublisher.publishEvent(new ArtistMetadataUpdatedEvent(artist.getId(), path));
            log.info("ARTIST_IMAGE_RESOLVED artistId={} provenance={} path={}",
                    artist.getId(), image.provenance, path);
            return path;
        } catch (ImageProcessingException | IOException e) {
            log.warn("ARTIST_IMAGE_STORE_FAILED artistId={} provenance={} reason={}",
                    artist.getId(), image.provenance, e.getMessage());
            return null;
        }
    }

    Path artistImageDir() {
        return Paths.get(appLibraryProperties.getArtistImageCacheDir());
    }

    private LocalDateTime nowUtc() {
        return LocalDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    }

    static final class ArtistImage {

        final byte[] data;
        final String extension;
        final ImageProvenance provenance;

        ArtistImage(byte[] data, String extension, ImageProvenance provenance) {
            this.data = data;
            this.extension = extension;
            this.provenance = provenance;
        }
    }
}
