package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.domain.model.ColorSwatches;
import com.example.musiclibrary.domain.model.EmbeddedPicture;
import com.example.musiclibrary.domain.model.ResolvedArtwork;
import com.example.musiclibrary.infrastructure.filesystem.FileSystemService;
import com.example.musiclibrary.infrastructure.image.ImageProcessingException;
import com.example.musiclibrary.infrastructure.image.ImageProcessor;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves a song's cover: a well-known image next to the audio file first, the first embedded picture
 * otherwise. The chosen bytes land in the content-addressed cover cache.
 */
@Component
public class ArtworkResolver {

    private static final Logger log = LoggerFactory.getLogger(ArtworkResolver.class);

    /**
     * Cover base names, highest priority first.
     */
    static final List<String> COVER_BASENAMES = Arrays.asList("cover", "folder", "front", "album");

    private final FileSystemService fileSystemService;
    private final ImageProcessor imageProcessor;
    private final ContentCache contentCache;
    private final AppLibraryProperties appLibraryProperties;

    public ArtworkResolver(FileSystemService fileSystemService,
                           ImageProcessor imageProcessor,
                           ContentCache contentCache,
                           AppLibraryProperties appLibraryProperties) {
        this.fileSystemService = fileSystemService;
        this.imageProcessor = imageProcessor;
        this.contentCache = contentCache;
        this.appLibraryProperties = appLibraryProperties;
    }

    /**
     * @param audioFile       the song on disk
     * @param embeddedPicture called only when the directory has no cover image
     * @return the cached cover, or null when nothing was found or the image could not be processed
     */
    public ResolvedArtwork resolve(Path audioFile, Supplier<EmbeddedPicture> embeddedPicture) {
        FallbackChain<Path, ImageCandidate> chain = FallbackChain.<Path, ImageCandidate>named("artwork")
                .then("directory", file -> findDirectoryArt(file.getParent()))
                .then("embedded", file -> Optional.ofNullable(embeddedPicture.get())
                        .filter(picture -> picture.getData() != null && picture.getData().length > 0)
                        .map(picture -> new ImageCandidate(picture.getData(), picture.extension(), false)));
        Optional<ImageCandidate> candidate = chain.resolve(audioFile);
        if (!candidate.isPresent()) {
            log.debug("ARTWORK_NOT_FOUND path={}", audioFile);
            return null;
        }

        ImageCandidate image = candidate.get();
        try {
            ColorSwatches swatches = imageProcessor.extractSwatches(image.data);
            Path cached = contentCache.storeContentAddressed(coverCacheDir(), image.data, image.extension);
            return new ResolvedArtwork(cached.toString(), swatches.getLightSwatch(), swatches.getDarkSwatch(),
                    image.fromDirectory);
        } catch (ImageProcessingException | IOException e) {
            log.warn("ARTWORK_PROCESS_FAILED path={} fromDirectory={} reason={}",
                    audioFile, image.fromDirectory, e.getMessage());
            return null;
        }
    }

    /**
     * Picks the highest-priority cover image in {@code directory}, independent of listing order. Listing
     * failures count as no image.
     */
    Optional<ImageCandidate> findDirectoryArt(Path directory) {
        if (directory == null) {
            return Optional.empty();
        }
        List<Path> files;
        try {
            files = fileSystemService.listFiles(directory);
        } catch (IOException | RuntimeException e) {
            log.debug("ARTWORK_LIST_FAILED dir={} reason={}", directory, e.getMessage());
            return Optional.empty();
        }
        Set<String> imageExtensions = appLibraryProperties.normalizedImageExtensions();
        Path best = null;
        int bestRank = Integer.MAX_VALUE;
        for (Path file : files) {
            String name = file.getFileName().toString();
            int dot = name.lastIndexOf('.');
            if (dot <= 0) {
                continue;
            }
            String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
            if (!imageExtensions.contains(extension)) {
                continue;
            }
            int rank = COVER_BASENAMES.indexOf(name.substring(0, dot).toLowerCase(Locale.ROOT));
            if (rank >= 0 && rank < bestRank) {
                best = file;
                bestRank = rank;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        try {
            byte[] data = fileSystemService.readBytes(best);
            if (data == null || data.length == 0) {
                log.debug("ARTWORK_EMPTY path={}", best);
                return Optional.empty();
            }
            return Optional.of(new ImageCandidate(data, FolderScanner.extensionOf(best), true));
        } catch (IOException e) {
            log.debug("ARTWORK_READ_FAILED path={} reason={}", best, e.getMessage());
            return Optional.empty();
        }
    }

    Path coverCacheDir() {
        return Paths.get(appLibraryProperties.getCoverArtCacheDir());
    }

    static final class ImageCandidate {

        final byte[] data;
        final String extension;
        final boolean fromDirectory;

        ImageCandidate(byte[] data, String extension, boolean fromDirectory) {
            this.data = data;
            this.extension = extension;
            this.fromDirectory = fromDirectory;
        }
    }
}
