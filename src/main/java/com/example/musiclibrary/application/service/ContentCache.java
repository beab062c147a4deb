package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.util.HashUtil;
import com.example.musiclibrary.domain.enumtype.ImageProvenance;
import com.example.musiclibrary.infrastructure.filesystem.FileSystemService;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * File cache for derived artifacts. Two naming schemes:
 * <ul>
 *     <li>content-addressed: {@code {sha256}.fetched.{ext}}, identical bytes always share one file;</li>
 *     <li>per entity: {@code {entityId}.{custom|local|fetched}.{ext}}.</li>
 * </ul>
 * Every write goes to {@code target + ".tmp"} first and is then moved into place without overwriting, so
 * readers never see a half-written file.
 */
@Component
public class ContentCache {

    private static final Logger log = LoggerFactory.getLogger(ContentCache.class);

    private static final String TMP_SUFFIX = ".tmp";

    private final FileSystemService fileSystemService;
    private final MeterRegistry meterRegistry;

    public ContentCache(FileSystemService fileSystemService, ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.fileSystemService = fileSystemService;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public Path contentAddressedPath(Path cacheDir, byte[] data, String extension) {
        String fileName = HashUtil.sha256Hex(data) + ImageProvenance.FETCHED.marker() + normalizeExtension(extension);
        return cacheDir.resolve(fileName);
    }

    /**
     * Stores {@code data} under its content hash, skipping the write when the file is already there.
     */
    public Path storeContentAddressed(Path cacheDir, byte[] data, String extension) throws IOException {
        requireData(data);
        Path target = contentAddressedPath(cacheDir, data, extension);
        if (fileSystemService.fileExists(target)) {
            incrementCounter("music.library.cache.store", "result", "hit");
            return target;
        }
        fileSystemService.createDirectories(cacheDir);
        // identical bytes map to one name, so a writer that loses the race still has the right file
        writeAtomically(target, data);
        incrementCounter("music.library.cache.store", "result", "write");
        return target;
    }

    public Path entityArtifactPath(Path cacheDir, String entityKey, ImageProvenance provenance, String extension) {
        return cacheDir.resolve(entityKey + provenance.marker() + normalizeExtension(extension));
    }

    /**
     * Stores a per-entity artifact, replacing every earlier artifact of the same entity. A {@code .custom.}
     * file is only replaced by another custom one.
     */
    public Path storeEntityArtifact(Path cacheDir,
                                    String entityKey,
                                    ImageProvenance provenance,
                                    byte[] data,
                                    String extension) throws IOException {
        requireData(data);
        fileSystemService.createDirectories(cacheDir);
        Path target = entityArtifactPath(cacheDir, entityKey, provenance, extension);
        deleteVariants(cacheDir, entityKey, provenance);
        if (!writeAtomically(target, data)) {
            log.warn("CACHE_ENTITY_WRITE_RACE target={}", target);
        }
        incrementCounter("music.library.cache.store", "result", "entity");
        return target;
    }

    /**
     * Deletes {@code path} if it lies inside {@code cacheDir}; anything outside the cache is never touched.
     */
    public boolean deleteIfInside(Path cacheDir, String path) {
        if (path == null || path.trim().isEmpty()) {
            return false;
        }
        Path candidate = Paths.get(path).toAbsolutePath().normalize();
        if (!candidate.startsWith(cacheDir.toAbsolutePath().normalize())) {
            return false;
        }
        try {
            return fileSystemService.deleteIfExists(candidate);
        } catch (IOException e) {
            log.warn("CACHE_DELETE_FAILED path={}", candidate, e);
            return false;
        }
    }

    /**
     * @return false when another writer placed the target first
     */
    boolean writeAtomically(Path target, byte[] data) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
        try {
            fileSystemService.writeNewFile(tmp, data);
        } catch (FileAlreadyExistsException e) {
            // another writer (or a crashed one) owns the plain temp name
            tmp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + TMP_SUFFIX);
            fileSystemService.writeNewFile(tmp, data);
        }
        boolean moved = false;
        try {
            moved = fileSystemService.moveWithoutOverwrite(tmp, target);
            return moved;
        } finally {
            if (!moved) {
                deleteQuietly(tmp);
            }
        }
    }

    private void deleteVariants(Path cacheDir, String entityKey, ImageProvenance incoming) throws IOException {
        List<Path> existing = fileSystemService.listFiles(cacheDir);
        String lowerPrefix = entityKey.toLowerCase(Locale.ROOT) + ".";
        for (Path path : existing) {
            String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
            if (!name.startsWith(lowerPrefix) || name.endsWith(TMP_SUFFIX)) {
                continue;
            }
            if (incoming != ImageProvenance.CUSTOM && ImageProvenance.fromPath(name) == ImageProvenance.CUSTOM) {
                continue;
            }
            fileSystemService.deleteIfExists(path);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            fileSystemService.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Temp file delete failed: {}", path, e);
        }
    }

    private void requireData(byte[] data) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Artifact data is empty");
        }
    }

    static String normalizeExtension(String extension) {
        if (extension == null || extension.trim().isEmpty()) {
            return "bin";
        }
        return extension.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", "");
    }

    private void incrementCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }
}
