package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.domain.model.FolderScanResult;
import com.example.musiclibrary.domain.model.ScannedFile;
import com.example.musiclibrary.infrastructure.filesystem.FileSystemService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FolderScanner {

    private static final Logger log = LoggerFactory.getLogger(FolderScanner.class);

    private static final int MAX_DEPTH = 64;

    private final FileSystemService fileSystemService;
    private final AppLibraryProperties appLibraryProperties;

    public FolderScanner(FileSystemService fileSystemService, AppLibraryProperties appLibraryProperties) {
        this.fileSystemService = fileSystemService;
        this.appLibraryProperties = appLibraryProperties;
    }

    public FolderScanResult scan(Path root) {
        return scan(root, null);
    }

    /**
     * Lists audio files under {@code root} recursively. A directory that cannot be listed is recorded and
     * skipped; its siblings are still visited.
     */
    public FolderScanResult scan(Path root, BooleanSupplier cancelSignal) {
        if (!fileSystemService.directoryExists(root)) {
            log.info("FOLDER_GONE path={}", root);
            return FolderScanResult.gone();
        }
        Set<String> extensions = appLibraryProperties.normalizedAudioExtensions();
        if (extensions.isEmpty()) {
            throw new IllegalStateException("app.library.audio-extensions is empty");
        }

        List<ScannedFile> files = new ArrayList<>();
        List<String> unreadable = new ArrayList<>();
        Deque<Path> pending = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        pending.push(root);
        depths.push(0);
        while (!pending.isEmpty()) {
            if (cancelSignal != null && cancelSignal.getAsBoolean()) {
                break;
            }
            Path directory = pending.pop();
            int depth = depths.pop();
            try {
                for (Path file : fileSystemService.listFiles(directory)) {
                    String extension = extensionOf(file);
                    if (extension == null || !extensions.contains(extension)) {
                        continue;
                    }
                    try {
                        files.add(new ScannedFile(file.toString(), extension, fileSystemService.lastWriteTimeUtc(file)));
                    } catch (IOException e) {
                        unreadable.add(file.toString());
                        log.warn("SCAN_FILE_UNREADABLE path={} reason={}", file, e.getMessage());
                    }
                }
                if (depth < MAX_DEPTH) {
                    List<Path> children = fileSystemService.listDirectories(directory);
                    for (int i = children.size() - 1; i >= 0; i--) {
                        pending.push(children.get(i));
                        depths.push(depth + 1);
                    }
                } else {
                    log.warn("SCAN_DEPTH_LIMIT path={} depth={}", directory, depth);
                }
            } catch (IOException | RuntimeException e) {
                unreadable.add(directory.toString());
                log.warn("SCAN_DIRECTORY_UNREADABLE path={} reason={}", directory, e.getMessage());
            }
        }
        log.debug("FOLDER_SCANNED path={} audioFiles={} unreadable={}", root, files.size(), unreadable.size());
        return FolderScanResult.of(files, unreadable);
    }

    static String extensionOf(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot >= name.length() - 1) {
            return null;
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
