package com.example.musiclibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.domain.model.FolderScanResult;
import com.example.musiclibrary.domain.model.ScannedFile;
import com.example.musiclibrary.infrastructure.filesystem.LocalFileSystemService;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FolderScannerTest {

    @TempDir
    Path root;

    private LocalFileSystemService fileSystemService;
    private AppLibraryProperties properties;
    private FolderScanner scanner;

    @BeforeEach
    void setUp() {
        fileSystemService = spy(new LocalFileSystemService());
        properties = new AppLibraryProperties();
        scanner = new FolderScanner(fileSystemService, properties);
    }

    @Test
    void scanShouldFindAudioFilesInNestedDirectories() throws IOException {
        touch(root.resolve("01.mp3"));
        touch(root.resolve("Artist/Album/02.FLAC"));
        touch(root.resolve("Artist/Album/cover.jpg"));
        touch(root.resolve("Artist/Album/notes"));
        touch(root.resolve("Other/03.m4a"));

        FolderScanResult result = scanner.scan(root);

        assertFalse(result.isFolderGone());
        assertEquals(Collections.emptyList(), result.getUnreadablePaths());
        List<String> names = result.getFiles().stream()
                .map(f -> Paths.get(f.getPath()).getFileName().toString())
                .sorted()
                .collect(Collectors.toList());
        assertEquals(Arrays.asList("01.mp3", "02.FLAC", "03.m4a"), names);
        ScannedFile flac = result.getFiles().stream()
                .filter(f -> f.getPath().endsWith("02.FLAC"))
                .findFirst()
                .orElseThrow(IllegalStateException::new);
        assertEquals("flac", flac.getExtension());
        assertEquals(fileSystemService.lastWriteTimeUtc(Paths.get(flac.getPath())), flac.getLastModified());
    }

    @Test
    void missingRootShouldBeReportedAsGone() {
        FolderScanResult result = scanner.scan(root.resolve("unmounted"));

        assertTrue(result.isFolderGone());
        assertTrue(result.getFiles().isEmpty());
    }

    @Test
    void unreadableDirectoryShouldBeRecordedAndSiblingsStillScanned() throws IOException {
        touch(root.resolve("Locked/01.mp3"));
        touch(root.resolve("Open/02.mp3"));
        Path locked = root.resolve("Locked");
        doThrow(new AccessDeniedException(locked.toString())).when(fileSystemService).listFiles(locked);

        FolderScanResult result = scanner.scan(root);

        assertEquals(Collections.singletonList(locked.toString()), result.getUnreadablePaths());
        assertEquals(1, result.getFiles().size());
        assertTrue(result.getFiles().get(0).getPath().endsWith("02.mp3"));
    }

    @Test
    void cancelledScanShouldStopWalking() throws IOException {
        touch(root.resolve("A/01.mp3"));

        FolderScanResult result = scanner.scan(root, () -> true);

        assertFalse(result.isFolderGone());
        assertTrue(result.getFiles().isEmpty());
    }

    @Test
    void emptyExtensionListShouldBeRejected() {
        properties.setAudioExtensions(Collections.emptyList());

        assertThrows(IllegalStateException.class, () -> scanner.scan(root));
    }

    @Test
    void extensionOfShouldIgnoreDotFilesWithoutSuffix() {
        assertEquals("mp3", FolderScanner.extensionOf(Paths.get("a/b.MP3")));
        assertNull(FolderScanner.extensionOf(Paths.get("a/noext")));
        assertNull(FolderScanner.extensionOf(Paths.get("a/trailing.")));
    }

    private static void touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[]{0});
    }
}
