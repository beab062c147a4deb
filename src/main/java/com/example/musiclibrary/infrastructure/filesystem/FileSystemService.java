package com.example.musiclibrary.infrastructure.filesystem;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Filesystem operations used by the scanner, the resolvers and the artifact cache.
 */
public interface FileSystemService {

    boolean directoryExists(Path directory);

    boolean fileExists(Path file);

    /**
     * Regular files directly inside {@code directory}, sorted by file name.
     */
    List<Path> listFiles(Path directory) throws IOException;

    /**
     * Subdirectories directly inside {@code directory}, sorted by name.
     */
    List<Path> listDirectories(Path directory) throws IOException;

    byte[] readBytes(Path file) throws IOException;

    String readText(Path file) throws IOException;

    void writeBytes(Path file, byte[] data) throws IOException;

    /**
     * Creates {@code file} and writes {@code data}; fails with {@link java.nio.file.FileAlreadyExistsException}
     * if it exists.
     */
    void writeNewFile(Path file, byte[] data) throws IOException;

    void writeText(Path file, String text) throws IOException;

    /**
     * Last write time in UTC, truncated to milliseconds.
     */
    LocalDateTime lastWriteTimeUtc(Path file) throws IOException;

    /**
     * Moves {@code source} to {@code target} unless the target exists.
     *
     * @return false when the target already existed; the source is left in place
     */
    boolean moveWithoutOverwrite(Path source, Path target) throws IOException;

    void createDirectories(Path directory) throws IOException;

    boolean deleteIfExists(Path path) throws IOException;
}
