package com.example.musiclibrary.infrastructure.filesystem;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

@Component
public class LocalFileSystemService implements FileSystemService {

    @Override
    public boolean directoryExists(Path directory) {
        return directory != null && Files.isDirectory(directory);
    }

    @Override
    public boolean fileExists(Path file) {
        return file != null && Files.isRegularFile(file);
    }

    @Override
    public List<Path> listFiles(Path directory) throws IOException {
        return list(directory, Files::isRegularFile);
    }

    @Override
    public List<Path> listDirectories(Path directory) throws IOException {
        return list(directory, Files::isDirectory);
    }

    private List<Path> list(Path directory, Predicate<Path> filter) throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.filter(filter)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    @Override
    public byte[] readBytes(Path file) throws IOException {
        return Files.readAllBytes(file);
    }

    @Override
    public String readText(Path file) throws IOException {
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        // strip UTF-8 BOM
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    @Override
    public void writeBytes(Path file, byte[] data) throws IOException {
        Files.write(file, data);
    }

    @Override
    public void writeNewFile(Path file, byte[] data) throws IOException {
        Files.write(file, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    @Override
    public void writeText(Path file, String text) throws IOException {
        Files.write(file, text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public LocalDateTime lastWriteTimeUtc(Path file) throws IOException {
        return LocalDateTime.ofInstant(Files.getLastModifiedTime(file).toInstant(), ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.MILLIS);
    }

    @Override
    public boolean moveWithoutOverwrite(Path source, Path target) throws IOException {
        try {
            Files.move(source, target);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    @Override
    public void createDirectories(Path directory) throws IOException {
        Files.createDirectories(directory);
    }

    @Override
    public boolean deleteIfExists(Path path) throws IOException {
        return Files.deleteIfExists(path);
    }
}
