package com.example.musiclibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musiclibrary.domain.model.ScannedFile;
import com.example.musiclibrary.infrastructure.persistence.model.SongFileStateRow;
import java.io.File;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class FolderDiffTest {

    private static final LocalDateTime T1 = LocalDateTime.of(2024, 3, 1, 10, 0, 0);
    private static final LocalDateTime T2 = T1.plusSeconds(30);
    private static final String ROOT = File.separator + "music";

    @Test
    void filesShouldBeClassifiedByPathAndLastWriteTime() {
        FolderDiff diff = FolderDiff.compute(
                Arrays.asList(file("a.flac", T1), file("b.flac", T2), file("c.flac", T1)),
                Arrays.asList(row(1L, "a.flac", T1), row(2L, "b.flac", T1), row(3L, "d.flac", T1)),
                Collections.emptyList());

        assertEquals(1, diff.getAdded().size());
        assertEquals(path("c.flac"), diff.getAdded().get(0).getPath());
        assertEquals(1, diff.getModified().size());
        assertEquals(2L, diff.getModified().get(0).getExisting().getId());
        assertEquals(T2, diff.getModified().get(0).getFile().getLastModified());
        assertEquals(1, diff.getDeleted().size());
        assertEquals(3L, diff.getDeleted().get(0).getId());
        assertEquals(1, diff.getUnchanged());
    }

    @Test
    void identicalStateShouldGiveEmptyDiff() {
        FolderDiff diff = FolderDiff.compute(
                Collections.singletonList(file("a.flac", T1)),
                Collections.singletonList(row(1L, "a.flac", T1)),
                null);

        assertTrue(diff.isEmpty());
        assertEquals(1, diff.getUnchanged());
    }

    @Test
    void pathComparisonShouldBeCaseSensitive() {
        FolderDiff diff = FolderDiff.compute(
                Collections.singletonList(file("A.flac", T1)),
                Collections.singletonList(row(1L, "a.flac", T1)),
                Collections.emptyList());

        assertEquals(1, diff.getAdded().size());
        assertEquals(1, diff.getDeleted().size());
    }

    @Test
    void songsBelowUnreadablePathsShouldNeverBeReportedDeleted() {
        FolderDiff diff = FolderDiff.compute(
                Collections.emptyList(),
                Arrays.asList(row(1L, "locked" + File.separator + "a.flac", T1),
                        row(2L, "locked-not" + File.separator + "b.flac", T1),
                        row(3L, "broken.flac", T1)),
                Arrays.asList(path("locked"), path("broken.flac")));

        assertEquals(1, diff.getDeleted().size());
        assertEquals(2L, diff.getDeleted().get(0).getId());
    }

    private static String path(String relative) {
        return ROOT + File.separator + relative;
    }

    private static ScannedFile file(String relative, LocalDateTime lastModified) {
        return new ScannedFile(path(relative), "flac", lastModified);
    }

    private static SongFileStateRow row(Long id, String relative, LocalDateTime modified) {
        SongFileStateRow row = new SongFileStateRow();
        row.setId(id);
        row.setFilePath(path(relative));
        row.setFileModifiedDate(modified);
        return row;
    }
}
