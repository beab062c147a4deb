package com.example.musiclibrary.domain.event;

import com.example.musiclibrary.domain.enumtype.LibraryChangeType;

/**
 * Raised once per logical library operation that committed changes.
 */
public class LibraryContentChangedEvent {

    private final LibraryChangeType changeType;
    private final Long folderId;

    public LibraryContentChangedEvent(LibraryChangeType changeType, Long folderId) {
        this.changeType = changeType;
        this.folderId = folderId;
    }

    public static LibraryContentChangedEvent libraryRescanned() {
        return new LibraryContentChangedEvent(LibraryChangeType.LIBRARY_RESCANNED, null);
    }

    public LibraryChangeType getChangeType() {
        return changeType;
    }

    /**
     * Folder the change applies to; null for library-wide changes.
     */
    public Long getFolderId() {
        return folderId;
    }

    @Override
    public String toString() {
        return "LibraryContentChangedEvent{changeType=" + changeType + ", folderId=" + folderId + "}";
    }
}
