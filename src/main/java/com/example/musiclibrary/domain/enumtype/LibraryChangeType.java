package com.example.musiclibrary.domain.enumtype;

public enum LibraryChangeType {

    FOLDER_ADDED,

    FOLDER_REMOVED,

    FOLDER_RESCANNED,

    LIBRARY_RESCANNED
}
