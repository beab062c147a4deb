package com.example.musiclibrary.domain.enumtype;

public enum LyricsSource {

    CACHED_LRC,

    SIDECAR_LRC,

    SIDECAR_TXT,

    ONLINE,

    EMBEDDED
}
