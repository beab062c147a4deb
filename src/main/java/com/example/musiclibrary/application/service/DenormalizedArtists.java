package com.example.musiclibrary.application.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Display names derived from an ordered artist collection.
 */
public final class DenormalizedArtists {

    public static final String UNKNOWN_ARTIST = "Unknown Artist";

    static final String SEPARATOR = " & ";

    private final String artistName;
    private final String primaryArtistName;

    private DenormalizedArtists(String artistName, String primaryArtistName) {
        this.artistName = artistName;
        this.primaryArtistName = primaryArtistName;
    }

    public static DenormalizedArtists of(List<String> orderedNames) {
        List<String> names = new ArrayList<>();
        if (orderedNames != null) {
            for (String name : orderedNames) {
                if (name != null && !name.trim().isEmpty()) {
                    names.add(name.trim());
                }
            }
        }
        if (names.isEmpty()) {
            return new DenormalizedArtists(UNKNOWN_ARTIST, UNKNOWN_ARTIST);
        }
        return new DenormalizedArtists(String.join(SEPARATOR, names), names.get(0));
    }

    public String getArtistName() {
        return artistName;
    }

    public String getPrimaryArtistName() {
        return primaryArtistName;
    }
}
