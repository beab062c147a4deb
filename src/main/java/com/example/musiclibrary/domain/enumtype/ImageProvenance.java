package com.example.musiclibrary.domain.enumtype;

import java.util.Locale;

/**
 * Origin of a cached image, encoded in its file name as {@code {key}.{suffix}.{ext}}.
 */
public enum ImageProvenance {

    /** Supplied by the user; automated resolvers never replace it. */
    CUSTOM("custom"),

    /** Found next to the audio files on disk. */
    LOCAL("local"),

    /** Downloaded from an online provider, or content-addressed. */
    FETCHED("fetched");

    private final String suffix;

    ImageProvenance(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public String marker() {
        return "." + suffix + ".";
    }

    /**
     * Returns the provenance encoded in the file name of a cache path, or null for legacy and unknown names.
     * Directory names are ignored.
     */
    public static ImageProvenance fromPath(String path) {
        if (path == null) {
            return null;
        }
        int separator = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String lower = path.substring(separator + 1).toLowerCase(Locale.ROOT);
        for (ImageProvenance provenance : values()) {
            if (lower.contains(provenance.marker())) {
                return provenance;
            }
        }
        return null;
    }
}
