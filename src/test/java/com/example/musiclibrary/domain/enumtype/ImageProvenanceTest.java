package com.example.musiclibrary.domain.enumtype;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class ImageProvenanceTest {

    @Test
    void fromPathShouldReadMarkerFromFileName() {
        assertEquals(ImageProvenance.CUSTOM, ImageProvenance.fromPath("/cache/artists/7.custom.jpg"));
        assertEquals(ImageProvenance.LOCAL, ImageProvenance.fromPath("/cache/artists/7.LOCAL.png"));
        assertEquals(ImageProvenance.FETCHED, ImageProvenance.fromPath("C:\\cache\\artists\\7.fetched.png"));
    }

    @Test
    void fromPathShouldIgnoreMarkersInDirectoryNames() {
        assertEquals(ImageProvenance.FETCHED, ImageProvenance.fromPath("/data/my.custom.cache/7.fetched.png"));
        assertEquals(ImageProvenance.LOCAL, ImageProvenance.fromPath("C:\\my.custom.cache\\7.local.png"));
        assertNull(ImageProvenance.fromPath("/data/old.local.images/7.png"));
    }

    @Test
    void fromPathShouldReturnNullForMissingOrLegacyNames() {
        assertNull(ImageProvenance.fromPath(null));
        assertNull(ImageProvenance.fromPath("/cache/artists/7.jpg"));
    }
}
