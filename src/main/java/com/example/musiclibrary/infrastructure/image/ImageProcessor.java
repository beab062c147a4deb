package com.example.musiclibrary.infrastructure.image;

import com.example.musiclibrary.domain.model.ColorSwatches;

public interface ImageProcessor {

    /**
     * Decodes an image and derives its light/dark theme swatches.
     *
     * @throws ImageProcessingException when the bytes are not a decodable image
     */
    ColorSwatches extractSwatches(byte[] imageBytes) throws ImageProcessingException;
}
