package com.example.musiclibrary.infrastructure.image;

public class ImageProcessingException extends Exception {

    public ImageProcessingException(String message) {
        super(message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
