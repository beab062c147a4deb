package com.example.musiclibrary.domain.enumtype;

public enum ExtractionFailureReason {

    CORRUPT_FILE("CorruptFile"),

    UNSUPPORTED_FORMAT("UnsupportedFormat");

    private final String code;

    ExtractionFailureReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
