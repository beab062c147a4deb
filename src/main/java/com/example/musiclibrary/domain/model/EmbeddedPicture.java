package com.example.musiclibrary.domain.model;

import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddedPicture {

    private byte[] data;

    private String mimeType;

    public String extension() {
        if (mimeType == null) {
            return "jpg";
        }
        String lower = mimeType.toLowerCase(Locale.ROOT);
        if (lower.contains("png")) {
            return "png";
        }
        if (lower.contains("gif")) {
            return "gif";
        }
        if (lower.contains("bmp")) {
            return "bmp";
        }
        return "jpg";
    }
}
