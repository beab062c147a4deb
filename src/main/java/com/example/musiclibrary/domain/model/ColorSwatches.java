package com.example.musiclibrary.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Representative colours of an image as {@code rrggbb} hex, one for light and one for dark themes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ColorSwatches {

    private String lightSwatch;

    private String darkSwatch;
}
