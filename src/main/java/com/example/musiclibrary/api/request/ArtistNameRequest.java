package com.example.musiclibrary.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class ArtistNameRequest {

    @NotBlank
    @Size(max = 255)
    private String name;
}
