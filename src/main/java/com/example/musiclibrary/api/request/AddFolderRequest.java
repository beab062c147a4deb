package com.example.musiclibrary.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class AddFolderRequest {

    @NotBlank
    @Size(max = 1024)
    private String path;

    @Size(max = 255)
    private String name;

    private Boolean scanNow = Boolean.TRUE;
}
