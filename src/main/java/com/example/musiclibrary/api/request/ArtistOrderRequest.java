package com.example.musiclibrary.api.request;

import java.util.List;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ArtistOrderRequest {

    @NotEmpty
    private List<@NotNull Long> artistIds;
}
