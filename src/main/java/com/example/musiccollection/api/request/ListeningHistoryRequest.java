package com.example.musiccollection.api.request;

import java.time.LocalDateTime;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class ListeningHistoryRequest {

    @NotBlank(message = "artist is required")
    @Size(max = 300)
    private String artist;

    @NotBlank(message = "album is required")
    @Size(max = 500)
    private String album;

    @NotNull(message = "source is required")
    @Pattern(regexp = "roon|discogs|both", message = "source must be roon, discogs, or both")
    private String source;

    private LocalDateTime listenedAt;

    @Size(max = 100)
    private String format;

    private String notes;

    private Long discogsCollectionId;

    private Long roonAlbumId;
}
