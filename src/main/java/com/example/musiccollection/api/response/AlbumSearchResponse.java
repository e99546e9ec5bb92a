package com.example.musiccollection.api.response;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class AlbumSearchResponse {

    /** {@code roon} for the library, {@code discogs} for the catalog collection. */
    private String source;
    private Long id;
    private String artist;
    private String albumTitle;
    private String label;
    private String format;
    private Integer year;
    private String thumbUrl;
    private String imageKey;
    private LocalDateTime lastListened;
    private boolean nun;
    private boolean physicalDupe;
    private String physicalTag;
}
