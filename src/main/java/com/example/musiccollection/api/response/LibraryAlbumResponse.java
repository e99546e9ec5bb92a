package com.example.musiccollection.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LibraryAlbumResponse {

    private Long id;
    private String artist;
    private String albumTitle;
    private String imageKey;
    private boolean physicalDupe;
    private String physicalTag;
}
