package com.example.musiccollection.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OverlapAlbumResponse {

    private String matchKey;
    private Long catalogId;
    private Long libraryAlbumId;
    private String artist;
    private String albumTitle;
    private String format;
    private Integer year;
}
