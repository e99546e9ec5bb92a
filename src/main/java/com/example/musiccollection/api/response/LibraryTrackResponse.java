package com.example.musiccollection.api.response;

import lombok.Data;

@Data
public class LibraryTrackResponse {

    private Long id;
    private Integer discNumber;
    private Integer trackNumber;
    private String trackTitle;
    private String trackArtists;
    private String album;
    private String albumArtist;
    private String composers;
    private String source;
}
