package com.example.musiccollection.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatalogTrackResponse {

    private Long id;
    private String position;
    private String trackTitle;
    private String duration;
    private String trackArtists;
    private String extraArtists;
}
