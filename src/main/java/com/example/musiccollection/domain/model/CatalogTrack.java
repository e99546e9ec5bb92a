package com.example.musiccollection.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatalogTrack {

    private String position;

    private String title;

    private String duration;

    private String artists;

    private String extraArtists;
}
