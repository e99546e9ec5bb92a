package com.example.musiccollection.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class CatalogTrackEntity {

    private Long id;

    private Long collectionId;

    private Long releaseId;

    private String position;

    private String trackTitle;

    private String duration;

    private String trackArtists;

    private String extraArtists;
}
