package com.example.musiccollection.infrastructure.persistence.model;

import lombok.Data;

@Data
public class OverlapAlbumRow {

    private String matchKey;

    private Long catalogId;

    private Long libraryAlbumId;

    private String artist;

    private String albumTitle;

    private String format;

    private Integer year;
}
