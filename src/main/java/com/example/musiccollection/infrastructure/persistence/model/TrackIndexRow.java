package com.example.musiccollection.infrastructure.persistence.model;

import lombok.Data;

@Data
public class TrackIndexRow {

    private Long id;

    private String trackTitle;

    private String album;

    private String artist;

    private String source;
}
