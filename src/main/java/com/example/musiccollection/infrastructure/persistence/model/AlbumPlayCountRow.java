package com.example.musiccollection.infrastructure.persistence.model;

import lombok.Data;

@Data
public class AlbumPlayCountRow {

    private String artist;

    private String album;

    private long playCount;
}
