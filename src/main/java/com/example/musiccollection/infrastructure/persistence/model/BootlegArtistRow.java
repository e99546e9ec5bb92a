package com.example.musiccollection.infrastructure.persistence.model;

import lombok.Data;

@Data
public class BootlegArtistRow {

    private String artist;

    private long showCount;
}
