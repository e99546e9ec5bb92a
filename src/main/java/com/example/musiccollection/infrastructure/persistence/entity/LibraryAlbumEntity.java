package com.example.musiccollection.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class LibraryAlbumEntity {

    private Long id;

    private String albumTitle;

    private String artist;

    private String imageKey;

    private String itemKey;

    private String artistNorm;

    private String albumNorm;

    private String matchKey;

    private Boolean isPhysicalDupe;

    private String physicalTag;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
