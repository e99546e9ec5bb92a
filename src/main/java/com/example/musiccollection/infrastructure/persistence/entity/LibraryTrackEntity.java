package com.example.musiccollection.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class LibraryTrackEntity {

    private Long id;

    private String albumArtist;

    private String album;

    private Integer discNumber;

    private Integer trackNumber;

    private String trackTitle;

    private String trackArtists;

    private String composers;

    private String externalId;

    private String source;

    private Boolean isDuplicate;

    private Boolean isHidden;

    private String tags;

    private LocalDateTime createdAt;
}
